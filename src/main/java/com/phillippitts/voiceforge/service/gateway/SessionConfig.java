package com.phillippitts.voiceforge.service.gateway;

import org.json.JSONObject;

/**
 * Per-session options taken from the {@code init} frame.
 *
 * @param conversationId key for loading and saving context, or null for an ephemeral session
 * @param ttsEnabled     whether replies are synthesized; false makes a text-only session
 * @param voice          voice id passed to synthesis, or null for the backend default
 * @param language       language hint passed to transcription, or null
 * @param systemPrompt   instructions passed to reply generation, or null
 * @param sampleRate     sample rate of client audio
 */
public record SessionConfig(
        String conversationId,
        boolean ttsEnabled,
        String voice,
        String language,
        String systemPrompt,
        int sampleRate
) {

    public SessionConfig {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
    }

    public static SessionConfig fromJson(JSONObject json, int defaultSampleRate) {
        return new SessionConfig(
                blankToNull(json.optString("conversationId", null)),
                json.optBoolean("tts", true),
                blankToNull(json.optString("voice", null)),
                blankToNull(json.optString("language", null)),
                blankToNull(json.optString("systemPrompt", null)),
                json.optInt("sampleRate", defaultSampleRate));
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
