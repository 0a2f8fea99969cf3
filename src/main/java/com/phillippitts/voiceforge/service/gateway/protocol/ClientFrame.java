package com.phillippitts.voiceforge.service.gateway.protocol;

import org.json.JSONObject;

import java.util.Objects;

/**
 * Decoded client frame.
 *
 * @param type    frame type
 * @param eventId optional client correlation id, echoed on direct responses
 * @param bytes   PCM16LE audio of {@code audio_chunk}, otherwise null
 * @param seq     client sequence number of {@code audio_chunk}, -1 when absent
 * @param text    text of {@code text_input}, otherwise null
 * @param score   score of {@code quality_feedback}, otherwise null
 * @param config  JSON object text of {@code init}'s config, otherwise null
 */
public record ClientFrame(
        ClientFrameType type,
        String eventId,
        byte[] bytes,
        long seq,
        String text,
        Double score,
        String config
) {

    public ClientFrame {
        Objects.requireNonNull(type, "type");
    }

    public static ClientFrame of(ClientFrameType type) {
        return new ClientFrame(type, null, null, -1, null, null, null);
    }

    public static ClientFrame init(JSONObject config) {
        return new ClientFrame(ClientFrameType.INIT, null, null, -1, null, null,
                config == null ? "{}" : config.toString());
    }

    public static ClientFrame audio(byte[] bytes, long seq) {
        return new ClientFrame(ClientFrameType.AUDIO_CHUNK, null, bytes, seq, null, null, null);
    }

    public static ClientFrame text(String text) {
        return new ClientFrame(ClientFrameType.TEXT_INPUT, null, null, -1, text, null, null);
    }

    public static ClientFrame feedback(double score) {
        return new ClientFrame(ClientFrameType.QUALITY_FEEDBACK, null, null, -1, null, score, null);
    }

    public ClientFrame withEventId(String id) {
        return new ClientFrame(type, id, bytes, seq, text, score, config);
    }

    public JSONObject configJson() {
        return config == null ? new JSONObject() : new JSONObject(config);
    }
}
