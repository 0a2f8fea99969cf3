package com.phillippitts.voiceforge.service.gateway.protocol;

/**
 * Frames the gateway sends.
 */
public enum ServerFrameType {
    READY("ready"),
    STT_PARTIAL("stt_partial"),
    STT_FINAL("stt_final"),
    AGENT_THINKING("agent_thinking"),
    AGENT_REPLY("agent_reply"),
    TTS_CHUNK("tts_chunk"),
    TTS_COMPLETE("tts_complete"),
    METRICS("metrics"),
    ERROR("error"),
    ENDED("ended");

    private final String wireName;

    ServerFrameType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
