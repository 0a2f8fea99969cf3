package com.phillippitts.voiceforge.service.gateway.protocol;

import java.util.Arrays;
import java.util.Optional;

/**
 * Frames a client may send.
 */
public enum ClientFrameType {
    INIT("init"),
    AUDIO_CHUNK("audio_chunk"),
    TEXT_INPUT("text_input"),
    PAUSE("pause"),
    RESUME("resume"),
    END("end"),
    QUALITY_FEEDBACK("quality_feedback");

    private final String wireName;

    ClientFrameType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ClientFrameType> fromWire(String name) {
        return Arrays.stream(values()).filter(t -> t.wireName.equals(name)).findFirst();
    }
}
