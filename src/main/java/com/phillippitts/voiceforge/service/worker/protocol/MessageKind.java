package com.phillippitts.voiceforge.service.worker.protocol;

import java.util.Arrays;
import java.util.Optional;

/**
 * Tag of a worker IPC message.
 */
public enum MessageKind {
    READY,
    TASK,
    RESULT,
    ERROR,
    CHUNK,
    PING,
    PONG,
    SHUTDOWN;

    public String wireName() {
        return name().toLowerCase();
    }

    public static Optional<MessageKind> fromWire(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(k -> k.wireName().equals(name)).findFirst();
    }
}
