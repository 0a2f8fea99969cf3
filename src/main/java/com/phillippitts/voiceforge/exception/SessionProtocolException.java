package com.phillippitts.voiceforge.exception;

import java.util.Objects;

/**
 * Thrown when a client frame violates the streaming session protocol.
 */
public class SessionProtocolException extends VoiceForgeException {

    private final SessionErrorKind kind;

    public SessionProtocolException(SessionErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public SessionProtocolException(SessionErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public SessionErrorKind getKind() {
        return kind;
    }
}
