package com.phillippitts.voiceforge.exception;

/**
 * Base exception for all VoiceForge application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class VoiceForgeException extends RuntimeException {

    public VoiceForgeException(String message) {
        super(message);
    }

    public VoiceForgeException(String message, Throwable cause) {
        super(message, cause);
    }

    public VoiceForgeException(Throwable cause) {
        super(cause);
    }
}
