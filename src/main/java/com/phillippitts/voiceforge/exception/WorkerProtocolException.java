package com.phillippitts.voiceforge.exception;

/**
 * Thrown when a worker IPC line cannot be decoded into a known message.
 */
public class WorkerProtocolException extends VoiceForgeException {

    private final String line;

    public WorkerProtocolException(String message, String line) {
        super(message);
        this.line = line;
    }

    public WorkerProtocolException(String message, String line, Throwable cause) {
        super(message, cause);
        this.line = line;
    }

    public String getLine() {
        return line;
    }
}
