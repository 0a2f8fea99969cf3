package com.phillippitts.voiceforge.exception;

/**
 * Thrown when a task is routed to a type with no registered pool.
 * This is a startup configuration error, not a runtime condition to recover from.
 */
public class UnknownTaskTypeException extends VoiceForgeException {

    private final String taskType;

    public UnknownTaskTypeException(String taskType) {
        super("No worker pool registered for task type: " + taskType);
        this.taskType = taskType;
    }

    public String getTaskType() {
        return taskType;
    }
}
