package com.phillippitts.voiceforge.exception;

import com.phillippitts.voiceforge.domain.TaskErrorKind;
import com.phillippitts.voiceforge.domain.TaskType;

import java.util.Objects;

/**
 * Thrown (or used to complete a task future exceptionally) when a task cannot produce a result:
 * worker crash, queue or execution timeout, pool drain, cancellation, or a worker-reported fault.
 */
public class TaskFailedException extends VoiceForgeException {

    private final TaskErrorKind kind;
    private final String taskId;
    private final TaskType taskType;

    public TaskFailedException(TaskErrorKind kind, String taskId, TaskType taskType, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.taskId = taskId;
        this.taskType = taskType;
    }

    public TaskFailedException(TaskErrorKind kind, String taskId, TaskType taskType, String message,
                               Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.taskId = taskId;
        this.taskType = taskType;
    }

    public TaskErrorKind getKind() {
        return kind;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskType getTaskType() {
        return taskType;
    }
}
