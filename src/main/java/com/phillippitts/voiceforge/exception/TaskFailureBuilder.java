package com.phillippitts.voiceforge.exception;

import com.phillippitts.voiceforge.domain.TaskErrorKind;
import com.phillippitts.voiceforge.domain.TaskType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link TaskFailedException} with contextual details.
 *
 * <pre>
 * throw TaskFailureBuilder.create(TaskErrorKind.WORKER_CRASHED, "Worker exited")
 *         .task(task.id(), task.type())
 *         .slot(3)
 *         .exitCode(137)
 *         .durationMs(1500)
 *         .metadata("stderr", snippet)
 *         .build();
 * </pre>
 *
 * <p>Final message format:
 * {@code {message} (type={type}, slot={n}, exitCode={code}, durationMs={ms}, {key}={value}, ...)}
 */
public final class TaskFailureBuilder {

    private final TaskErrorKind kind;
    private final String message;
    private String taskId;
    private TaskType taskType;
    private Integer slot;
    private Integer exitCode;
    private Long durationMs;
    private Throwable cause;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private TaskFailureBuilder(TaskErrorKind kind, String message) {
        this.kind = kind;
        this.message = message;
    }

    public static TaskFailureBuilder create(TaskErrorKind kind, String message) {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new TaskFailureBuilder(kind, message);
    }

    public TaskFailureBuilder task(String taskId, TaskType taskType) {
        this.taskId = taskId;
        this.taskType = taskType;
        return this;
    }

    public TaskFailureBuilder slot(int slot) {
        this.slot = slot;
        return this;
    }

    public TaskFailureBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public TaskFailureBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    public TaskFailureBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public TaskFailureBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public TaskFailedException build() {
        String detailed = buildDetailedMessage();
        return cause == null
                ? new TaskFailedException(kind, taskId, taskType, detailed)
                : new TaskFailedException(kind, taskId, taskType, detailed, cause);
    }

    private String buildDetailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (taskType != null) {
            details.put("type", taskType.wireName());
        }
        if (slot != null) {
            details.put("slot", String.valueOf(slot));
        }
        if (exitCode != null) {
            details.put("exitCode", String.valueOf(exitCode));
        }
        if (durationMs != null) {
            details.put("durationMs", String.valueOf(durationMs));
        }
        details.putAll(metadata);
        if (details.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> e : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(e.getKey()).append('=').append(e.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
