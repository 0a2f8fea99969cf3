package com.phillippitts.voiceforge.domain;

import org.json.JSONObject;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable unit of inference work submitted to a worker pool.
 *
 * <p>The payload is kept as serialized JSON text so the record stays immutable; binary audio
 * travels base64-encoded inside it. {@link #payloadJson()} returns a fresh copy on every call.
 *
 * @param id          unique per submission, used as correlation id on the worker protocol
 * @param type        task type, selects the pool
 * @param payload     JSON object text specific to the type
 * @param priority    dispatch tier
 * @param submittedAt creation time, second ordering key after priority
 * @param deadline    optional deadline measured from submission (null = pool default)
 */
public record Task(
        String id,
        TaskType type,
        String payload,
        TaskPriority priority,
        Instant submittedAt,
        Duration deadline
) {

    /** Field that carries a payload submitted as bare base64 bytes. */
    public static final String BYTES_FIELD = "bytes";

    public Task {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(priority, "priority must not be null");
        Objects.requireNonNull(submittedAt, "submittedAt must not be null");
        if (payload == null || payload.isBlank()) {
            payload = "{}";
        }
        if (deadline != null && (deadline.isNegative() || deadline.isZero())) {
            throw new IllegalArgumentException("deadline must be positive, got: " + deadline);
        }
    }

    /**
     * Creates a task with a random id, the current time and no explicit deadline.
     */
    public static Task of(TaskType type, JSONObject payload, TaskPriority priority) {
        return new Task(UUID.randomUUID().toString(), type,
                payload == null ? "{}" : payload.toString(), priority, Instant.now(), null);
    }

    public Task withDeadline(Duration newDeadline) {
        return new Task(id, type, payload, priority, submittedAt, newDeadline);
    }

    public JSONObject payloadJson() {
        return new JSONObject(payload);
    }

    /**
     * Parses the external submission contract
     * {@code {id, type, payload, priority:int, deadlineMs?}}.
     *
     * @throws IllegalArgumentException if the type is missing or unknown
     */
    public static Task fromJson(JSONObject json) {
        String typeName = json.optString("type", "");
        TaskType type = TaskType.fromWire(typeName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown task type: " + typeName));
        String id = json.optString("id", "");
        String payload = payloadText(json.opt("payload"));
        long deadlineMs = json.optLong("deadlineMs", 0);
        return new Task(
                id.isBlank() ? UUID.randomUUID().toString() : id,
                type,
                payload,
                TaskPriority.fromLevel(json.optInt("priority", TaskPriority.NORMAL.level())),
                Instant.now(),
                deadlineMs > 0 ? Duration.ofMillis(deadlineMs) : null);
    }

    /**
     * Normalizes a wire payload to JSON object text. A string payload is base64 bytes and is
     * wrapped as {@code {"bytes": ...}}; a missing payload becomes {@code {}}.
     *
     * @throws IllegalArgumentException for any other JSON value
     */
    public static String payloadText(Object raw) {
        if (raw == null || JSONObject.NULL.equals(raw)) {
            return "{}";
        }
        if (raw instanceof JSONObject obj) {
            return obj.toString();
        }
        if (raw instanceof String bytes) {
            return new JSONObject().put(BYTES_FIELD, bytes).toString();
        }
        throw new IllegalArgumentException("payload must be an object or base64 bytes, got: "
                + raw.getClass().getSimpleName());
    }
}
