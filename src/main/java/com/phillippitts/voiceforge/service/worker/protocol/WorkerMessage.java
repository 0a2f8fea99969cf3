package com.phillippitts.voiceforge.service.worker.protocol;

import com.phillippitts.voiceforge.domain.Task;
import com.phillippitts.voiceforge.domain.TaskError;
import com.phillippitts.voiceforge.domain.TaskErrorKind;
import com.phillippitts.voiceforge.domain.TaskType;
import org.json.JSONObject;

import java.util.Objects;

/**
 * One message on the worker IPC channel.
 *
 * <p>Fields are populated according to {@link #kind()}:
 * <ul>
 *   <li>{@code task}: id, type, payload</li>
 *   <li>{@code result}, {@code chunk}: id, payload</li>
 *   <li>{@code error}: id, error</li>
 *   <li>{@code ping}, {@code pong}: optional id used as ping nonce</li>
 *   <li>{@code ready}, {@code shutdown}: no fields</li>
 * </ul>
 *
 * @param kind    message tag
 * @param id      correlation id (task id or ping nonce), may be null
 * @param type    task type, only for {@code task}
 * @param payload JSON object text, may be null
 * @param error   error details, only for {@code error}
 */
public record WorkerMessage(
        MessageKind kind,
        String id,
        TaskType type,
        String payload,
        TaskError error
) {

    public WorkerMessage {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public static WorkerMessage ready() {
        return new WorkerMessage(MessageKind.READY, null, null, null, null);
    }

    public static WorkerMessage shutdown() {
        return new WorkerMessage(MessageKind.SHUTDOWN, null, null, null, null);
    }

    public static WorkerMessage ping(String nonce) {
        return new WorkerMessage(MessageKind.PING, nonce, null, null, null);
    }

    public static WorkerMessage pong(String nonce) {
        return new WorkerMessage(MessageKind.PONG, nonce, null, null, null);
    }

    public static WorkerMessage task(Task task) {
        return new WorkerMessage(MessageKind.TASK, task.id(), task.type(), task.payload(), null);
    }

    public static WorkerMessage result(String id, JSONObject payload) {
        return new WorkerMessage(MessageKind.RESULT, id, null, payloadText(payload), null);
    }

    public static WorkerMessage chunk(String id, JSONObject payload) {
        return new WorkerMessage(MessageKind.CHUNK, id, null, payloadText(payload), null);
    }

    public static WorkerMessage error(String id, TaskErrorKind kind, String message) {
        return new WorkerMessage(MessageKind.ERROR, id, null, null, new TaskError(kind, message));
    }

    public JSONObject payloadJson() {
        return payload == null ? new JSONObject() : new JSONObject(payload);
    }

    private static String payloadText(JSONObject payload) {
        return payload == null ? "{}" : payload.toString();
    }
}
