package com.phillippitts.voiceforge.service.worker.protocol;

import com.phillippitts.voiceforge.domain.Task;
import com.phillippitts.voiceforge.domain.TaskError;
import com.phillippitts.voiceforge.domain.TaskErrorKind;
import com.phillippitts.voiceforge.domain.TaskType;
import com.phillippitts.voiceforge.exception.WorkerProtocolException;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Encodes and decodes worker IPC messages as one JSON object per line.
 *
 * <p>Wire shapes:
 * <pre>
 * {"kind":"ready"}
 * {"kind":"task","id":"..","type":"transcribe","payload":{..}}
 * {"kind":"result","id":"..","payload":{..}}
 * {"kind":"chunk","id":"..","payload":{..}}
 * {"kind":"error","id":"..","error":{"kind":"TASK_FAILED","message":".."}}
 * {"kind":"ping","id":".."} / {"kind":"pong","id":".."}
 * {"kind":"shutdown"}
 * </pre>
 *
 * <p>{@link JSONObject#toString()} escapes control characters, so an encoded message never
 * contains a raw newline.
 */
public final class WorkerMessageCodec {

    private WorkerMessageCodec() {}

    /**
     * Encodes a message without the trailing newline.
     */
    public static String encode(WorkerMessage msg) {
        JSONObject json = new JSONObject().put("kind", msg.kind().wireName());
        if (msg.id() != null) {
            json.put("id", msg.id());
        }
        if (msg.type() != null) {
            json.put("type", msg.type().wireName());
        }
        if (msg.payload() != null) {
            json.put("payload", new JSONObject(msg.payload()));
        }
        if (msg.error() != null) {
            json.put("error", msg.error().toJson());
        }
        return json.toString();
    }

    /**
     * Decodes one line.
     *
     * @throws WorkerProtocolException if the line is not a JSON object, has an unknown kind,
     *                                 or lacks fields required by its kind
     */
    public static WorkerMessage decode(String line) {
        if (line == null || line.isBlank()) {
            throw new WorkerProtocolException("Empty message line", line);
        }
        JSONObject json;
        try {
            json = new JSONObject(line.trim());
        } catch (JSONException e) {
            throw new WorkerProtocolException("Malformed JSON: " + e.getMessage(), line, e);
        }

        String kindName = json.optString("kind", null);
        MessageKind kind = MessageKind.fromWire(kindName)
                .orElseThrow(() -> new WorkerProtocolException("Unknown message kind: " + kindName, line));

        String id = json.has("id") && !json.isNull("id") ? json.optString("id") : null;
        String payload;
        try {
            payload = Task.payloadText(json.opt("payload"));
        } catch (IllegalArgumentException e) {
            throw new WorkerProtocolException(e.getMessage(), line, e);
        }

        return switch (kind) {
            case READY, SHUTDOWN -> new WorkerMessage(kind, null, null, null, null);
            case PING, PONG -> new WorkerMessage(kind, id, null, null, null);
            case TASK -> {
                requireId(id, kind, line);
                String typeName = json.optString("type", null);
                TaskType type = TaskType.fromWire(typeName)
                        .orElseThrow(() -> new WorkerProtocolException("Unknown task type: " + typeName, line));
                yield new WorkerMessage(kind, id, type, payload, null);
            }
            case RESULT, CHUNK -> {
                requireId(id, kind, line);
                yield new WorkerMessage(kind, id, null, payload, null);
            }
            case ERROR -> {
                requireId(id, kind, line);
                yield new WorkerMessage(kind, id, null, null, decodeError(json));
            }
        };
    }

    private static TaskError decodeError(JSONObject json) {
        Object raw = json.opt("error");
        if (raw instanceof JSONObject err) {
            TaskErrorKind kind = parseKind(err.optString("kind", null));
            return new TaskError(kind, err.optString("message", ""));
        }
        // Bare string errors are tolerated and treated as task faults
        return new TaskError(TaskErrorKind.TASK_FAILED, raw == null ? "" : String.valueOf(raw));
    }

    private static TaskErrorKind parseKind(String name) {
        if (name == null) {
            return TaskErrorKind.TASK_FAILED;
        }
        try {
            return TaskErrorKind.valueOf(name);
        } catch (IllegalArgumentException e) {
            return TaskErrorKind.TASK_FAILED;
        }
    }

    private static void requireId(String id, MessageKind kind, String line) {
        if (id == null || id.isEmpty()) {
            throw new WorkerProtocolException("Message kind '" + kind.wireName() + "' requires an id", line);
        }
    }
}
