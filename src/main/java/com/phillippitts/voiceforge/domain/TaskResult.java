package com.phillippitts.voiceforge.domain;

import org.json.JSONObject;

import java.util.Objects;

/**
 * Outcome of one task: either {@code ok} with a JSON result, or an {@link TaskError}.
 *
 * @param id     correlation id of the originating task
 * @param ok     whether the task succeeded
 * @param result JSON object text (null when not ok)
 * @param error  error details (null when ok)
 */
public record TaskResult(String id, boolean ok, String result, TaskError error) {

    public TaskResult {
        Objects.requireNonNull(id, "id must not be null");
        if (ok && error != null) {
            throw new IllegalArgumentException("successful result must not carry an error");
        }
        if (!ok && error == null) {
            throw new IllegalArgumentException("failed result must carry an error");
        }
    }

    public static TaskResult success(String id, JSONObject result) {
        return new TaskResult(id, true, result == null ? "{}" : result.toString(), null);
    }

    public static TaskResult failure(String id, TaskErrorKind kind, String message) {
        return new TaskResult(id, false, null, new TaskError(kind, message));
    }

    public JSONObject resultJson() {
        return result == null ? new JSONObject() : new JSONObject(result);
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject().put("id", id).put("ok", ok);
        if (ok) {
            json.put("result", resultJson());
        } else {
            json.put("error", error.toJson());
        }
        return json;
    }
}
