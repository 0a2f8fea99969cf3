package com.phillippitts.voiceforge.domain;

import org.json.JSONObject;

import java.util.Objects;

/**
 * Typed error attached to a failed {@link TaskResult}.
 */
public record TaskError(TaskErrorKind kind, String message) {

    public TaskError {
        Objects.requireNonNull(kind, "kind must not be null");
        message = message == null ? "" : message;
    }

    public JSONObject toJson() {
        return new JSONObject().put("kind", kind.name()).put("message", message);
    }
}
