package com.phillippitts.voiceforge.service.gateway.context;

import org.json.JSONObject;

import java.time.Instant;
import java.util.Objects;

/**
 * One utterance in a conversation.
 *
 * @param role speaker
 * @param text utterance text
 * @param at   when it was added
 */
public record ConversationTurn(Role role, String text, Instant at) {

    public enum Role {
        USER,
        ASSISTANT;

        public String wireName() {
            return name().toLowerCase();
        }
    }

    public ConversationTurn {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(at, "at");
        text = text == null ? "" : text;
    }

    public JSONObject toJson() {
        return new JSONObject().put("role", role.wireName()).put("text", text);
    }
}
