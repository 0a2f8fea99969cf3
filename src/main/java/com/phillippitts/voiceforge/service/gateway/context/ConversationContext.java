package com.phillippitts.voiceforge.service.gateway.context;

import org.json.JSONArray;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded conversation history of one session; the oldest turn is dropped once
 * {@code maxTurns} is reached. Confined to the owning session's mailbox.
 */
public final class ConversationContext {

    private final int maxTurns;
    private final Deque<ConversationTurn> turns = new ArrayDeque<>();

    public ConversationContext(int maxTurns) {
        if (maxTurns < 1) {
            throw new IllegalArgumentException("maxTurns must be >= 1, got: " + maxTurns);
        }
        this.maxTurns = maxTurns;
    }

    public static ConversationContext restore(int maxTurns, List<ConversationTurn> history) {
        ConversationContext ctx = new ConversationContext(maxTurns);
        history.forEach(ctx::append);
        return ctx;
    }

    public void addUser(String text) {
        append(new ConversationTurn(ConversationTurn.Role.USER, text, Instant.now()));
    }

    public void addAssistant(String text) {
        append(new ConversationTurn(ConversationTurn.Role.ASSISTANT, text, Instant.now()));
    }

    void append(ConversationTurn turn) {
        turns.addLast(turn);
        while (turns.size() > maxTurns) {
            turns.removeFirst();
        }
    }

    public List<ConversationTurn> turns() {
        return List.copyOf(turns);
    }

    public int size() {
        return turns.size();
    }

    public int maxTurns() {
        return maxTurns;
    }

    /**
     * History as {@code [{role, text}, ...]}, oldest first, for the generate-reply payload.
     */
    public JSONArray toJson() {
        JSONArray arr = new JSONArray();
        for (ConversationTurn t : new ArrayList<>(turns)) {
            arr.put(t.toJson());
        }
        return arr;
    }
}
