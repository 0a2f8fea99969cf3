package com.phillippitts.voiceforge.service.gateway.context;

import java.util.List;
import java.util.Optional;

/**
 * Durability of conversation history across reconnects, keyed by a client-chosen conversation
 * id. Sessions without a conversation id are not persisted.
 */
public interface ContextStore {

    /**
     * @return stored history oldest first, or empty if none is known
     */
    Optional<List<ConversationTurn>> load(String conversationId);

    void save(String conversationId, List<ConversationTurn> turns);
}
