package com.phillippitts.voiceforge.service.gateway.context;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link ContextStore}; history is lost on restart.
 */
@Component
@ConditionalOnMissingBean(value = ContextStore.class, ignored = InMemoryContextStore.class)
public class InMemoryContextStore implements ContextStore {

    private final Map<String, List<ConversationTurn>> store = new ConcurrentHashMap<>();

    @Override
    public Optional<List<ConversationTurn>> load(String conversationId) {
        return Optional.ofNullable(store.get(conversationId));
    }

    @Override
    public void save(String conversationId, List<ConversationTurn> turns) {
        store.put(conversationId, List.copyOf(turns));
    }
}
