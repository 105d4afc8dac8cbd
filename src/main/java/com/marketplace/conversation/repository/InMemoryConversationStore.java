package com.marketplace.conversation.repository;

import com.marketplace.conversation.model.Conversation;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryConversationStore implements ConversationStore {

    private final ConcurrentHashMap<String, Conversation> conversations = new ConcurrentHashMap<>();

    @Override
    public Optional<Conversation> find(String buyerId) {
        return Optional.ofNullable(conversations.get(buyerId));
    }

    @Override
    public void put(Conversation conversation) {
        conversations.put(conversation.getBuyerId(), conversation);
    }

    @Override
    public Collection<Conversation> findAll() {
        return List.copyOf(conversations.values());
    }
}
