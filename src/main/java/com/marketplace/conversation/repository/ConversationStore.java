package com.marketplace.conversation.repository;

import com.marketplace.conversation.model.Conversation;

import java.util.Collection;
import java.util.Optional;

/**
 * Working set of conversations owned by one engine instance. Callers serialize updates per buyer.
 */
public interface ConversationStore {

    Optional<Conversation> find(String buyerId);

    void put(Conversation conversation);

    Collection<Conversation> findAll();
}
