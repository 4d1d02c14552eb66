package io.github.drompincen.agentchat.persistence.store;

import io.github.drompincen.agentchat.protocol.api.ConversationSummary;

import java.util.List;
import java.util.Optional;

/**
 * Where finished turns are handed off. Implementations own the storage medium.
 */
public interface ConversationStore {

    void save(StoredConversation conversation);

    Optional<StoredConversation> load(String conversationId);

    /** Newest first. */
    List<ConversationSummary> list();

    List<ConversationSummary> search(String query);

    boolean delete(String conversationId);

    Optional<StoredConversation> latest();
}
