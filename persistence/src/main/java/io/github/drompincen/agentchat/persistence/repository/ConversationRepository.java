package io.github.drompincen.agentchat.persistence.repository;

import io.github.drompincen.agentchat.persistence.document.ConversationDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface ConversationRepository extends MongoRepository<ConversationDocument, String> {
    List<ConversationDocument> findTop100ByOrderByEndTimeDesc();
    Optional<ConversationDocument> findFirstByOrderByEndTimeDesc();
    List<ConversationDocument> findByFirstUserMessageContainingIgnoreCaseOrLastUserMessageContainingIgnoreCaseOrderByEndTimeDesc(
            String first, String last);
}
