package io.github.drompincen.agentchat.persistence.store;

import io.github.drompincen.agentchat.persistence.document.ConversationDocument;
import io.github.drompincen.agentchat.persistence.repository.ConversationRepository;
import io.github.drompincen.agentchat.protocol.api.ConversationSummary;
import io.github.drompincen.agentchat.protocol.log.ConversationLogEntry;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class MongoConversationStore implements ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(MongoConversationStore.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ConversationRepository conversationRepository;
    private final ObjectMapper objectMapper;

    public MongoConversationStore(ConversationRepository conversationRepository, ObjectMapper objectMapper) {
        this.conversationRepository = conversationRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    public void save(StoredConversation conversation) {
        ConversationDocument doc = new ConversationDocument();
        doc.setConversationId(conversation.conversationId());
        doc.setAgentSessionId(conversation.agentSessionId());
        doc.setTitle(conversation.title());
        doc.setStartTime(conversation.startTime());
        doc.setEndTime(conversation.endTime());
        doc.setMessageCount(conversation.messages().size());
        doc.setTotalCost(conversation.totalCost());
        doc.setTotalTokensInput(conversation.totalTokensInput());
        doc.setTotalTokensOutput(conversation.totalTokensOutput());
        doc.setFirstUserMessage(conversation.firstUserMessage());
        doc.setLastUserMessage(conversation.lastUserMessage());
        List<Map<String, Object>> messages = new ArrayList<>();
        for (ConversationLogEntry entry : conversation.messages()) {
            messages.add(objectMapper.convertValue(entry.toJson(), MAP_TYPE));
        }
        doc.setMessages(messages);
        try {
            conversationRepository.save(doc);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to save conversation " + conversation.conversationId(), e);
        }
        log.debug("Saved conversation {} with {} messages", conversation.conversationId(), messages.size());
    }

    @Override
    public Optional<StoredConversation> load(String conversationId) {
        return conversationRepository.findById(conversationId).map(this::toStored);
    }

    @Override
    public List<ConversationSummary> list() {
        return conversationRepository.findTop100ByOrderByEndTimeDesc().stream()
                .map(this::toSummary)
                .toList();
    }

    @Override
    public List<ConversationSummary> search(String query) {
        if (query == null || query.isBlank()) {
            return list();
        }
        String q = query.trim();
        return conversationRepository
                .findByFirstUserMessageContainingIgnoreCaseOrLastUserMessageContainingIgnoreCaseOrderByEndTimeDesc(q, q)
                .stream()
                .map(this::toSummary)
                .toList();
    }

    @Override
    public boolean delete(String conversationId) {
        try {
            if (!conversationRepository.existsById(conversationId)) {
                return false;
            }
            conversationRepository.deleteById(conversationId);
            log.info("Deleted conversation {}", conversationId);
            return true;
        } catch (DataAccessException e) {
            throw new StoreException("Failed to delete conversation " + conversationId, e);
        }
    }

    @Override
    public Optional<StoredConversation> latest() {
        return conversationRepository.findFirstByOrderByEndTimeDesc().map(this::toStored);
    }

    private StoredConversation toStored(ConversationDocument doc) {
        List<ConversationLogEntry> messages = new ArrayList<>();
        if (doc.getMessages() != null) {
            for (Map<String, Object> raw : doc.getMessages()) {
                JsonNode node = objectMapper.valueToTree(raw);
                if (node instanceof ObjectNode object) {
                    messages.add(new ConversationLogEntry(object));
                }
            }
        }
        return new StoredConversation(doc.getConversationId(), doc.getAgentSessionId(), doc.getTitle(),
                doc.getStartTime(), doc.getEndTime(), doc.getTotalCost(),
                doc.getTotalTokensInput(), doc.getTotalTokensOutput(), messages);
    }

    private ConversationSummary toSummary(ConversationDocument doc) {
        return new ConversationSummary(doc.getConversationId(), doc.getAgentSessionId(), doc.getTitle(),
                doc.getStartTime(), doc.getEndTime(), doc.getMessageCount(), doc.getTotalCost(),
                doc.getFirstUserMessage(), doc.getLastUserMessage());
    }
}
