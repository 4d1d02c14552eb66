package io.github.drompincen.agentchat.persistence.store;

import io.github.drompincen.agentchat.protocol.api.ConversationSummary;
import io.github.drompincen.agentchat.protocol.log.ConversationLogEntry;
import io.github.drompincen.agentchat.protocol.log.LogEntryType;

import java.time.Instant;
import java.util.List;

public record StoredConversation(
        String conversationId,
        String agentSessionId,
        String title,
        Instant startTime,
        Instant endTime,
        double totalCost,
        long totalTokensInput,
        long totalTokensOutput,
        List<ConversationLogEntry> messages
) {
    static final int PREVIEW_LENGTH = 100;

    public StoredConversation {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public String firstUserMessage() {
        return messages.stream()
                .filter(m -> m.type() == LogEntryType.USER_INPUT)
                .findFirst()
                .map(m -> preview(m.dataAsText()))
                .orElse("");
    }

    public String lastUserMessage() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).type() == LogEntryType.USER_INPUT) {
                return preview(messages.get(i).dataAsText());
            }
        }
        return "";
    }

    public ConversationSummary summary() {
        return new ConversationSummary(conversationId, agentSessionId, title, startTime, endTime,
                messages.size(), totalCost, firstUserMessage(), lastUserMessage());
    }

    static String preview(String text) {
        return text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) : text;
    }
}
