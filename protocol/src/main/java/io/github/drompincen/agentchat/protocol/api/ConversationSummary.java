package io.github.drompincen.agentchat.protocol.api;

import java.time.Instant;

public record ConversationSummary(
        String conversationId,
        String agentSessionId,
        String title,
        Instant startTime,
        Instant endTime,
        int messageCount,
        double totalCost,
        String firstUserMessage,
        String lastUserMessage
) {}
