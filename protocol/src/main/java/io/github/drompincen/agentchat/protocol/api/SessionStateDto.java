package io.github.drompincen.agentchat.protocol.api;

public record SessionStateDto(
        String conversationId,
        boolean processing,
        double totalCost,
        long totalTokensInput,
        long totalTokensOutput,
        long cacheReadTokens,
        long cacheCreationTokens,
        int requestCount,
        String agentSessionId,
        String selectedModel,
        Long lastDurationMs
) {}
