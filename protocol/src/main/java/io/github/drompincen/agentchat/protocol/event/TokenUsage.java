package io.github.drompincen.agentchat.protocol.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

public record TokenUsage(
        long inputTokens,
        long outputTokens,
        long cacheReadInputTokens,
        long cacheCreationInputTokens
) {
    public static final TokenUsage ZERO = new TokenUsage(0, 0, 0, 0);

    /**
     * Reads the agent's snake_case usage object. Input and output counts are required,
     * cache counts default to zero.
     */
    public static Optional<TokenUsage> fromJson(JsonNode node) {
        if (node == null || !node.isObject()
                || !node.path("input_tokens").isNumber() || !node.path("output_tokens").isNumber()) {
            return Optional.empty();
        }
        return Optional.of(new TokenUsage(
                node.path("input_tokens").asLong(),
                node.path("output_tokens").asLong(),
                node.path("cache_read_input_tokens").asLong(0),
                node.path("cache_creation_input_tokens").asLong(0)));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("input_tokens", inputTokens);
        node.put("output_tokens", outputTokens);
        node.put("cache_read_input_tokens", cacheReadInputTokens);
        node.put("cache_creation_input_tokens", cacheCreationInputTokens);
        return node;
    }

    public TokenUsage plus(TokenUsage other) {
        return new TokenUsage(
                inputTokens + other.inputTokens,
                outputTokens + other.outputTokens,
                cacheReadInputTokens + other.cacheReadInputTokens,
                cacheCreationInputTokens + other.cacheCreationInputTokens);
    }
}
