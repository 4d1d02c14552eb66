package io.github.drompincen.agentchat.protocol.transcript;

import io.github.drompincen.agentchat.protocol.event.TokenUsage;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A row of the rendered transcript. Entries are immutable; the reducer replaces an
 * entry when its state changes.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ConversationEntry.User.class, name = "user"),
        @JsonSubTypes.Type(value = ConversationEntry.Assistant.class, name = "assistant"),
        @JsonSubTypes.Type(value = ConversationEntry.Thinking.class, name = "thinking"),
        @JsonSubTypes.Type(value = ConversationEntry.ToolUse.class, name = "toolUse"),
        @JsonSubTypes.Type(value = ConversationEntry.ToolResult.class, name = "toolResult"),
        @JsonSubTypes.Type(value = ConversationEntry.Error.class, name = "error")
})
public sealed interface ConversationEntry permits
        ConversationEntry.User,
        ConversationEntry.Assistant,
        ConversationEntry.Thinking,
        ConversationEntry.ToolUse,
        ConversationEntry.ToolResult,
        ConversationEntry.Error {

    String id();

    long timestamp();

    record User(String id, long timestamp, String content) implements ConversationEntry {}

    record Assistant(String id, long timestamp, String content, boolean streaming, TokenUsage usage)
            implements ConversationEntry {

        public Assistant append(String text) {
            return new Assistant(id, timestamp, content + text, streaming, usage);
        }

        public Assistant closed() {
            return streaming ? new Assistant(id, timestamp, content, false, usage) : this;
        }

        public Assistant withUsage(TokenUsage newUsage) {
            return new Assistant(id, timestamp, content, streaming, newUsage);
        }
    }

    record Thinking(String id, long timestamp, String content) implements ConversationEntry {}

    record ToolUse(
            String id,
            long timestamp,
            String toolUseId,
            String toolName,
            JsonNode rawInput,
            String toolInfo,
            ToolStatus status,
            Long duration,
            Long tokens,
            Long cacheReadTokens,
            Long cacheCreationTokens,
            String fileContentAfter
    ) implements ConversationEntry {

        /** Applies a result's outcome; counters the result leaves unset keep their values. */
        public ToolUse resolved(boolean failed, Long duration, Long tokens, Long cacheReadTokens,
                                Long cacheCreationTokens, String fileContentAfter) {
            return new ToolUse(id, timestamp, toolUseId, toolName, rawInput, toolInfo,
                    failed ? ToolStatus.FAILED : ToolStatus.COMPLETED,
                    duration != null ? duration : this.duration,
                    tokens != null ? tokens : this.tokens,
                    cacheReadTokens != null ? cacheReadTokens : this.cacheReadTokens,
                    cacheCreationTokens != null ? cacheCreationTokens : this.cacheCreationTokens,
                    fileContentAfter != null ? fileContentAfter : this.fileContentAfter);
        }
    }

    record ToolResult(
            String id,
            long timestamp,
            String toolUseId,
            String toolName,
            String content,
            boolean isError,
            Long duration,
            Long tokens,
            Long cacheReadTokens,
            Long cacheCreationTokens,
            String fileContentAfter
    ) implements ConversationEntry {}

    record Error(String id, long timestamp, String content) implements ConversationEntry {}
}
