package io.github.drompincen.agentchat.protocol.log;

import io.github.drompincen.agentchat.protocol.event.TokenUsage;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.DateTimeException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One record of a conversation's persisted log: {@code {type, data?, timestamp, ...}}.
 * Kind-specific fields may sit at the top level or inside {@code data}; readers check
 * the top level first. The same records feed the live transcript and replay.
 */
public final class ConversationLogEntry {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectNode node;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public ConversationLogEntry(ObjectNode node) {
        this.node = Objects.requireNonNull(node, "node").deepCopy();
    }

    @JsonValue
    public ObjectNode toJson() {
        return node;
    }

    public LogEntryType type() {
        return LogEntryType.fromWire(node.path("type").asText(""));
    }

    public JsonNode data() {
        return node.get("data");
    }

    /**
     * Epoch milliseconds of the record. Accepts a number or an ISO-8601 string; anything
     * else reads as 0 so that replay stays deterministic.
     */
    public long timestampMillis() {
        JsonNode ts = node.get("timestamp");
        if (ts == null || ts.isNull()) {
            return 0L;
        }
        if (ts.isNumber()) {
            return ts.asLong();
        }
        try {
            return Instant.parse(ts.asText()).toEpochMilli();
        } catch (DateTimeException e) {
            return 0L;
        }
    }

    /** Top-level field, else the same field inside an object {@code data}. */
    public Optional<JsonNode> field(String name) {
        JsonNode top = node.get(name);
        if (top != null && !top.isNull()) {
            return Optional.of(top);
        }
        JsonNode data = node.get("data");
        if (data != null && data.isObject()) {
            JsonNode nested = data.get(name);
            if (nested != null && !nested.isNull()) {
                return Optional.of(nested);
            }
        }
        return Optional.empty();
    }

    public Optional<String> textField(String name) {
        return field(name).filter(JsonNode::isTextual).map(JsonNode::asText);
    }

    public Optional<Boolean> booleanField(String name) {
        return field(name).filter(JsonNode::isBoolean).map(JsonNode::asBoolean);
    }

    public Optional<Long> longField(String name) {
        return field(name).filter(JsonNode::isNumber).map(JsonNode::asLong);
    }

    /** {@code data} as text: strings verbatim, structures as JSON, absent as empty. */
    public String dataAsText() {
        JsonNode data = node.get("data");
        if (data == null || data.isNull()) {
            return "";
        }
        return data.isTextual() ? data.asText() : data.toString();
    }

    // Factories for records produced by the live session

    public static ConversationLogEntry userInput(Instant at, String text) {
        return new ConversationLogEntry(base(LogEntryType.USER_INPUT, at).put("data", text));
    }

    public static ConversationLogEntry output(Instant at, String text, boolean isFinal) {
        ObjectNode n = base(LogEntryType.OUTPUT, at).put("data", text);
        n.put("isFinal", isFinal);
        return new ConversationLogEntry(n);
    }

    public static ConversationLogEntry thinking(Instant at, String text) {
        return new ConversationLogEntry(base(LogEntryType.THINKING, at).put("data", text));
    }

    public static ConversationLogEntry toolUse(Instant at, String toolUseId, String toolName,
                                               JsonNode rawInput, String toolInfo) {
        ObjectNode n = base(LogEntryType.TOOL_USE, at);
        ObjectNode data = n.putObject("data");
        data.put("toolUseId", toolUseId);
        data.put("toolName", toolName);
        data.set("rawInput", rawInput == null ? NODES.objectNode() : rawInput.deepCopy());
        data.put("toolInfo", toolInfo);
        return new ConversationLogEntry(n);
    }

    public static ConversationLogEntry toolResult(Instant at, String toolUseId, String toolName,
                                                  String content, boolean isError, boolean hidden) {
        ObjectNode n = base(LogEntryType.TOOL_RESULT, at);
        ObjectNode data = n.putObject("data");
        data.put("toolUseId", toolUseId);
        data.put("toolName", toolName);
        data.put("content", content);
        data.put("isError", isError);
        data.put("hidden", hidden);
        return new ConversationLogEntry(n);
    }

    public static ConversationLogEntry updateTokens(Instant at, TokenUsage current, TokenUsage totals) {
        ObjectNode n = base(LogEntryType.UPDATE_TOKENS, at);
        ObjectNode data = n.putObject("data");
        data.set("current", current.toJson());
        data.put("totalTokensInput", totals.inputTokens());
        data.put("totalTokensOutput", totals.outputTokens());
        data.put("cacheReadTokens", totals.cacheReadInputTokens());
        data.put("cacheCreationTokens", totals.cacheCreationInputTokens());
        return new ConversationLogEntry(n);
    }

    public static ConversationLogEntry error(Instant at, String message) {
        return new ConversationLogEntry(base(LogEntryType.ERROR, at).put("data", message));
    }

    public static ConversationLogEntry sessionInfo(Instant at, String sessionId, List<String> tools, JsonNode mcpServers) {
        ObjectNode n = base(LogEntryType.SESSION_INFO, at);
        ObjectNode data = n.putObject("data");
        data.put("sessionId", sessionId);
        tools.forEach(data.putArray("tools")::add);
        data.set("mcpServers", mcpServers == null ? NODES.arrayNode() : mcpServers.deepCopy());
        return new ConversationLogEntry(n);
    }

    public static ConversationLogEntry compacting(Instant at, boolean compacting) {
        ObjectNode n = base(LogEntryType.COMPACTING, at);
        n.putObject("data").put("isCompacting", compacting);
        return new ConversationLogEntry(n);
    }

    public static ConversationLogEntry compactBoundary(Instant at, String trigger, Long preTokens) {
        ObjectNode n = base(LogEntryType.COMPACT_BOUNDARY, at);
        ObjectNode data = n.putObject("data");
        data.put("trigger", trigger);
        if (preTokens != null) {
            data.put("preTokens", preTokens);
        }
        return new ConversationLogEntry(n);
    }

    public static ConversationLogEntry permissionRequest(Instant at, String requestId, String toolName,
                                                         JsonNode input, String pattern) {
        ObjectNode n = base(LogEntryType.PERMISSION_REQUEST, at);
        ObjectNode data = n.putObject("data");
        data.put("requestId", requestId);
        data.put("toolName", toolName);
        data.set("input", input == null ? NODES.objectNode() : input.deepCopy());
        data.put("pattern", pattern);
        return new ConversationLogEntry(n);
    }

    private static ObjectNode base(LogEntryType type, Instant at) {
        ObjectNode n = NODES.objectNode();
        n.put("type", type.wireName());
        n.put("timestamp", at.toString());
        return n;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ConversationLogEntry other && node.equals(other.node);
    }

    @Override
    public int hashCode() {
        return node.hashCode();
    }

    @Override
    public String toString() {
        return node.toString();
    }
}
