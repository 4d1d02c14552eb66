package io.github.drompincen.agentchat.protocol.wire;

import io.github.drompincen.agentchat.protocol.event.ContentBlock;
import io.github.drompincen.agentchat.protocol.event.ProtocolEvent;
import io.github.drompincen.agentchat.protocol.event.TokenUsage;
import io.github.drompincen.agentchat.protocol.event.ToolResultBlock;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns one framed stdout line into a {@link ProtocolEvent}. Anything that is not a JSON
 * object with a known {@code type}/{@code subtype} decodes to empty and is dropped.
 */
public class EventDecoder {

    private static final Logger log = LoggerFactory.getLogger(EventDecoder.class);

    static final String UNKNOWN_TOOL = "Unknown Tool";
    static final String DEFAULT_TOOL_RESULT = "Tool executed successfully";

    private final ObjectMapper mapper;

    public EventDecoder() {
        this(new ObjectMapper());
    }

    public EventDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Optional<ProtocolEvent> decode(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.debug("Skipping non-JSON line: {}", abbreviate(line));
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }

        String type = root.path("type").asText("");
        switch (type) {
            case "system":
                return decodeSystem(root);
            case "assistant":
                return decodeAssistant(root);
            case "user":
                return decodeToolResults(root);
            case "control_request":
                return decodeControlRequest(root);
            case "result":
                return Optional.of(decodeResult(root));
            case "control_response":
                return Optional.empty();
            default:
                log.debug("Skipping record with unknown type '{}'", type);
                return Optional.empty();
        }
    }

    private Optional<ProtocolEvent> decodeSystem(JsonNode root) {
        String subtype = root.path("subtype").asText("");
        switch (subtype) {
            case "init": {
                List<String> tools = new ArrayList<>();
                for (JsonNode tool : root.path("tools")) {
                    tools.add(tool.isTextual() ? tool.asText() : tool.path("name").asText(tool.toString()));
                }
                JsonNode mcpServers = root.has("mcp_servers") ? root.get("mcp_servers") : mapper.createArrayNode();
                return Optional.of(new ProtocolEvent.SystemInit(text(root, "session_id"), List.copyOf(tools), mcpServers));
            }
            case "status":
                return Optional.of(new ProtocolEvent.SystemStatus(text(root, "status")));
            case "compact_boundary": {
                JsonNode meta = root.path("compact_metadata");
                Long preTokens = meta.path("pre_tokens").isNumber() ? meta.get("pre_tokens").asLong() : null;
                return Optional.of(new ProtocolEvent.CompactBoundary(text(meta, "trigger"), preTokens));
            }
            default:
                log.debug("Skipping system record with subtype '{}'", subtype);
                return Optional.empty();
        }
    }

    private Optional<ProtocolEvent> decodeAssistant(JsonNode root) {
        JsonNode message = root.path("message");
        List<ContentBlock> blocks = new ArrayList<>();
        for (JsonNode block : message.path("content")) {
            String blockType = block.path("type").asText("");
            if ("text".equals(blockType)) {
                blocks.add(new ContentBlock.Text(block.path("text").asText("")));
            } else if ("thinking".equals(blockType)) {
                blocks.add(new ContentBlock.Thinking(block.path("thinking").asText("")));
            } else if ("tool_use".equals(blockType)) {
                JsonNode input = block.path("input").isObject() ? block.get("input") : mapper.createObjectNode();
                blocks.add(new ContentBlock.ToolUse(text(block, "id"), block.path("name").asText(UNKNOWN_TOOL), input));
            }
        }
        TokenUsage usage = TokenUsage.fromJson(message.get("usage")).orElse(null);
        return Optional.of(new ProtocolEvent.AssistantMessage(List.copyOf(blocks), usage));
    }

    private Optional<ProtocolEvent> decodeToolResults(JsonNode root) {
        List<ToolResultBlock> results = new ArrayList<>();
        for (JsonNode block : root.path("message").path("content")) {
            if (!"tool_result".equals(block.path("type").asText())) {
                continue;
            }
            results.add(new ToolResultBlock(
                    text(block, "tool_use_id"),
                    resultContent(block.get("content")),
                    block.path("is_error").asBoolean(false)));
        }
        if (results.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ProtocolEvent.ToolResults(List.copyOf(results)));
    }

    private Optional<ProtocolEvent> decodeControlRequest(JsonNode root) {
        JsonNode request = root.path("request");
        if (!"can_use_tool".equals(request.path("subtype").asText())) {
            log.debug("Ignoring control request subtype '{}'", request.path("subtype").asText());
            return Optional.empty();
        }
        String requestId = text(root, "request_id");
        if (requestId == null) {
            return Optional.empty();
        }
        JsonNode input = request.path("input").isObject() ? request.get("input") : mapper.createObjectNode();
        String toolUseId = request.hasNonNull("tool_use_id") ? request.get("tool_use_id").asText() : requestId;
        return Optional.of(new ProtocolEvent.ControlRequest(
                requestId,
                request.hasNonNull("tool_name") ? request.get("tool_name").asText() : UNKNOWN_TOOL,
                input,
                toolUseId,
                request.get("permission_suggestions"),
                text(request, "decision_reason"),
                text(request, "blocked_path")));
    }

    private ProtocolEvent.Result decodeResult(JsonNode root) {
        return new ProtocolEvent.Result(
                text(root, "subtype"),
                text(root, "session_id"),
                root.path("total_cost_usd").isNumber() ? root.get("total_cost_usd").asDouble() : null,
                root.path("duration_ms").isNumber() ? root.get("duration_ms").asLong() : null,
                root.path("num_turns").isNumber() ? root.get("num_turns").asInt() : null,
                root.path("is_error").asBoolean(false),
                text(root, "result"));
    }

    private String resultContent(JsonNode content) {
        if (content == null || content.isNull() || content.isMissingNode()
                || (content.isTextual() && content.asText().isEmpty())) {
            return DEFAULT_TOOL_RESULT;
        }
        if (content.isTextual()) {
            return content.asText();
        }
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(content);
        } catch (JsonProcessingException e) {
            return content.toString();
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String abbreviate(String line) {
        return line.length() > 120 ? line.substring(0, 120) + "..." : line;
    }
}
