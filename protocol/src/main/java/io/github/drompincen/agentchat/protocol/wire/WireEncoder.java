package io.github.drompincen.agentchat.protocol.wire;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builds the single-line JSON records written to the agent's stdin.
 */
public class WireEncoder {

    private final ObjectMapper mapper;

    public WireEncoder() {
        this(new ObjectMapper());
    }

    public WireEncoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String userTurn(TurnPayload payload, String sessionId) {
        ObjectNode root = mapper.createObjectNode();
        root.put("type", "user");
        root.put("session_id", sessionId == null ? "" : sessionId);
        ObjectNode message = root.putObject("message");
        message.put("role", "user");
        ArrayNode content = message.putArray("content");
        content.addObject().put("type", "text").put("text", payload.text());
        for (ImageAttachment image : payload.images()) {
            ObjectNode block = content.addObject();
            block.put("type", "image");
            block.putObject("source")
                    .put("type", "base64")
                    .put("media_type", image.mediaType())
                    .put("data", image.base64Data());
        }
        root.putNull("parent_tool_use_id");
        return write(root);
    }

    public String controlResponse(ControlResponse response) {
        ObjectNode root = mapper.createObjectNode();
        root.put("type", "control_response");
        ObjectNode outer = root.putObject("response");
        outer.put("subtype", "success");
        outer.put("request_id", response.requestId());
        ObjectNode inner = outer.putObject("response");
        if (response.allow()) {
            inner.put("behavior", "allow");
            inner.set("updatedInput", response.updatedInput() == null
                    ? mapper.createObjectNode() : response.updatedInput());
            if (response.updatedPermissions() != null && !response.updatedPermissions().isNull()) {
                inner.set("updatedPermissions", response.updatedPermissions());
            }
        } else {
            inner.put("behavior", "deny");
            inner.put("message", ControlResponse.DENY_MESSAGE);
            inner.put("interrupt", true);
        }
        inner.put("toolUseID", response.toolUseId());
        return write(root);
    }

    private String write(ObjectNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + node.path("type").asText(), e);
        }
    }
}
