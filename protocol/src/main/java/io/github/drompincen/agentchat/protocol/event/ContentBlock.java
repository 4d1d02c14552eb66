package io.github.drompincen.agentchat.protocol.event;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One block of an assistant message.
 */
public sealed interface ContentBlock permits ContentBlock.Text, ContentBlock.Thinking, ContentBlock.ToolUse {

    record Text(String text) implements ContentBlock {}

    record Thinking(String thinking) implements ContentBlock {}

    record ToolUse(String id, String name, JsonNode input) implements ContentBlock {}
}
