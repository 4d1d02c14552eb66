package io.github.drompincen.agentchat.protocol.event;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Closed set of records the agent process writes to stdout, one per line.
 * Every event belongs to the single process invocation that produced it.
 */
public sealed interface ProtocolEvent permits
        ProtocolEvent.SystemInit,
        ProtocolEvent.SystemStatus,
        ProtocolEvent.CompactBoundary,
        ProtocolEvent.AssistantMessage,
        ProtocolEvent.ToolResults,
        ProtocolEvent.ControlRequest,
        ProtocolEvent.Result {

    record SystemInit(String sessionId, List<String> tools, JsonNode mcpServers) implements ProtocolEvent {}

    record SystemStatus(String status) implements ProtocolEvent {
        public boolean compacting() {
            return "compacting".equals(status);
        }
    }

    record CompactBoundary(String trigger, Long preTokens) implements ProtocolEvent {}

    record AssistantMessage(List<ContentBlock> content, TokenUsage usage) implements ProtocolEvent {}

    record ToolResults(List<ToolResultBlock> results) implements ProtocolEvent {}

    record ControlRequest(
            String requestId,
            String toolName,
            JsonNode input,
            String toolUseId,
            JsonNode permissionSuggestions,
            String decisionReason,
            String blockedPath
    ) implements ProtocolEvent {}

    record Result(
            String subtype,
            String sessionId,
            Double totalCostUsd,
            Long durationMs,
            Integer numTurns,
            boolean isError,
            String result
    ) implements ProtocolEvent {
        public boolean successful() {
            return "success".equals(subtype) && !isError;
        }
    }
}
