package io.github.drompincen.agentchat.runtime.control;

import io.github.drompincen.agentchat.protocol.event.ProtocolEvent;
import io.github.drompincen.agentchat.runtime.permission.PermissionPatternCache;
import com.fasterxml.jackson.databind.JsonNode;

public record PendingControlRequest(
        String requestId,
        String toolName,
        JsonNode input,
        String toolUseId,
        JsonNode suggestions,
        String decisionReason,
        String blockedPath,
        String suggestedPattern
) {
    public static PendingControlRequest from(ProtocolEvent.ControlRequest request) {
        return new PendingControlRequest(
                request.requestId(),
                request.toolName(),
                request.input(),
                request.toolUseId(),
                request.permissionSuggestions(),
                request.decisionReason(),
                request.blockedPath(),
                PermissionPatternCache.suggestPattern(request.toolName(), request.input()).orElse(null));
    }
}
