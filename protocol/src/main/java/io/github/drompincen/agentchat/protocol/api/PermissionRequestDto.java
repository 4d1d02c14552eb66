package io.github.drompincen.agentchat.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A tool permission question surfaced to the user.
 */
public record PermissionRequestDto(
        String conversationId,
        String requestId,
        String toolName,
        JsonNode input,
        String toolUseId,
        String suggestedPattern,
        JsonNode suggestions,
        String decisionReason,
        String blockedPath
) {}
