package io.github.drompincen.agentchat.protocol.wire;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Answer to a tool permission request. {@code updatedPermissions} is only set when the
 * user chose to always allow, and carries the agent's own suggestions back unchanged.
 */
public record ControlResponse(
        String requestId,
        boolean allow,
        JsonNode updatedInput,
        JsonNode updatedPermissions,
        String toolUseId
) {
    public static final String DENY_MESSAGE = "User denied permission";

    public static ControlResponse allow(String requestId, JsonNode updatedInput,
                                        JsonNode updatedPermissions, String toolUseId) {
        return new ControlResponse(requestId, true, updatedInput, updatedPermissions, toolUseId);
    }

    public static ControlResponse deny(String requestId, String toolUseId) {
        return new ControlResponse(requestId, false, null, null, toolUseId);
    }
}
