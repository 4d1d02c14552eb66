package io.github.drompincen.agentchat.protocol.api;

import java.time.Instant;

public record PermissionPatternEntry(
        String toolName,
        String pattern,
        Instant createdAt
) {
    public boolean sameRule(String toolName, String pattern) {
        return this.toolName.equals(toolName) && this.pattern.equals(pattern);
    }
}
