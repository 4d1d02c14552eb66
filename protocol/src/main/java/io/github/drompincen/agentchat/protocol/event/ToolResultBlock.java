package io.github.drompincen.agentchat.protocol.event;

public record ToolResultBlock(
        String toolUseId,
        String content,
        boolean isError
) {}
