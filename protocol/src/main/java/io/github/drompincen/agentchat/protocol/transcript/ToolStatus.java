package io.github.drompincen.agentchat.protocol.transcript;

public enum ToolStatus {
    EXECUTING, COMPLETED, FAILED
}
