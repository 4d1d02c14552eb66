package io.github.drompincen.agentchat.protocol.api;

public enum AgentErrorCategory {
    AGENT_NOT_INSTALLED,
    LOGIN_REQUIRED,
    PROCESS_ERROR
}
