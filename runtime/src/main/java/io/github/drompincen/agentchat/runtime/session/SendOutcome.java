package io.github.drompincen.agentchat.runtime.session;

public enum SendOutcome {
    ACCEPTED,
    BUSY,
    UNKNOWN_CONVERSATION,
    EMPTY_MESSAGE
}
