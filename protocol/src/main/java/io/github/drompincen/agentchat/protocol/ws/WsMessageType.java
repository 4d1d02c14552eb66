package io.github.drompincen.agentchat.protocol.ws;

public enum WsMessageType {
    // Client -> Server
    SUBSCRIBE_CONVERSATION,
    UNSUBSCRIBE,
    OPEN_CONVERSATION,
    SEND_MESSAGE,
    STOP,
    APPROVE_TOOL_CALL,
    DENY_TOOL_CALL,
    CLOSE_CONVERSATION,
    REWIND,
    FORK,
    SELECT_MODEL,

    // Server -> Client
    TRANSCRIPT,
    PERMISSION_REQUEST,
    SESSION_STATE,
    NOTICE,
    ERROR,
    SUBSCRIBED,
    UNSUBSCRIBED,
    BUSY;

    public static WsMessageType fromString(String value) {
        try {
            return valueOf(value);
        } catch (IllegalArgumentException | NullPointerException e) {
            return null;
        }
    }
}
