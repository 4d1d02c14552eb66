package io.github.drompincen.agentchat.protocol.ws;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record WsMessage(
        WsMessageType type,
        String conversationId,
        JsonNode payload,
        Instant ts
) {
    public static WsMessage of(WsMessageType type, String conversationId, JsonNode payload) {
        return new WsMessage(type, conversationId, payload, Instant.now());
    }

    public static WsMessage error(String conversationId, JsonNode payload) {
        return of(WsMessageType.ERROR, conversationId, payload);
    }
}
