package io.github.drompincen.agentchat.gateway.websocket;

import io.github.drompincen.agentchat.protocol.api.PermissionRequestDto;
import io.github.drompincen.agentchat.protocol.api.SendMessageRequest;
import io.github.drompincen.agentchat.protocol.api.SessionStateDto;
import io.github.drompincen.agentchat.protocol.transcript.ConversationEntry;
import io.github.drompincen.agentchat.protocol.wire.ImageAttachment;
import io.github.drompincen.agentchat.protocol.wire.TurnPayload;
import io.github.drompincen.agentchat.protocol.ws.WsMessage;
import io.github.drompincen.agentchat.protocol.ws.WsMessageType;
import io.github.drompincen.agentchat.runtime.process.AgentFailure;
import io.github.drompincen.agentchat.runtime.session.ConversationEventSink;
import io.github.drompincen.agentchat.runtime.session.ConversationSession;
import io.github.drompincen.agentchat.runtime.session.SendOutcome;
import io.github.drompincen.agentchat.runtime.session.TabScheduler;
import io.github.drompincen.agentchat.runtime.session.TurnOptions;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * The chat client's channel: envelopes {@code {type, conversationId, payload}} in, scheduler
 * notifications out to every socket subscribed to the conversation.
 */
@Component
public class AgentChatWebSocketHandler extends TextWebSocketHandler implements ConversationEventSink {

    private static final Logger log = LoggerFactory.getLogger(AgentChatWebSocketHandler.class);

    private final ObjectMapper objectMapper;
    private final TabScheduler scheduler;
    private final Map<String, Set<WebSocketSession>> subscriptions = new ConcurrentHashMap<>();

    public AgentChatWebSocketHandler(ObjectMapper objectMapper, TabScheduler scheduler) {
        this.objectMapper = objectMapper;
        this.scheduler = scheduler;
    }

    @PostConstruct
    public void init() {
        scheduler.setSink(this);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        subscriptions.values().forEach(set -> set.remove(session));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        JsonNode node = objectMapper.readTree(message.getPayload());
        WsMessageType type = WsMessageType.fromString(node.path("type").asText());
        String conversationId = node.hasNonNull("conversationId") ? node.get("conversationId").asText() : null;
        JsonNode payload = node.path("payload");

        if (type == null) {
            reply(session, WsMessage.error(conversationId, text("Unknown message type: " + node.path("type").asText())));
            return;
        }
        try {
            dispatch(session, type, conversationId, payload);
        } catch (IllegalArgumentException e) {
            reply(session, WsMessage.error(conversationId, text(e.getMessage())));
        }
    }

    private void dispatch(WebSocketSession session, WsMessageType type, String conversationId, JsonNode payload)
            throws IOException {
        switch (type) {
            case SUBSCRIBE_CONVERSATION: {
                Optional<ConversationSession> conversation = scheduler.get(conversationId);
                if (conversation.isEmpty()) {
                    reply(session, WsMessage.error(conversationId, text("Unknown conversation")));
                    return;
                }
                subscribe(session, conversation.get());
                break;
            }
            case UNSUBSCRIBE: {
                Set<WebSocketSession> set = conversationId == null ? null : subscriptions.get(conversationId);
                if (set != null) {
                    set.remove(session);
                }
                reply(session, WsMessage.of(WsMessageType.UNSUBSCRIBED, conversationId, null));
                break;
            }
            case OPEN_CONVERSATION: {
                Optional<ConversationSession> conversation = conversationId == null
                        ? Optional.of(scheduler.open())
                        : scheduler.openStored(conversationId);
                if (conversation.isEmpty()) {
                    reply(session, WsMessage.error(conversationId, text("Conversation not found")));
                    return;
                }
                subscribe(session, conversation.get());
                break;
            }
            case SEND_MESSAGE: {
                if (!payload.isObject()) {
                    reply(session, WsMessage.error(conversationId, text("Message is empty")));
                    return;
                }
                SendMessageRequest request = objectMapper.treeToValue(payload, SendMessageRequest.class);
                SendOutcome outcome = scheduler.trySend(conversationId, toTurnPayload(request),
                        new TurnOptions(request.planMode(), request.thinkingMode()));
                if (outcome == SendOutcome.BUSY) {
                    reply(session, WsMessage.of(WsMessageType.BUSY, conversationId,
                            text("Another conversation is still running")));
                } else if (outcome == SendOutcome.UNKNOWN_CONVERSATION) {
                    reply(session, WsMessage.error(conversationId, text("Unknown conversation")));
                } else if (outcome == SendOutcome.EMPTY_MESSAGE) {
                    reply(session, WsMessage.error(conversationId, text("Message is empty")));
                }
                break;
            }
            case STOP:
                if (!scheduler.stop(conversationId)) {
                    log.debug("Stop for {} ignored, it is not running", conversationId);
                }
                break;
            case APPROVE_TOOL_CALL:
                scheduler.respond(payload.path("requestId").asText(null), true,
                        payload.path("alwaysAllow").asBoolean(false));
                break;
            case DENY_TOOL_CALL:
                scheduler.respond(payload.path("requestId").asText(null), false, false);
                break;
            case CLOSE_CONVERSATION:
                if (conversationId != null && scheduler.close(conversationId)) {
                    subscriptions.remove(conversationId);
                }
                break;
            case REWIND: {
                int index = payload.path("userInputIndex").asInt(-1);
                if (payload.hasNonNull("content")) {
                    SendOutcome outcome = scheduler.editAndResend(conversationId, index,
                            TurnPayload.text(payload.get("content").asText()), TurnOptions.DEFAULT);
                    if (outcome != SendOutcome.ACCEPTED) {
                        reply(session, WsMessage.of(WsMessageType.BUSY, conversationId, text(outcome.name())));
                    }
                } else if (!scheduler.rewind(conversationId, index)) {
                    reply(session, WsMessage.of(WsMessageType.BUSY, conversationId,
                            text("Cannot rewind while the conversation is running")));
                }
                break;
            }
            case FORK: {
                Optional<ConversationSession> fork = scheduler.fork(conversationId, payload.path("userInputIndex").asInt(-1));
                if (fork.isEmpty()) {
                    reply(session, WsMessage.error(conversationId, text("Unknown conversation")));
                    return;
                }
                subscribe(session, fork.get());
                break;
            }
            case SELECT_MODEL:
                scheduler.selectModel(conversationId, payload.path("model").asText(null));
                break;
            default:
                reply(session, WsMessage.error(conversationId, text("Unexpected message type: " + type)));
                break;
        }
    }

    // ConversationEventSink

    @Override
    public void transcriptChanged(String conversationId, List<ConversationEntry> transcript) {
        broadcast(WsMessage.of(WsMessageType.TRANSCRIPT, conversationId, objectMapper.valueToTree(transcript)));
    }

    @Override
    public void permissionRequested(PermissionRequestDto request) {
        broadcast(WsMessage.of(WsMessageType.PERMISSION_REQUEST, request.conversationId(),
                objectMapper.valueToTree(request)));
    }

    @Override
    public void stateChanged(SessionStateDto state) {
        broadcast(WsMessage.of(WsMessageType.SESSION_STATE, state.conversationId(), objectMapper.valueToTree(state)));
    }

    @Override
    public void notice(String conversationId, String message) {
        broadcast(WsMessage.of(WsMessageType.NOTICE, conversationId, text(message)));
    }

    @Override
    public void failure(String conversationId, AgentFailure failure) {
        ObjectNode payload = text(failure.message());
        payload.put("category", failure.category().name());
        broadcast(WsMessage.error(conversationId, payload));
    }

    static TurnPayload toTurnPayload(SendMessageRequest request) {
        StringBuilder text = new StringBuilder(request.content() == null ? "" : request.content());
        List<ImageAttachment> images = new ArrayList<>();
        if (request.parts() != null) {
            for (SendMessageRequest.ContentPart part : request.parts()) {
                if ("image".equals(part.type())) {
                    ImageAttachment.fromDataUrl(part.data())
                            .or(() -> part.mediaType() != null && part.data() != null
                                    ? Optional.of(new ImageAttachment(part.mediaType(), part.data()))
                                    : Optional.empty())
                            .ifPresent(images::add);
                } else if ("text".equals(part.type()) && part.text() != null) {
                    if (text.length() > 0) {
                        text.append('\n');
                    }
                    text.append(part.text());
                }
            }
        }
        return new TurnPayload(text.toString(), images);
    }

    private void subscribe(WebSocketSession session, ConversationSession conversation) throws IOException {
        subscriptions.computeIfAbsent(conversation.id(), k -> new CopyOnWriteArraySet<>()).add(session);
        ObjectNode ack = objectMapper.createObjectNode();
        ack.put("title", conversation.title());
        reply(session, WsMessage.of(WsMessageType.SUBSCRIBED, conversation.id(), ack));
        reply(session, WsMessage.of(WsMessageType.TRANSCRIPT, conversation.id(),
                objectMapper.valueToTree(conversation.transcript())));
        reply(session, WsMessage.of(WsMessageType.SESSION_STATE, conversation.id(),
                objectMapper.valueToTree(conversation.state().snapshot(conversation.id()))));
    }

    private void broadcast(WsMessage message) {
        Set<WebSocketSession> subscribers = subscriptions.get(message.conversationId());
        if (subscribers == null || subscribers.isEmpty()) {
            return;
        }
        TextMessage tm;
        try {
            tm = new TextMessage(objectMapper.writeValueAsString(message));
        } catch (IOException e) {
            log.error("Could not encode {} for {}", message.type(), message.conversationId(), e);
            return;
        }
        for (WebSocketSession ws : subscribers) {
            if (ws.isOpen()) {
                send(ws, tm);
            }
        }
    }

    private void reply(WebSocketSession session, WsMessage message) throws IOException {
        send(session, new TextMessage(objectMapper.writeValueAsString(message)));
    }

    private void send(WebSocketSession ws, TextMessage tm) {
        // scheduler callbacks and request handling may write to the same socket
        synchronized (ws) {
            try {
                ws.sendMessage(tm);
            } catch (IOException e) {
                log.warn("Dropping message to socket {}: {}", ws.getId(), e.getMessage());
            }
        }
    }

    private ObjectNode text(String message) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("message", message);
        return node;
    }
}
