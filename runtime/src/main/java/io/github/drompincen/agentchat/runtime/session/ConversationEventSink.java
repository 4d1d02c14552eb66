package io.github.drompincen.agentchat.runtime.session;

import io.github.drompincen.agentchat.protocol.api.PermissionRequestDto;
import io.github.drompincen.agentchat.protocol.api.SessionStateDto;
import io.github.drompincen.agentchat.protocol.transcript.ConversationEntry;
import io.github.drompincen.agentchat.runtime.process.AgentFailure;

import java.util.List;

/**
 * Where the scheduler reports conversation changes to the host.
 */
public interface ConversationEventSink {

    ConversationEventSink NONE = new ConversationEventSink() {};

    default void transcriptChanged(String conversationId, List<ConversationEntry> transcript) {}

    default void permissionRequested(PermissionRequestDto request) {}

    default void stateChanged(SessionStateDto state) {}

    default void notice(String conversationId, String message) {}

    default void failure(String conversationId, AgentFailure failure) {}
}
