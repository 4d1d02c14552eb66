package io.github.drompincen.agentchat.runtime.session;

import io.github.drompincen.agentchat.persistence.store.ConversationStore;
import io.github.drompincen.agentchat.persistence.store.StoreException;
import io.github.drompincen.agentchat.persistence.store.StoredConversation;
import io.github.drompincen.agentchat.protocol.api.AgentErrorCategory;
import io.github.drompincen.agentchat.protocol.api.PermissionRequestDto;
import io.github.drompincen.agentchat.protocol.event.ContentBlock;
import io.github.drompincen.agentchat.protocol.event.ProtocolEvent;
import io.github.drompincen.agentchat.protocol.log.ConversationLogEntry;
import io.github.drompincen.agentchat.protocol.log.LogEntryType;
import io.github.drompincen.agentchat.protocol.transcript.ConversationEntry;
import io.github.drompincen.agentchat.protocol.wire.TurnPayload;
import io.github.drompincen.agentchat.runtime.config.EngineSettings;
import io.github.drompincen.agentchat.runtime.control.ControlRequestPolicy;
import io.github.drompincen.agentchat.runtime.control.PendingControlRequest;
import io.github.drompincen.agentchat.runtime.permission.PermissionPatternCache;
import io.github.drompincen.agentchat.runtime.process.AgentFailure;
import io.github.drompincen.agentchat.runtime.process.AgentLaunchOptions;
import io.github.drompincen.agentchat.runtime.process.AgentProcessSupervisor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TabSchedulerTest {

    private static final Instant NOW = Instant.parse("2025-04-01T09:00:00Z");
    private static final long RUN = 1L;

    @Mock
    private AgentProcessSupervisor supervisor;

    @Mock
    private ConversationStore conversationStore;

    @Mock
    private PermissionPatternCache patternCache;

    @Mock
    private ControlRequestPolicy policy;

    @Mock
    private ConversationEventSink sink;

    private final ObjectMapper mapper = new ObjectMapper();
    private TabScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new TabScheduler(supervisor, conversationStore, patternCache, policy,
                EngineSettings.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));
        scheduler.setSink(sink);
        lenient().when(supervisor.send(any(), any())).thenReturn(RUN);
    }

    private static ProtocolEvent.AssistantMessage say(String text) {
        return new ProtocolEvent.AssistantMessage(List.of(new ContentBlock.Text(text)), null);
    }

    private static ProtocolEvent.SystemInit init(String sessionId) {
        return new ProtocolEvent.SystemInit(sessionId, List.of(), null);
    }

    /** One finished exchange on {@code conversationId}. */
    private void exchange(String conversationId, String prompt, String answer) {
        assertThat(scheduler.trySend(conversationId, TurnPayload.text(prompt), TurnOptions.DEFAULT))
                .isEqualTo(SendOutcome.ACCEPTED);
        scheduler.onMessage(RUN, init("s-1"));
        scheduler.onMessage(RUN, say(answer));
        scheduler.onEnd(RUN);
    }

    @Test
    void registersAsSupervisorListener() {
        verify(supervisor).setListener(scheduler);
    }

    @Test
    void onlyOneConversationOwnsTheAgent() {
        ConversationSession a = scheduler.open();
        ConversationSession b = scheduler.open();

        assertThat(scheduler.trySend(a.id(), TurnPayload.text("one"), TurnOptions.DEFAULT)).isEqualTo(SendOutcome.ACCEPTED);
        assertThat(scheduler.trySend(b.id(), TurnPayload.text("two"), TurnOptions.DEFAULT)).isEqualTo(SendOutcome.BUSY);
        assertThat(scheduler.trySend(a.id(), TurnPayload.text("three"), TurnOptions.DEFAULT)).isEqualTo(SendOutcome.BUSY);

        verify(supervisor, times(1)).send(any(), any());
        assertThat(scheduler.owner()).contains(a.id());
        assertThat(b.log()).isEmpty();

        scheduler.onEnd(RUN);

        assertThat(scheduler.owner()).isEmpty();
        assertThat(scheduler.trySend(b.id(), TurnPayload.text("two"), TurnOptions.DEFAULT)).isEqualTo(SendOutcome.ACCEPTED);
    }

    @Test
    void rejectsUnknownConversationAndEmptyMessage() {
        ConversationSession a = scheduler.open();

        assertThat(scheduler.trySend("nope", TurnPayload.text("hi"), TurnOptions.DEFAULT))
                .isEqualTo(SendOutcome.UNKNOWN_CONVERSATION);
        assertThat(scheduler.trySend(a.id(), TurnPayload.text("   "), TurnOptions.DEFAULT))
                .isEqualTo(SendOutcome.EMPTY_MESSAGE);
        verify(supervisor, never()).send(any(), any());
    }

    @Test
    void supervisorStillBusyRollsBack() {
        ConversationSession a = scheduler.open();
        when(supervisor.send(any(), any())).thenThrow(new IllegalStateException("running"));

        assertThat(scheduler.trySend(a.id(), TurnPayload.text("hi"), TurnOptions.DEFAULT)).isEqualTo(SendOutcome.BUSY);

        assertThat(scheduler.owner()).isEmpty();
        assertThat(a.state().isProcessing()).isFalse();
        assertThat(a.log()).isEmpty();
        assertThat(a.title()).isEqualTo(ConversationSession.DEFAULT_TITLE);
        verify(sink, never()).transcriptChanged(anyString(), any());
    }

    @Test
    void notificationsOfStoppedRunDoNotReachNextOwner() {
        when(supervisor.send(any(), any())).thenReturn(1L, 2L);
        ConversationSession a = scheduler.open();
        ConversationSession b = scheduler.open();
        scheduler.trySend(a.id(), TurnPayload.text("one"), TurnOptions.DEFAULT);
        scheduler.stop(a.id());
        assertThat(scheduler.trySend(b.id(), TurnPayload.text("two"), TurnOptions.DEFAULT)).isEqualTo(SendOutcome.ACCEPTED);
        PendingControlRequest late = new PendingControlRequest("r9", "Bash",
                mapper.createObjectNode().put("command", "ls"), "tu9", null, null, null, "ls");

        scheduler.onMessage(1L, say("late"));
        scheduler.onControlRequest(1L, late);
        scheduler.onEnd(1L);
        scheduler.onError(1L, new AgentFailure(AgentErrorCategory.AGENT_NOT_INSTALLED, "Cannot run program"));

        assertThat(scheduler.owner()).contains(b.id());
        assertThat(b.state().isProcessing()).isTrue();
        assertThat(b.transcript()).singleElement().isInstanceOf(ConversationEntry.User.class);
        assertThat(a.transcript()).singleElement().isInstanceOf(ConversationEntry.User.class);
        verifyNoInteractions(policy);
        verify(sink, never()).failure(anyString(), any());

        scheduler.onMessage(2L, say("for b"));
        scheduler.onEnd(2L);

        assertThat(b.transcript()).hasSize(2);
        assertThat(scheduler.owner()).isEmpty();
    }

    @Test
    void failureOfEndedRunGoesToItsConversationEvenAfterNextSend() {
        when(supervisor.send(any(), any())).thenReturn(1L, 2L);
        ConversationSession a = scheduler.open();
        ConversationSession b = scheduler.open();
        scheduler.trySend(a.id(), TurnPayload.text("one"), TurnOptions.DEFAULT);
        scheduler.onEnd(1L);
        scheduler.trySend(b.id(), TurnPayload.text("two"), TurnOptions.DEFAULT);
        AgentFailure failure = new AgentFailure(AgentErrorCategory.PROCESS_ERROR, "exited with code 1");

        scheduler.onError(1L, failure);

        assertThat(a.transcript()).last().isInstanceOf(ConversationEntry.Error.class);
        assertThat(b.transcript()).singleElement().isInstanceOf(ConversationEntry.User.class);
        assertThat(scheduler.owner()).contains(b.id());
        assertThat(b.state().isProcessing()).isTrue();
        verify(sink).failure(a.id(), failure);
    }

    @Test
    void staleFailureDoesNotSwallowFailureOfEndedRun() {
        when(supervisor.send(any(), any())).thenReturn(1L, 2L);
        ConversationSession a = scheduler.open();
        ConversationSession b = scheduler.open();
        scheduler.trySend(a.id(), TurnPayload.text("one"), TurnOptions.DEFAULT);
        scheduler.stop(a.id());
        scheduler.trySend(b.id(), TurnPayload.text("two"), TurnOptions.DEFAULT);
        AgentFailure failure = new AgentFailure(AgentErrorCategory.PROCESS_ERROR, "exited with code 2");

        scheduler.onEnd(2L);
        scheduler.onError(1L, new AgentFailure(AgentErrorCategory.AGENT_NOT_INSTALLED, "Cannot run program"));
        scheduler.onError(2L, failure);

        assertThat(b.transcript()).last().isInstanceOf(ConversationEntry.Error.class);
        assertThat(a.transcript()).singleElement().isInstanceOf(ConversationEntry.User.class);
        verify(sink).failure(b.id(), failure);
        verify(sink, never()).failure(eq(a.id()), any());
    }

    @Test
    void sendRecordsUserInputAndLaunchOptions() {
        ConversationSession a = scheduler.open();
        scheduler.setAutoApprove(true);

        scheduler.trySend(a.id(), TurnPayload.text("Refactor the parser"), new TurnOptions(true, false));

        ArgumentCaptor<AgentLaunchOptions> options = ArgumentCaptor.forClass(AgentLaunchOptions.class);
        verify(supervisor).send(eq(TurnPayload.text("Refactor the parser")), options.capture());
        assertThat(options.getValue().planMode()).isTrue();
        assertThat(options.getValue().skipPermissions()).isTrue();
        assertThat(options.getValue().agentSessionId()).isNull();
        assertThat(a.state().isProcessing()).isTrue();
        assertThat(a.title()).isEqualTo("Refactor the parser");
        assertThat(a.transcript()).singleElement().isInstanceOf(ConversationEntry.User.class);
        verify(sink, atLeastOnce()).transcriptChanged(eq(a.id()), any());
    }

    @Test
    void nextTurnResumesAgentSession() {
        ConversationSession a = scheduler.open();
        exchange(a.id(), "first", "ok");

        scheduler.trySend(a.id(), TurnPayload.text("second"), TurnOptions.DEFAULT);

        ArgumentCaptor<AgentLaunchOptions> options = ArgumentCaptor.forClass(AgentLaunchOptions.class);
        verify(supervisor, times(2)).send(any(), options.capture());
        assertThat(options.getAllValues().get(1).agentSessionId()).isEqualTo("s-1");
    }

    @Test
    void eventsGoToTheOwner() {
        ConversationSession a = scheduler.open();
        ConversationSession b = scheduler.open();
        scheduler.trySend(a.id(), TurnPayload.text("hi"), TurnOptions.DEFAULT);

        scheduler.onMessage(RUN, say("Hello there"));

        assertThat(a.transcript()).hasSize(2);
        assertThat(((ConversationEntry.Assistant) a.transcript().get(1)).content()).isEqualTo("Hello there");
        assertThat(b.transcript()).isEmpty();
    }

    @Test
    void eventsWithoutOwnerAreDropped() {
        ConversationSession a = scheduler.open();

        scheduler.onMessage(RUN, say("stray"));

        assertThat(a.log()).isEmpty();
    }

    @Test
    void endSavesConversationWithAgentSession() {
        ConversationSession a = scheduler.open();

        exchange(a.id(), "hi", "Hello");

        ArgumentCaptor<StoredConversation> stored = ArgumentCaptor.forClass(StoredConversation.class);
        verify(conversationStore).save(stored.capture());
        assertThat(stored.getValue().agentSessionId()).isEqualTo("s-1");
        assertThat(stored.getValue().endTime()).isEqualTo(NOW);
        assertThat(stored.getValue().messages()).extracting(ConversationLogEntry::type)
                .containsExactly(LogEntryType.USER_INPUT, LogEntryType.SESSION_INFO, LogEntryType.OUTPUT);
        assertThat(a.state().isProcessing()).isFalse();
    }

    @Test
    void endWithoutAgentSessionIsNotSaved() {
        ConversationSession a = scheduler.open();
        scheduler.trySend(a.id(), TurnPayload.text("hi"), TurnOptions.DEFAULT);

        scheduler.onEnd(RUN);

        verify(conversationStore, never()).save(any());
    }

    @Test
    void saveFailureDoesNotBreakTheTurn() {
        ConversationSession a = scheduler.open();
        doThrow(new StoreException("down", null)).when(conversationStore).save(any());

        exchange(a.id(), "hi", "Hello");

        assertThat(scheduler.owner()).isEmpty();
        assertThat(a.state().isProcessing()).isFalse();
    }

    @Test
    void errorIsRecordedOnEndedConversationWithPermissionTip() {
        ConversationSession a = scheduler.open();
        scheduler.trySend(a.id(), TurnPayload.text("delete it"), TurnOptions.DEFAULT);
        AgentFailure failure = new AgentFailure(AgentErrorCategory.PROCESS_ERROR, "Permission denied for Bash");

        scheduler.onEnd(RUN);
        scheduler.onError(RUN, failure);

        assertThat(a.transcript()).last().isInstanceOf(ConversationEntry.Error.class);
        verify(sink).failure(a.id(), failure);
        verify(sink).notice(a.id(), TabScheduler.PERMISSION_TIP);
    }

    @Test
    void noPermissionTipInAutoApproveMode() {
        ConversationSession a = scheduler.open();
        scheduler.setAutoApprove(true);
        scheduler.trySend(a.id(), TurnPayload.text("hi"), TurnOptions.DEFAULT);

        scheduler.onEnd(RUN);
        scheduler.onError(RUN, new AgentFailure(AgentErrorCategory.PROCESS_ERROR, "permission denied"));

        verify(sink, never()).notice(anyString(), anyString());
    }

    @Test
    void controlRequestIsForwardedWhenUserMustDecide() {
        ConversationSession a = scheduler.open();
        scheduler.trySend(a.id(), TurnPayload.text("install"), TurnOptions.DEFAULT);
        ObjectNode input = mapper.createObjectNode().put("command", "npm install lodash");
        PendingControlRequest request = new PendingControlRequest("r1", "Bash", input, "tu1",
                null, null, null, "npm install *");
        when(policy.decide(request, false)).thenReturn(ControlRequestPolicy.Decision.ASK_USER);

        scheduler.onControlRequest(RUN, request);

        ArgumentCaptor<PermissionRequestDto> dto = ArgumentCaptor.forClass(PermissionRequestDto.class);
        verify(sink).permissionRequested(dto.capture());
        assertThat(dto.getValue().conversationId()).isEqualTo(a.id());
        assertThat(dto.getValue().suggestedPattern()).isEqualTo("npm install *");
        assertThat(a.log()).last().extracting(ConversationLogEntry::type).isEqualTo(LogEntryType.PERMISSION_REQUEST);
        verify(supervisor, never()).respondToControl(anyString(), anyBoolean(), anyBoolean());
    }

    @Test
    void preApprovedControlRequestIsAnsweredDirectly() {
        ConversationSession a = scheduler.open();
        scheduler.trySend(a.id(), TurnPayload.text("status"), TurnOptions.DEFAULT);
        PendingControlRequest request = new PendingControlRequest("r2", "Bash",
                mapper.createObjectNode().put("command", "git status"), "tu2", null, null, null, "git status");
        when(policy.decide(request, false)).thenReturn(ControlRequestPolicy.Decision.PRE_APPROVED);

        scheduler.onControlRequest(RUN, request);

        verify(supervisor).respondToControl("r2", true, false);
        verify(sink, never()).permissionRequested(any());
    }

    @Test
    void alwaysAllowRemembersSuggestedPattern() {
        PendingControlRequest request = new PendingControlRequest("r1", "Bash",
                mapper.createObjectNode().put("command", "npm install lodash"), "tu1", null, null, null, "npm install *");
        when(supervisor.respondToControl("r1", true, true)).thenReturn(Optional.of(request));

        assertThat(scheduler.respond("r1", true, true)).isTrue();

        verify(patternCache).add("Bash", "npm install *");
    }

    @Test
    void plainApprovalAndUnknownRequestsDoNotTouchPatterns() {
        when(supervisor.respondToControl("gone", true, true)).thenReturn(Optional.empty());

        assertThat(scheduler.respond("gone", true, true)).isFalse();

        verifyNoInteractions(patternCache);
    }

    @Test
    void stopIsOnlyForTheOwner() {
        ConversationSession a = scheduler.open();
        ConversationSession b = scheduler.open();
        scheduler.trySend(a.id(), TurnPayload.text("long"), TurnOptions.DEFAULT);

        assertThat(scheduler.stop(b.id())).isFalse();
        verify(supervisor, never()).stop();

        assertThat(scheduler.stop(a.id())).isTrue();
        verify(supervisor).stop();
        assertThat(scheduler.owner()).isEmpty();
        assertThat(a.state().isProcessing()).isFalse();
    }

    @Test
    void closingNonOwnerLeavesAgentAlone() {
        ConversationSession a = scheduler.open();
        ConversationSession b = scheduler.open();
        scheduler.trySend(a.id(), TurnPayload.text("long"), TurnOptions.DEFAULT);

        assertThat(scheduler.close(b.id())).isTrue();

        verify(supervisor, never()).stop();
        assertThat(scheduler.owner()).contains(a.id());
        assertThat(scheduler.get(b.id())).isEmpty();
    }

    @Test
    void closingOwnerStopsAgent() {
        ConversationSession a = scheduler.open();
        scheduler.trySend(a.id(), TurnPayload.text("long"), TurnOptions.DEFAULT);

        assertThat(scheduler.close(a.id())).isTrue();

        verify(supervisor).stop();
        assertThat(scheduler.owner()).isEmpty();
        assertThat(scheduler.close(a.id())).isFalse();
    }

    @Test
    void rewindDropsLaterExchangesAndStartsNewAgentSession() {
        ConversationSession a = scheduler.open();
        exchange(a.id(), "first", "one");
        exchange(a.id(), "second", "two");

        assertThat(scheduler.rewind(a.id(), 1)).isTrue();

        assertThat(a.log()).extracting(ConversationLogEntry::type)
                .containsExactly(LogEntryType.USER_INPUT, LogEntryType.SESSION_INFO, LogEntryType.OUTPUT);
        assertThat(a.state().agentSessionId()).isNull();
        assertThat(a.transcript()).hasSize(2);
    }

    @Test
    void rewindIsRefusedWhileProcessingAndRejectsBadIndex() {
        ConversationSession a = scheduler.open();
        ConversationSession b = scheduler.open();
        scheduler.trySend(a.id(), TurnPayload.text("busy"), TurnOptions.DEFAULT);

        assertThat(scheduler.rewind(a.id(), 0)).isFalse();
        assertThatThrownBy(() -> scheduler.rewind(b.id(), 0)).isInstanceOf(IllegalArgumentException.class);
        verify(supervisor, never()).stop();
    }

    @Test
    void editAndResendReplacesTheTurn() {
        ConversationSession a = scheduler.open();
        exchange(a.id(), "frist", "huh?");

        assertThat(scheduler.editAndResend(a.id(), 0, TurnPayload.text("first"), TurnOptions.DEFAULT))
                .isEqualTo(SendOutcome.ACCEPTED);

        assertThat(a.log()).singleElement().extracting(ConversationLogEntry::dataAsText).isEqualTo("first");
        assertThat(a.state().isProcessing()).isTrue();
        ArgumentCaptor<AgentLaunchOptions> options = ArgumentCaptor.forClass(AgentLaunchOptions.class);
        verify(supervisor, times(2)).send(any(), options.capture());
        assertThat(options.getAllValues().get(1).agentSessionId()).isNull();
    }

    @Test
    void editAndResendWhileAnotherConversationRunsKeepsHistory() {
        ConversationSession a = scheduler.open();
        ConversationSession b = scheduler.open();
        exchange(a.id(), "first", "one");
        scheduler.trySend(b.id(), TurnPayload.text("busy"), TurnOptions.DEFAULT);

        assertThat(scheduler.editAndResend(a.id(), 0, TurnPayload.text("edited"), TurnOptions.DEFAULT))
                .isEqualTo(SendOutcome.BUSY);

        assertThat(a.log()).hasSize(3);
        assertThat(a.log().get(0).dataAsText()).isEqualTo("first");
        assertThat(a.state().agentSessionId()).isEqualTo("s-1");
        assertThat(scheduler.owner()).contains(b.id());
    }

    @Test
    void editAndResendRejectedByAgentKeepsHistory() {
        ConversationSession a = scheduler.open();
        exchange(a.id(), "first", "one");
        when(supervisor.send(any(), any())).thenThrow(new IllegalStateException("running"));

        assertThat(scheduler.editAndResend(a.id(), 0, TurnPayload.text("edited"), TurnOptions.DEFAULT))
                .isEqualTo(SendOutcome.BUSY);

        assertThat(a.log()).hasSize(3);
        assertThat(a.state().agentSessionId()).isEqualTo("s-1");
        assertThat(scheduler.owner()).isEmpty();
    }

    @Test
    void editAndResendChecksConversationMessageAndIndex() {
        ConversationSession a = scheduler.open();
        exchange(a.id(), "first", "one");

        assertThat(scheduler.editAndResend("missing", 0, TurnPayload.text("x"), TurnOptions.DEFAULT))
                .isEqualTo(SendOutcome.UNKNOWN_CONVERSATION);
        assertThat(scheduler.editAndResend(a.id(), 0, TurnPayload.text(" "), TurnOptions.DEFAULT))
                .isEqualTo(SendOutcome.EMPTY_MESSAGE);
        assertThatThrownBy(() -> scheduler.editAndResend(a.id(), 5, TurnPayload.text("x"), TurnOptions.DEFAULT))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(a.log()).hasSize(3);
    }

    @Test
    void forkCopiesHistoryUpToExchange() {
        ConversationSession a = scheduler.open();
        exchange(a.id(), "first", "one");
        exchange(a.id(), "second", "two");

        ConversationSession fork = scheduler.fork(a.id(), 0).orElseThrow();

        assertThat(fork.id()).isNotEqualTo(a.id());
        assertThat(fork.title()).isEqualTo("first (fork)");
        assertThat(fork.log()).hasSize(3);
        assertThat(fork.state().agentSessionId()).isNull();
        assertThat(a.log()).hasSize(6);
        assertThat(scheduler.list()).hasSize(2);
        verify(supervisor, times(2)).send(any(), any());
    }

    @Test
    void forkOfLastExchangeCopiesEverything() {
        ConversationSession a = scheduler.open();
        exchange(a.id(), "only", "answer");

        assertThat(scheduler.fork(a.id(), 0).orElseThrow().log()).isEqualTo(a.log());
        assertThat(scheduler.fork("missing", 0)).isEmpty();
    }

    @Test
    void openStoredRestoresTranscriptAndCounters() {
        StoredConversation stored = new StoredConversation("conv-1", "s-5", "Old chat", NOW, NOW, 0.3, 100, 40,
                List.of(ConversationLogEntry.userInput(NOW, "hello"), ConversationLogEntry.output(NOW, "hi!", true)));
        when(conversationStore.load("conv-1")).thenReturn(Optional.of(stored));

        ConversationSession session = scheduler.openStored("conv-1").orElseThrow();

        assertThat(session.title()).isEqualTo("Old chat");
        assertThat(session.transcript()).hasSize(2);
        assertThat(session.state().agentSessionId()).isEqualTo("s-5");
        assertThat(session.state().totals().inputTokens()).isEqualTo(100);
        assertThat(scheduler.openStored("conv-1")).containsSame(session);
        verify(conversationStore, times(1)).load("conv-1");
    }

    @Test
    void selectModelUpdatesState() {
        ConversationSession a = scheduler.open();

        assertThat(scheduler.selectModel(a.id(), "sonnet")).isTrue();
        assertThat(scheduler.selectModel("missing", "sonnet")).isFalse();

        assertThat(a.state().selectedModel()).isEqualTo("sonnet");
    }
}
