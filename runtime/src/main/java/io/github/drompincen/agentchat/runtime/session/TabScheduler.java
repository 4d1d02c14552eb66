package io.github.drompincen.agentchat.runtime.session;

import io.github.drompincen.agentchat.persistence.store.ConversationStore;
import io.github.drompincen.agentchat.persistence.store.StoreException;
import io.github.drompincen.agentchat.protocol.api.AgentErrorCategory;
import io.github.drompincen.agentchat.protocol.api.PermissionRequestDto;
import io.github.drompincen.agentchat.protocol.event.ProtocolEvent;
import io.github.drompincen.agentchat.protocol.log.ConversationLogEntry;
import io.github.drompincen.agentchat.protocol.wire.TurnPayload;
import io.github.drompincen.agentchat.runtime.config.EngineSettings;
import io.github.drompincen.agentchat.runtime.control.ControlRequestPolicy;
import io.github.drompincen.agentchat.runtime.control.PendingControlRequest;
import io.github.drompincen.agentchat.runtime.permission.PermissionPatternCache;
import io.github.drompincen.agentchat.runtime.process.AgentFailure;
import io.github.drompincen.agentchat.runtime.process.AgentLaunchOptions;
import io.github.drompincen.agentchat.runtime.process.AgentProcessListener;
import io.github.drompincen.agentchat.runtime.process.AgentProcessSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Shares the single agent process between open conversations. A conversation must take
 * the exclusivity token to send a turn; it keeps the token until the process ends or the
 * turn is stopped. Supervisor notifications are routed by run number: only the run the
 * token was taken for reaches the owner, anything from an abandoned run is dropped.
 */
@Service
public class TabScheduler implements AgentProcessListener {

    private static final Logger log = LoggerFactory.getLogger(TabScheduler.class);

    static final String PERMISSION_TIP = "Enable auto-approve mode to skip permission prompts.";

    private final AgentProcessSupervisor supervisor;
    private final ConversationStore conversationStore;
    private final PermissionPatternCache patternCache;
    private final ControlRequestPolicy policy;
    private final EngineSettings settings;
    private final Clock clock;
    private final Map<String, ConversationSession> conversations = new LinkedHashMap<>();

    private volatile ConversationEventSink sink = ConversationEventSink.NONE;
    private volatile boolean autoApprove;
    private String owner;
    private long ownerRun;
    private String endedOwner;
    private long endedRun;

    @Autowired
    public TabScheduler(AgentProcessSupervisor supervisor, ConversationStore conversationStore,
                        PermissionPatternCache patternCache, ControlRequestPolicy policy, EngineSettings settings) {
        this(supervisor, conversationStore, patternCache, policy, settings, Clock.systemUTC());
    }

    TabScheduler(AgentProcessSupervisor supervisor, ConversationStore conversationStore,
                 PermissionPatternCache patternCache, ControlRequestPolicy policy, EngineSettings settings,
                 Clock clock) {
        this.supervisor = supervisor;
        this.conversationStore = conversationStore;
        this.patternCache = patternCache;
        this.policy = policy;
        this.settings = settings;
        this.clock = clock;
        this.autoApprove = settings.autoApprove();
        supervisor.setListener(this);
    }

    public void setSink(ConversationEventSink sink) {
        this.sink = sink == null ? ConversationEventSink.NONE : sink;
    }

    public boolean isAutoApprove() {
        return autoApprove;
    }

    public void setAutoApprove(boolean autoApprove) {
        this.autoApprove = autoApprove;
        log.info("Auto-approve mode {}", autoApprove ? "enabled" : "disabled");
    }

    // Conversations

    public synchronized ConversationSession open() {
        ConversationSession session = new ConversationSession("conv-" + UUID.randomUUID(), null, clock.instant(), clock);
        conversations.put(session.id(), session);
        log.debug("Opened conversation {}", session.id());
        return session;
    }

    /** Opens a stored conversation, or returns it if it is already open. */
    public synchronized Optional<ConversationSession> openStored(String conversationId) {
        ConversationSession existing = conversations.get(conversationId);
        if (existing != null) {
            return Optional.of(existing);
        }
        return conversationStore.load(conversationId).map(stored -> {
            ConversationSession session = ConversationSession.fromStored(stored, clock);
            conversations.put(session.id(), session);
            log.info("Restored conversation {} with {} log entries", session.id(), stored.messages().size());
            return session;
        });
    }

    public synchronized Optional<ConversationSession> get(String conversationId) {
        return Optional.ofNullable(conversations.get(conversationId));
    }

    public synchronized List<ConversationSession> list() {
        return new ArrayList<>(conversations.values());
    }

    public synchronized Optional<String> owner() {
        return Optional.ofNullable(owner);
    }

    /**
     * Closes a conversation. Closing the owner stops the running turn; any other
     * conversation is dropped without touching the agent process.
     */
    public boolean close(String conversationId) {
        ConversationSession session;
        boolean wasOwner;
        synchronized (this) {
            session = conversations.remove(conversationId);
            if (session == null) {
                return false;
            }
            wasOwner = owner != null && owner.equals(conversationId);
            if (wasOwner) {
                stopOwner(session);
            }
        }
        if (wasOwner) {
            save(session);
        }
        log.debug("Closed conversation {}", conversationId);
        return true;
    }

    // Turns

    public SendOutcome trySend(String conversationId, TurnPayload payload, TurnOptions options) {
        ConversationSession session;
        synchronized (this) {
            session = conversations.get(conversationId);
            if (session == null) {
                return SendOutcome.UNKNOWN_CONVERSATION;
            }
            if (payload == null || payload.isEmpty()) {
                return SendOutcome.EMPTY_MESSAGE;
            }
            if (owner != null) {
                log.debug("Send from {} rejected, {} owns the agent", conversationId, owner);
                return SendOutcome.BUSY;
            }
            SendOutcome outcome = startTurn(session, payload, options, -1);
            if (outcome != SendOutcome.ACCEPTED) {
                return outcome;
            }
        }
        publish(session);
        return SendOutcome.ACCEPTED;
    }

    /** Stops the turn of {@code conversationId}; false if that conversation does not own the agent. */
    public boolean stop(String conversationId) {
        ConversationSession session;
        synchronized (this) {
            if (owner == null || !owner.equals(conversationId)) {
                return false;
            }
            session = conversations.get(conversationId);
            stopOwner(session);
        }
        log.info("Stopped turn of conversation {}", conversationId);
        save(session);
        publish(session);
        return true;
    }

    /**
     * Drops the log from the n-th (0-based) user input on and starts a fresh agent session.
     * Refused while the conversation has a turn in flight.
     */
    public boolean rewind(String conversationId, int userInputIndex) {
        ConversationSession session;
        synchronized (this) {
            session = conversations.get(conversationId);
            if (session == null || session.state().isProcessing()) {
                return false;
            }
            int logIndex = session.logIndexOfUserInput(userInputIndex);
            if (logIndex < 0) {
                throw new IllegalArgumentException("No user input #" + userInputIndex + " in " + conversationId);
            }
            session.truncate(logIndex);
            session.state().reset();
        }
        publish(session);
        return true;
    }

    /**
     * Rewinds to the n-th user input and sends {@code payload} in its place. The history is
     * only cut once the agent has accepted the new turn; a busy agent leaves it untouched.
     */
    public SendOutcome editAndResend(String conversationId, int userInputIndex, TurnPayload payload, TurnOptions options) {
        ConversationSession session;
        synchronized (this) {
            session = conversations.get(conversationId);
            if (session == null) {
                return SendOutcome.UNKNOWN_CONVERSATION;
            }
            if (payload == null || payload.isEmpty()) {
                return SendOutcome.EMPTY_MESSAGE;
            }
            if (owner != null) {
                log.debug("Edit of {} rejected, {} owns the agent", conversationId, owner);
                return SendOutcome.BUSY;
            }
            int logIndex = session.logIndexOfUserInput(userInputIndex);
            if (logIndex < 0) {
                throw new IllegalArgumentException("No user input #" + userInputIndex + " in " + conversationId);
            }
            SendOutcome outcome = startTurn(session, payload, options, logIndex);
            if (outcome != SendOutcome.ACCEPTED) {
                return outcome;
            }
        }
        publish(session);
        return SendOutcome.ACCEPTED;
    }

    /**
     * New conversation holding the log up to and including the n-th user input's exchange.
     * The agent session is not carried over.
     */
    public Optional<ConversationSession> fork(String conversationId, int userInputIndex) {
        ConversationSession fork;
        synchronized (this) {
            ConversationSession source = conversations.get(conversationId);
            if (source == null) {
                return Optional.empty();
            }
            if (source.logIndexOfUserInput(userInputIndex) < 0) {
                throw new IllegalArgumentException("No user input #" + userInputIndex + " in " + conversationId);
            }
            List<ConversationLogEntry> sourceLog = source.log();
            int end = source.logIndexOfUserInput(userInputIndex + 1);
            List<ConversationLogEntry> forkLog = sourceLog.subList(0, end < 0 ? sourceLog.size() : end);

            fork = new ConversationSession("conv-" + UUID.randomUUID(), source.title() + " (fork)", clock.instant(), clock);
            fork.replaceLog(forkLog);
            fork.state().setSelectedModel(source.state().selectedModel());
            conversations.put(fork.id(), fork);
        }
        log.info("Forked {} at user input {} into {}", conversationId, userInputIndex, fork.id());
        publish(fork);
        return Optional.of(fork);
    }

    public boolean selectModel(String conversationId, String model) {
        return get(conversationId).map(session -> {
            session.state().setSelectedModel(model);
            sink.stateChanged(session.state().snapshot(session.id()));
            return true;
        }).orElse(false);
    }

    /**
     * Answers a permission request. With {@code alwaysAllow} the suggested pattern is
     * remembered for later requests.
     */
    public boolean respond(String requestId, boolean approved, boolean alwaysAllow) {
        Optional<PendingControlRequest> resolved = supervisor.respondToControl(requestId, approved, alwaysAllow);
        resolved.filter(r -> approved && alwaysAllow && r.suggestedPattern() != null)
                .ifPresent(r -> patternCache.add(r.toolName(), r.suggestedPattern()));
        return resolved.isPresent();
    }

    // Supervisor notifications

    @Override
    public void onMessage(long run, ProtocolEvent event) {
        ConversationSession session;
        synchronized (this) {
            session = ownerOf(run);
            if (session == null) {
                return;
            }
            session.record(event);
        }
        publish(session);
    }

    @Override
    public void onControlRequest(long run, PendingControlRequest request) {
        ConversationSession session;
        ControlRequestPolicy.Decision decision;
        synchronized (this) {
            session = ownerOf(run);
            if (session == null) {
                return;
            }
            decision = policy.decide(request, autoApprove);
            if (decision == ControlRequestPolicy.Decision.ASK_USER) {
                session.append(ConversationLogEntry.permissionRequest(clock.instant(), request.requestId(),
                        request.toolName(), request.input(), request.suggestedPattern()));
            }
        }
        if (decision != ControlRequestPolicy.Decision.ASK_USER) {
            log.info("{} {} for request {}", decision, request.toolName(), request.requestId());
            supervisor.respondToControl(request.requestId(), true, false);
            return;
        }
        sink.permissionRequested(new PermissionRequestDto(session.id(), request.requestId(), request.toolName(),
                request.input(), request.toolUseId(), request.suggestedPattern(), request.suggestions(),
                request.decisionReason(), request.blockedPath()));
    }

    @Override
    public void onEnd(long run) {
        ConversationSession session;
        synchronized (this) {
            if (owner == null || ownerRun != run) {
                log.debug("Ignoring end of abandoned run {}", run);
                return;
            }
            session = conversations.get(owner);
            endedOwner = owner;
            endedRun = run;
            owner = null;
            if (session == null) {
                return;
            }
            session.finishStream();
            session.state().setProcessing(false);
        }
        save(session);
        publish(session);
    }

    @Override
    public void onError(long run, AgentFailure failure) {
        ConversationSession session;
        synchronized (this) {
            if (endedOwner == null || endedRun != run) {
                log.warn("Agent failure of abandoned run {}: {}", run, failure.message());
                return;
            }
            session = conversations.get(endedOwner);
            endedOwner = null;
            if (session == null) {
                log.warn("Agent failure of run {} with no conversation: {}", run, failure.message());
                return;
            }
            session.append(ConversationLogEntry.error(clock.instant(), failure.message()));
            session.finishStream();
            session.state().setProcessing(false);
        }
        log.warn("Turn of {} failed ({}): {}", session.id(), failure.category(), failure.message());
        save(session);
        publish(session);
        sink.failure(session.id(), failure);
        if (failure.category() == AgentErrorCategory.PROCESS_ERROR && failure.permissionHint() && !autoApprove) {
            sink.notice(session.id(), PERMISSION_TIP);
        }
    }

    /** Claims the token and starts the run; the caller holds the lock and has checked the token is free. */
    private SendOutcome startTurn(ConversationSession session, TurnPayload payload, TurnOptions options, int truncateAt) {
        String agentSessionId = truncateAt >= 0 ? null : session.state().agentSessionId();
        AgentLaunchOptions launch = launchOptions(session, options == null ? TurnOptions.DEFAULT : options, agentSessionId);
        long run;
        try {
            run = supervisor.send(payload, launch);
        } catch (IllegalStateException e) {
            log.warn("Agent still busy from an earlier run: {}", e.getMessage());
            return SendOutcome.BUSY;
        }
        owner = session.id();
        ownerRun = run;
        if (truncateAt >= 0) {
            session.truncate(truncateAt);
            session.state().reset();
        }
        session.append(ConversationLogEntry.userInput(clock.instant(), payload.text()));
        session.state().setProcessing(true);
        return SendOutcome.ACCEPTED;
    }

    private ConversationSession ownerOf(long run) {
        if (owner == null || ownerRun != run) {
            log.debug("Dropping notification of abandoned run {}", run);
            return null;
        }
        return conversations.get(owner);
    }

    private void stopOwner(ConversationSession session) {
        supervisor.stop();
        owner = null;
        if (session != null) {
            session.finishStream();
            session.state().setProcessing(false);
        }
    }

    private AgentLaunchOptions launchOptions(ConversationSession session, TurnOptions options, String agentSessionId) {
        return AgentLaunchOptions.builder()
                .agentSessionId(agentSessionId)
                .model(session.state().selectedModel())
                .skipPermissions(autoApprove)
                .planMode(options.planMode())
                .thinkingMode(options.thinkingMode())
                .effort(settings.thinkingEffort())
                .mcpConfigPath(settings.mcpConfigPath())
                .allowedTools(settings.allowedTools())
                .disallowedTools(settings.disallowedTools())
                .maxTurns(settings.maxTurns())
                .workingDirectory(settings.workingDirectory())
                .build();
    }

    private void save(ConversationSession session) {
        if (session == null || session.state().agentSessionId() == null) {
            return;
        }
        try {
            conversationStore.save(session.toStored(clock.instant()));
        } catch (StoreException e) {
            log.error("Could not save conversation {}", session.id(), e);
        }
    }

    private void publish(ConversationSession session) {
        sink.transcriptChanged(session.id(), session.transcript());
        sink.stateChanged(session.state().snapshot(session.id()));
    }
}
