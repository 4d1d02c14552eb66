package io.github.drompincen.agentchat.runtime.session;

import io.github.drompincen.agentchat.persistence.store.StoredConversation;
import io.github.drompincen.agentchat.protocol.event.ProtocolEvent;
import io.github.drompincen.agentchat.protocol.log.ConversationLogEntry;
import io.github.drompincen.agentchat.protocol.log.LogEntryType;
import io.github.drompincen.agentchat.protocol.transcript.ConversationEntry;
import io.github.drompincen.agentchat.runtime.conversation.ConversationReducer;
import io.github.drompincen.agentchat.runtime.conversation.TranscriptRecorder;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One open conversation: its log, the transcript folded from it and its counters.
 */
public class ConversationSession {

    static final String DEFAULT_TITLE = "New conversation";
    private static final int TITLE_LENGTH = 50;

    private final String id;
    private final Instant startTime;
    private final SessionState state = new SessionState();
    private final TranscriptRecorder recorder;
    private final List<ConversationLogEntry> log = new ArrayList<>();
    private ConversationReducer reducer = new ConversationReducer();
    private String title;

    public ConversationSession(String id, String title, Instant startTime, Clock clock) {
        this.id = id;
        this.title = title;
        this.startTime = startTime;
        this.recorder = new TranscriptRecorder(clock);
    }

    public static ConversationSession fromStored(StoredConversation stored, Clock clock) {
        ConversationSession session = new ConversationSession(stored.conversationId(), stored.title(),
                stored.startTime() != null ? stored.startTime() : clock.instant(), clock);
        session.replaceLog(stored.messages());
        session.state.restore(stored.agentSessionId(), stored.totalCost(),
                stored.totalTokensInput(), stored.totalTokensOutput());
        return session;
    }

    public String id() { return id; }
    public Instant startTime() { return startTime; }
    public SessionState state() { return state; }

    public synchronized String title() {
        return title != null ? title : DEFAULT_TITLE;
    }

    public synchronized void append(ConversationLogEntry entry) {
        if (title == null && entry.type() == LogEntryType.USER_INPUT) {
            String text = entry.dataAsText().strip();
            title = text.length() > TITLE_LENGTH ? text.substring(0, TITLE_LENGTH) : text;
        }
        log.add(entry);
        reducer.apply(entry);
    }

    /** Records a live event; returns false when it produced no log entry. */
    public synchronized boolean record(ProtocolEvent event) {
        List<ConversationLogEntry> entries = recorder.record(event, state);
        entries.forEach(this::append);
        return !entries.isEmpty();
    }

    public synchronized void finishStream() {
        reducer.finish();
    }

    public synchronized List<ConversationEntry> transcript() {
        return reducer.transcript();
    }

    public synchronized List<ConversationLogEntry> log() {
        return List.copyOf(log);
    }

    /** Log position of the n-th (0-based) user input, or -1. */
    public synchronized int logIndexOfUserInput(int n) {
        int seen = 0;
        for (int i = 0; i < log.size(); i++) {
            if (log.get(i).type() == LogEntryType.USER_INPUT) {
                if (seen == n) {
                    return i;
                }
                seen++;
            }
        }
        return -1;
    }

    /** Drops the log from {@code logIndex} on and rebuilds the transcript. */
    public synchronized void truncate(int logIndex) {
        replaceLog(new ArrayList<>(log.subList(0, logIndex)));
    }

    synchronized void replaceLog(List<ConversationLogEntry> entries) {
        log.clear();
        log.addAll(entries);
        reducer = new ConversationReducer();
        log.forEach(reducer::apply);
        reducer.finish();
    }

    public synchronized StoredConversation toStored(Instant endTime) {
        return new StoredConversation(id, state.agentSessionId(), title(), startTime, endTime,
                state.totalCost(), state.totals().inputTokens(), state.totals().outputTokens(), log);
    }
}
