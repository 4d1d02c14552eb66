package io.github.drompincen.agentchat.runtime.session;

import io.github.drompincen.agentchat.protocol.api.SessionStateDto;
import io.github.drompincen.agentchat.protocol.event.TokenUsage;

/**
 * Counters of one conversation. Mutated only while that conversation owns the agent
 * process, or by its own reset/restore.
 */
public class SessionState {

    public static final String DEFAULT_MODEL = "default";

    private boolean processing;
    private double totalCost;
    private TokenUsage totals = TokenUsage.ZERO;
    private int requestCount;
    private String agentSessionId;
    private String selectedModel = DEFAULT_MODEL;
    private Long lastDurationMs;

    public synchronized boolean isProcessing() { return processing; }
    public synchronized void setProcessing(boolean processing) { this.processing = processing; }

    public synchronized double totalCost() { return totalCost; }
    public synchronized void addCost(double cost) { this.totalCost += cost; }

    public synchronized TokenUsage totals() { return totals; }
    public synchronized void addTokenUsage(TokenUsage usage) { this.totals = totals.plus(usage); }
    public synchronized void resetTokenCounts() { this.totals = TokenUsage.ZERO; }

    public synchronized int requestCount() { return requestCount; }
    public synchronized void incrementRequestCount() { this.requestCount++; }

    public synchronized String agentSessionId() { return agentSessionId; }
    public synchronized void setAgentSessionId(String agentSessionId) { this.agentSessionId = agentSessionId; }

    public synchronized String selectedModel() { return selectedModel; }
    public synchronized void setSelectedModel(String model) {
        this.selectedModel = model == null || model.isBlank() ? DEFAULT_MODEL : model;
    }

    public synchronized Long lastDurationMs() { return lastDurationMs; }
    public synchronized void setLastDurationMs(Long lastDurationMs) { this.lastDurationMs = lastDurationMs; }

    /** New session: everything but the selected model goes back to zero. */
    public synchronized void reset() {
        processing = false;
        totalCost = 0;
        totals = TokenUsage.ZERO;
        requestCount = 0;
        agentSessionId = null;
        lastDurationMs = null;
    }

    /** After loading a stored conversation. */
    public synchronized void restore(String agentSessionId, double totalCost, long inputTokens, long outputTokens) {
        reset();
        this.agentSessionId = agentSessionId;
        this.totalCost = totalCost;
        this.totals = new TokenUsage(inputTokens, outputTokens, 0, 0);
    }

    public synchronized SessionStateDto snapshot(String conversationId) {
        return new SessionStateDto(conversationId, processing, totalCost,
                totals.inputTokens(), totals.outputTokens(),
                totals.cacheReadInputTokens(), totals.cacheCreationInputTokens(),
                requestCount, agentSessionId, selectedModel, lastDurationMs);
    }
}
