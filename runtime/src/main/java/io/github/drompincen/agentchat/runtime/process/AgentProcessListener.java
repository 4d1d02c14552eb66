package io.github.drompincen.agentchat.runtime.process;

import io.github.drompincen.agentchat.protocol.event.ProtocolEvent;
import io.github.drompincen.agentchat.runtime.control.PendingControlRequest;

/**
 * The supervisor's outbound channels. There is exactly one subscriber. Every call carries
 * the run number returned by {@link AgentProcessSupervisor#send}, so the subscriber can drop
 * notifications from a run it has already abandoned. Calls arrive on the supervisor's threads
 * in stream order; {@link #onEnd} is delivered once per run and {@link #onError} at most once,
 * right after it.
 */
public interface AgentProcessListener {

    void onMessage(long run, ProtocolEvent event);

    void onControlRequest(long run, PendingControlRequest request);

    void onEnd(long run);

    void onError(long run, AgentFailure failure);
}
