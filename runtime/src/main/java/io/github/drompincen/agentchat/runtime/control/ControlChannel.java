package io.github.drompincen.agentchat.runtime.control;

import io.github.drompincen.agentchat.protocol.event.ProtocolEvent;
import io.github.drompincen.agentchat.protocol.wire.ControlResponse;
import io.github.drompincen.agentchat.protocol.wire.WireEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Outstanding tool permission requests of the current process, keyed by request id.
 * Requests are answered at most once; those still open when the process ends are
 * dropped without an answer.
 */
public class ControlChannel {

    private static final Logger log = LoggerFactory.getLogger(ControlChannel.class);

    private final Map<String, PendingControlRequest> pending = new ConcurrentHashMap<>();
    private final WireEncoder encoder;
    private final ControlResponseWriter writer;

    public ControlChannel(WireEncoder encoder, ControlResponseWriter writer) {
        this.encoder = encoder;
        this.writer = writer;
    }

    public PendingControlRequest register(ProtocolEvent.ControlRequest request) {
        PendingControlRequest entry = PendingControlRequest.from(request);
        pending.put(entry.requestId(), entry);
        log.debug("Control request {} for tool {}", entry.requestId(), entry.toolName());
        return entry;
    }

    /**
     * Answers a pending request. Unknown ids (already answered, or the process ended) are ignored.
     *
     * @return the resolved request, empty for an unknown id
     */
    public Optional<PendingControlRequest> respond(String requestId, boolean approved, boolean alwaysAllow) {
        PendingControlRequest entry = requestId == null ? null : pending.remove(requestId);
        if (entry == null) {
            log.debug("Ignoring response for unknown control request {}", requestId);
            return Optional.empty();
        }
        ControlResponse response = approved
                ? ControlResponse.allow(entry.requestId(), entry.input(),
                        alwaysAllow ? entry.suggestions() : null, entry.toolUseId())
                : ControlResponse.deny(entry.requestId(), entry.toolUseId());
        if (!writer.writeLine(encoder.controlResponse(response))) {
            log.debug("Agent input closed, response to {} not delivered", requestId);
        }
        return Optional.of(entry);
    }

    public Optional<PendingControlRequest> get(String requestId) {
        return Optional.ofNullable(pending.get(requestId));
    }

    public List<PendingControlRequest> pending() {
        return new ArrayList<>(pending.values());
    }

    public int discardAll() {
        int count = pending.size();
        pending.clear();
        if (count > 0) {
            log.debug("Discarded {} unanswered control requests", count);
        }
        return count;
    }
}
