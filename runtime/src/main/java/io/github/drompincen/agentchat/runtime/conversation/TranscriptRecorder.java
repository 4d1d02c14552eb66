package io.github.drompincen.agentchat.runtime.conversation;

import io.github.drompincen.agentchat.protocol.event.ContentBlock;
import io.github.drompincen.agentchat.protocol.event.ProtocolEvent;
import io.github.drompincen.agentchat.protocol.event.ToolResultBlock;
import io.github.drompincen.agentchat.protocol.log.ConversationLogEntry;
import io.github.drompincen.agentchat.runtime.session.SessionState;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Translates live protocol events into conversation log entries and keeps the
 * conversation's {@link SessionState} in step.
 */
public class TranscriptRecorder {

    /** Results of these tools only update their tool-use entry. */
    public static final Set<String> HIDDEN_RESULT_TOOLS = Set.of("Read", "TodoWrite");

    private record Invocation(String toolName, JsonNode input) {}

    private final Clock clock;
    private final Map<String, Invocation> invocations = new HashMap<>();

    public TranscriptRecorder(Clock clock) {
        this.clock = clock;
    }

    public List<ConversationLogEntry> record(ProtocolEvent event, SessionState state) {
        Instant now = clock.instant();
        List<ConversationLogEntry> out = new ArrayList<>();

        if (event instanceof ProtocolEvent.SystemInit init) {
            if (init.sessionId() != null) {
                state.setAgentSessionId(init.sessionId());
            }
            out.add(ConversationLogEntry.sessionInfo(now, init.sessionId(), init.tools(), init.mcpServers()));
        } else if (event instanceof ProtocolEvent.SystemStatus status) {
            out.add(ConversationLogEntry.compacting(now, status.compacting()));
        } else if (event instanceof ProtocolEvent.CompactBoundary boundary) {
            state.resetTokenCounts();
            out.add(ConversationLogEntry.compactBoundary(now, boundary.trigger(), boundary.preTokens()));
        } else if (event instanceof ProtocolEvent.AssistantMessage message) {
            recordAssistant(message, state, now, out);
        } else if (event instanceof ProtocolEvent.ToolResults results) {
            for (ToolResultBlock block : results.results()) {
                Invocation invocation = invocations.remove(block.toolUseId());
                String toolName = invocation != null ? invocation.toolName() : null;
                boolean hidden = toolName != null && HIDDEN_RESULT_TOOLS.contains(toolName) && !block.isError();
                out.add(ConversationLogEntry.toolResult(now, block.toolUseId(), toolName,
                        block.content(), block.isError(), hidden));
            }
        } else if (event instanceof ProtocolEvent.Result result) {
            if (result.sessionId() != null) {
                state.setAgentSessionId(result.sessionId());
            }
            if (result.totalCostUsd() != null) {
                state.addCost(result.totalCostUsd());
            }
            if (result.successful()) {
                state.incrementRequestCount();
            }
            state.setLastDurationMs(result.durationMs());
        }
        return out;
    }

    private void recordAssistant(ProtocolEvent.AssistantMessage message, SessionState state,
                                 Instant now, List<ConversationLogEntry> out) {
        if (message.usage() != null) {
            state.addTokenUsage(message.usage());
            out.add(ConversationLogEntry.updateTokens(now, message.usage(), state.totals()));
        }
        for (ContentBlock block : message.content()) {
            if (block instanceof ContentBlock.Text text) {
                String trimmed = text.text().trim();
                if (!trimmed.isEmpty()) {
                    out.add(ConversationLogEntry.output(now, trimmed, true));
                }
            } else if (block instanceof ContentBlock.Thinking thinking) {
                String trimmed = thinking.thinking().trim();
                if (!trimmed.isEmpty()) {
                    out.add(ConversationLogEntry.thinking(now, trimmed));
                }
            } else if (block instanceof ContentBlock.ToolUse toolUse) {
                invocations.put(toolUse.id(), new Invocation(toolUse.name(), toolUse.input()));
                out.add(ConversationLogEntry.toolUse(now, toolUse.id(), toolUse.name(), toolUse.input(),
                        toolInfo(toolUse.name(), toolUse.input())));
            }
        }
    }

    static String toolInfo(String toolName, JsonNode input) {
        StringBuilder info = new StringBuilder("Executing: ").append(toolName);
        if ("TodoWrite".equals(toolName)) {
            for (JsonNode todo : input.path("todos")) {
                info.append("\n- [").append(todo.path("status").asText("pending")).append("] ")
                        .append(todo.path("content").asText(""));
            }
        }
        return info.toString();
    }
}
