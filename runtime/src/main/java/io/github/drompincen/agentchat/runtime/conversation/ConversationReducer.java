package io.github.drompincen.agentchat.runtime.conversation;

import io.github.drompincen.agentchat.protocol.event.TokenUsage;
import io.github.drompincen.agentchat.protocol.log.ConversationLogEntry;
import io.github.drompincen.agentchat.protocol.transcript.ConversationEntry;
import io.github.drompincen.agentchat.protocol.transcript.ToolStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds conversation log entries into a transcript. Used for the live stream and for
 * restoring a stored conversation, so the output depends only on the entries applied:
 * ids come from the entry kind, its timestamp and its position in the log.
 * Not thread-safe.
 */
public class ConversationReducer {

    private final List<ConversationEntry> entries = new ArrayList<>();
    private final Map<String, Integer> toolUseIndex = new HashMap<>();
    private int activeAssistant = -1;
    private TokenUsage pendingUsage;
    private int position;

    public static List<ConversationEntry> replay(List<ConversationLogEntry> log) {
        ConversationReducer reducer = new ConversationReducer();
        log.forEach(reducer::apply);
        reducer.finish();
        return reducer.transcript();
    }

    public void apply(ConversationLogEntry entry) {
        int i = position++;
        long ts = entry.timestampMillis();
        switch (entry.type()) {
            case USER_INPUT:
                closeAssistant();
                entries.add(new ConversationEntry.User("user-" + ts + "-" + i, ts, entry.dataAsText()));
                break;
            case OUTPUT:
                output(entry, ts, i);
                break;
            case THINKING:
                closeAssistant();
                entries.add(new ConversationEntry.Thinking("thinking-" + ts + "-" + i, ts,
                        entry.textField("thinking").orElseGet(entry::dataAsText)));
                break;
            case TOOL_USE:
                closeAssistant();
                toolUse(entry, ts, i);
                break;
            case TOOL_RESULT:
                closeAssistant();
                toolResult(entry, ts, i);
                break;
            case UPDATE_TOKENS:
                updateTokens(entry);
                break;
            case ERROR:
                closeAssistant();
                entries.add(new ConversationEntry.Error("error-" + ts + "-" + i, ts,
                        entry.textField("message").orElseGet(entry::dataAsText)));
                break;
            default:
                // session info, compaction markers and permission prompts stay in the log only
                break;
        }
    }

    /** End of stream: the open assistant entry, if any, stops streaming. */
    public void finish() {
        closeAssistant();
    }

    public List<ConversationEntry> transcript() {
        return List.copyOf(entries);
    }

    public boolean hasOpenAssistant() {
        return activeAssistant >= 0;
    }

    private void output(ConversationLogEntry entry, long ts, int i) {
        String text = entry.field("text").filter(JsonNode::isTextual).map(JsonNode::asText)
                .orElseGet(() -> entry.data() != null && entry.data().isTextual() ? entry.data().asText() : "");
        boolean isFinal = entry.booleanField("isFinal").orElse(false);

        if (activeAssistant < 0) {
            if (text.isEmpty() && isFinal) {
                return;
            }
            entries.add(new ConversationEntry.Assistant("assistant-" + ts + "-" + i, ts, text, !isFinal, pendingUsage));
            pendingUsage = null;
            activeAssistant = entries.size() - 1;
        } else {
            ConversationEntry.Assistant current = (ConversationEntry.Assistant) entries.get(activeAssistant);
            current = current.append(text);
            if (current.usage() == null && pendingUsage != null) {
                current = current.withUsage(pendingUsage);
                pendingUsage = null;
            }
            entries.set(activeAssistant, current);
        }
        if (isFinal) {
            closeAssistant();
        }
    }

    private void toolUse(ConversationLogEntry entry, long ts, int i) {
        String toolUseId = entry.textField("toolUseId").orElse("tool-" + ts + "-" + i);
        JsonNode rawInput = entry.field("rawInput").filter(JsonNode::isObject)
                .orElseGet(JsonNodeFactory.instance::objectNode);
        entries.add(new ConversationEntry.ToolUse(
                toolUseId,
                ts,
                toolUseId,
                entry.textField("toolName").orElse("Tool"),
                rawInput,
                entry.textField("toolInfo").orElse(""),
                ToolStatus.EXECUTING,
                entry.longField("duration").orElse(null),
                entry.longField("tokens").orElse(null),
                entry.longField("cacheReadTokens").orElse(null),
                entry.longField("cacheCreationTokens").orElse(null),
                null));
        toolUseIndex.put(toolUseId, entries.size() - 1);
    }

    private void toolResult(ConversationLogEntry entry, long ts, int i) {
        String toolUseId = entry.textField("toolUseId").orElse("");
        boolean isError = entry.booleanField("isError").orElse(false);
        boolean hidden = entry.booleanField("hidden").orElse(false);
        Long duration = entry.longField("duration").orElse(null);
        Long tokens = entry.longField("tokens").orElse(null);
        Long cacheRead = entry.longField("cacheReadTokens").orElse(null);
        Long cacheCreation = entry.longField("cacheCreationTokens").orElse(null);
        String fileContentAfter = entry.textField("fileContentAfter").orElse(null);

        Integer index = toolUseIndex.get(toolUseId);
        if (index != null && entries.get(index) instanceof ConversationEntry.ToolUse use
                && use.status() == ToolStatus.EXECUTING) {
            entries.set(index, use.resolved(isError, duration, tokens, cacheRead, cacheCreation, fileContentAfter));
        }

        if (!hidden) {
            String content = entry.field("content")
                    .map(c -> c.isTextual() ? c.asText() : c.toString())
                    .orElse("");
            String idPart = toolUseId.isEmpty() ? String.valueOf(ts) : toolUseId;
            entries.add(new ConversationEntry.ToolResult(
                    "tool-result-" + idPart + "-" + i,
                    ts,
                    toolUseId,
                    entry.textField("toolName").orElse(null),
                    content,
                    isError,
                    duration,
                    tokens,
                    cacheRead,
                    cacheCreation,
                    fileContentAfter));
        }
    }

    private void updateTokens(ConversationLogEntry entry) {
        TokenUsage usage = entry.field("current").flatMap(TokenUsage::fromJson).orElse(null);
        if (usage == null) {
            return;
        }
        pendingUsage = usage;
        if (activeAssistant >= 0) {
            ConversationEntry.Assistant current = (ConversationEntry.Assistant) entries.get(activeAssistant);
            if (current.usage() == null) {
                entries.set(activeAssistant, current.withUsage(usage));
            }
            pendingUsage = null;
            return;
        }
        for (int k = entries.size() - 1; k >= 0; k--) {
            if (entries.get(k) instanceof ConversationEntry.Assistant last) {
                if (last.usage() == null) {
                    entries.set(k, last.withUsage(usage));
                    pendingUsage = null;
                }
                return;
            }
        }
    }

    private void closeAssistant() {
        if (activeAssistant < 0) {
            return;
        }
        ConversationEntry.Assistant current = (ConversationEntry.Assistant) entries.get(activeAssistant);
        entries.set(activeAssistant, current.closed());
        activeAssistant = -1;
    }
}
