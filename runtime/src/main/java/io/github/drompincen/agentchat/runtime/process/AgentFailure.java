package io.github.drompincen.agentchat.runtime.process;

import io.github.drompincen.agentchat.protocol.api.AgentErrorCategory;
import io.github.drompincen.agentchat.protocol.event.ProtocolEvent;

import java.util.List;
import java.util.Locale;

/**
 * A turn-ending failure reported by the supervisor, already categorized.
 */
public record AgentFailure(AgentErrorCategory category, String message) {

    private static final List<String> NOT_INSTALLED_MARKERS = List.of("ENOENT", "command not found");
    private static final List<String> LOGIN_MARKERS = List.of("authentication", "login", "API key", "unauthorized", "401");

    public static AgentFailure classify(String text) {
        String message = text == null ? "" : text.trim();
        if (containsAny(message, NOT_INSTALLED_MARKERS)) {
            return new AgentFailure(AgentErrorCategory.AGENT_NOT_INSTALLED, message);
        }
        if (containsAny(message, LOGIN_MARKERS)) {
            return new AgentFailure(AgentErrorCategory.LOGIN_REQUIRED, message);
        }
        return new AgentFailure(AgentErrorCategory.PROCESS_ERROR, message);
    }

    public static AgentFailure spawnFailed(String binary, String cause) {
        return new AgentFailure(AgentErrorCategory.AGENT_NOT_INSTALLED,
                "Error running " + binary + ": " + cause);
    }

    public static AgentFailure exited(int exitCode, String stderr) {
        if (stderr == null || stderr.isBlank()) {
            return new AgentFailure(AgentErrorCategory.PROCESS_ERROR, "Agent process exited with code " + exitCode);
        }
        return classify(stderr);
    }

    /** A result record that ended the turn unsuccessfully although the process exited cleanly. */
    public static AgentFailure fromResult(ProtocolEvent.Result result) {
        String text = result.result();
        if (text == null || text.isBlank()) {
            String subtype = result.subtype() == null ? "unknown" : result.subtype();
            return new AgentFailure(AgentErrorCategory.PROCESS_ERROR, "Agent turn failed (" + subtype + ")");
        }
        return classify(text);
    }

    /** Whether the failure text points at denied permissions. */
    public boolean permissionHint() {
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("permission") || lower.contains("denied");
    }

    private static boolean containsAny(String text, List<String> markers) {
        for (String marker : markers) {
            if (text.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
