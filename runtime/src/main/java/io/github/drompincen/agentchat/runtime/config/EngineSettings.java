package io.github.drompincen.agentchat.runtime.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Host-level settings for driving the agent process. The gateway binds these from
 * {@code agentchat.*} properties.
 */
public record EngineSettings(
        String agentBinary,
        Path workingDirectory,
        Duration stopGrace,
        boolean autoApprove,
        List<String> exemptTools,
        int maxTurns,
        String mcpConfigPath,
        String thinkingEffort,
        List<String> allowedTools,
        List<String> disallowedTools
) {
    public static final String DEFAULT_BINARY = "claude";

    public EngineSettings {
        agentBinary = agentBinary == null || agentBinary.isBlank() ? DEFAULT_BINARY : agentBinary;
        workingDirectory = workingDirectory == null ? Path.of(System.getProperty("user.dir")) : workingDirectory;
        stopGrace = stopGrace == null ? Duration.ofSeconds(2) : stopGrace;
        exemptTools = exemptTools == null ? List.of("AskUserQuestion") : List.copyOf(exemptTools);
        allowedTools = allowedTools == null ? List.of() : List.copyOf(allowedTools);
        disallowedTools = disallowedTools == null ? List.of() : List.copyOf(disallowedTools);
    }

    public static EngineSettings defaults() {
        return new EngineSettings(null, null, null, false, null, 0, null, null, null, null);
    }
}
