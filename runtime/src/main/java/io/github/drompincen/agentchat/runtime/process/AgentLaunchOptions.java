package io.github.drompincen.agentchat.runtime.process;

import java.nio.file.Path;
import java.util.List;

/**
 * Per-turn options that shape the agent command line.
 */
public record AgentLaunchOptions(
        String agentSessionId,
        boolean continueConversation,
        String model,
        boolean skipPermissions,
        boolean planMode,
        boolean thinkingMode,
        String effort,
        String mcpConfigPath,
        List<String> allowedTools,
        List<String> disallowedTools,
        int maxTurns,
        Path workingDirectory
) {
    public AgentLaunchOptions {
        allowedTools = allowedTools == null ? List.of() : List.copyOf(allowedTools);
        disallowedTools = disallowedTools == null ? List.of() : List.copyOf(disallowedTools);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String agentSessionId;
        private boolean continueConversation;
        private String model;
        private boolean skipPermissions;
        private boolean planMode;
        private boolean thinkingMode;
        private String effort;
        private String mcpConfigPath;
        private List<String> allowedTools = List.of();
        private List<String> disallowedTools = List.of();
        private int maxTurns;
        private Path workingDirectory;

        private Builder() {}

        public Builder agentSessionId(String v) { this.agentSessionId = v; return this; }
        public Builder continueConversation(boolean v) { this.continueConversation = v; return this; }
        public Builder model(String v) { this.model = v; return this; }
        public Builder skipPermissions(boolean v) { this.skipPermissions = v; return this; }
        public Builder planMode(boolean v) { this.planMode = v; return this; }
        public Builder thinkingMode(boolean v) { this.thinkingMode = v; return this; }
        public Builder effort(String v) { this.effort = v; return this; }
        public Builder mcpConfigPath(String v) { this.mcpConfigPath = v; return this; }
        public Builder allowedTools(List<String> v) { this.allowedTools = v; return this; }
        public Builder disallowedTools(List<String> v) { this.disallowedTools = v; return this; }
        public Builder maxTurns(int v) { this.maxTurns = v; return this; }
        public Builder workingDirectory(Path v) { this.workingDirectory = v; return this; }

        public AgentLaunchOptions build() {
            return new AgentLaunchOptions(agentSessionId, continueConversation, model, skipPermissions, planMode,
                    thinkingMode, effort, mcpConfigPath, allowedTools, disallowedTools, maxTurns, workingDirectory);
        }
    }
}
