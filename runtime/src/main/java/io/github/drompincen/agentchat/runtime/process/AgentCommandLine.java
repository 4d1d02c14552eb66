package io.github.drompincen.agentchat.runtime.process;

import java.util.ArrayList;
import java.util.List;

public final class AgentCommandLine {

    private AgentCommandLine() {}

    public static List<String> build(String binary, AgentLaunchOptions options) {
        List<String> args = new ArrayList<>();
        args.add(binary);
        args.add("--output-format");
        args.add("stream-json");
        args.add("--input-format");
        args.add("stream-json");
        args.add("--verbose");

        if (options.thinkingMode() && hasText(options.effort())) {
            args.add("--effort");
            args.add(options.effort());
        }
        // skipping permissions and routing them over stdio are mutually exclusive
        if (options.skipPermissions()) {
            args.add("--dangerously-skip-permissions");
        } else {
            args.add("--permission-prompt-tool");
            args.add("stdio");
            if (options.planMode()) {
                args.add("--permission-mode");
                args.add("plan");
            }
        }
        if (hasText(options.mcpConfigPath())) {
            args.add("--mcp-config");
            args.add(options.mcpConfigPath());
        }
        if (hasText(options.model()) && !"default".equals(options.model())) {
            args.add("--model");
            args.add(options.model());
        }
        for (String tool : options.allowedTools()) {
            args.add("--allowedTools");
            args.add(tool);
        }
        for (String tool : options.disallowedTools()) {
            args.add("--disallowedTools");
            args.add(tool);
        }
        if (options.maxTurns() > 0) {
            args.add("--max-turns");
            args.add(String.valueOf(options.maxTurns()));
        }
        if (hasText(options.agentSessionId())) {
            if (options.continueConversation()) {
                args.add("--continue");
            }
            args.add("--resume");
            args.add(options.agentSessionId());
        }
        return args;
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
