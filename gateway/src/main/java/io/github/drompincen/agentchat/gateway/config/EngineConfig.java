package io.github.drompincen.agentchat.gateway.config;

import io.github.drompincen.agentchat.runtime.config.EngineSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Binds the {@code agentchat.*} properties into the runtime's {@link EngineSettings}.
 */
@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    EngineSettings engineSettings(
            @Value("${agentchat.agent.binary:claude}") String binary,
            @Value("${agentchat.agent.working-directory:}") String workingDirectory,
            @Value("${agentchat.agent.stop-grace-millis:2000}") long stopGraceMillis,
            @Value("${agentchat.agent.max-turns:0}") int maxTurns,
            @Value("${agentchat.agent.mcp-config-path:}") String mcpConfigPath,
            @Value("${agentchat.agent.allowed-tools:}") String[] allowedTools,
            @Value("${agentchat.agent.disallowed-tools:}") String[] disallowedTools,
            @Value("${agentchat.permissions.auto-approve:false}") boolean autoApprove,
            @Value("${agentchat.permissions.exempt-tools:AskUserQuestion}") String[] exemptTools,
            @Value("${agentchat.thinking.effort:}") String thinkingEffort) {
        EngineSettings settings = new EngineSettings(
                binary,
                blankToNull(workingDirectory) == null ? null : Path.of(workingDirectory.trim()),
                Duration.ofMillis(stopGraceMillis),
                autoApprove,
                list(exemptTools),
                maxTurns,
                blankToNull(mcpConfigPath),
                blankToNull(thinkingEffort),
                list(allowedTools),
                list(disallowedTools));
        log.info("Agent binary '{}' in {} (auto-approve {})",
                settings.agentBinary(), settings.workingDirectory(), settings.autoApprove());
        return settings;
    }

    static List<String> list(String[] values) {
        if (values == null) {
            return List.of();
        }
        return Arrays.stream(values).map(String::trim).filter(v -> !v.isEmpty()).toList();
    }

    static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
