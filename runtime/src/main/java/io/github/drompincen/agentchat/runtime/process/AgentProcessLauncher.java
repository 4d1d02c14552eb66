package io.github.drompincen.agentchat.runtime.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Starts the agent binary. Tests substitute a scripted process.
 */
@FunctionalInterface
public interface AgentProcessLauncher {

    Process launch(List<String> command, Path workingDirectory, Map<String, String> extraEnvironment) throws IOException;

    static AgentProcessLauncher system() {
        return (command, workingDirectory, extraEnvironment) -> {
            ProcessBuilder pb = new ProcessBuilder(command)
                    .directory(workingDirectory.toFile())
                    .redirectErrorStream(false);
            pb.environment().putAll(extraEnvironment);
            return pb.start();
        };
    }
}
