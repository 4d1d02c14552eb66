package io.github.drompincen.agentchat.runtime.control;

@FunctionalInterface
public interface ControlResponseWriter {

    /**
     * Writes one line to the running agent's stdin.
     *
     * @return false when there is no live process or its input is already closed
     */
    boolean writeLine(String line);
}
