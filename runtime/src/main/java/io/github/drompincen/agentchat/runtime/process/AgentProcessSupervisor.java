package io.github.drompincen.agentchat.runtime.process;

import io.github.drompincen.agentchat.protocol.event.ProtocolEvent;
import io.github.drompincen.agentchat.protocol.wire.EventDecoder;
import io.github.drompincen.agentchat.protocol.wire.LineFramer;
import io.github.drompincen.agentchat.protocol.wire.TurnPayload;
import io.github.drompincen.agentchat.protocol.wire.WireEncoder;
import io.github.drompincen.agentchat.runtime.config.EngineSettings;
import io.github.drompincen.agentchat.runtime.control.ControlChannel;
import io.github.drompincen.agentchat.runtime.control.PendingControlRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the single external agent process. One run per turn: spawn, write the user turn,
 * stream stdout through the framer and decoder, then report end (and error) once.
 */
@Component
public class AgentProcessSupervisor {

    private static final Logger log = LoggerFactory.getLogger(AgentProcessSupervisor.class);

    private static final Map<String, String> AGENT_ENV = Map.of("FORCE_COLOR", "0", "NO_COLOR", "1");
    private static final int READ_BUFFER = 8192;

    private final EngineSettings settings;
    private final AgentProcessLauncher launcher;
    private final WireEncoder encoder;
    private final EventDecoder decoder;
    private final ControlChannel controlChannel;
    private final AtomicLong generations = new AtomicLong();
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "agent-process-io");
        t.setDaemon(true);
        return t;
    });

    private volatile AgentProcessListener listener = new AgentProcessListener() {
        @Override public void onMessage(long run, ProtocolEvent event) {}
        @Override public void onControlRequest(long run, PendingControlRequest request) {}
        @Override public void onEnd(long run) {}
        @Override public void onError(long run, AgentFailure failure) {}
    };
    private AgentRun current;
    private String agentSessionId;

    @Autowired
    public AgentProcessSupervisor(EngineSettings settings) {
        this(settings, AgentProcessLauncher.system());
    }

    public AgentProcessSupervisor(EngineSettings settings, AgentProcessLauncher launcher) {
        this.settings = settings;
        this.launcher = launcher;
        this.encoder = new WireEncoder();
        this.decoder = new EventDecoder();
        this.controlChannel = new ControlChannel(encoder, this::writeToCurrentRun);
    }

    public void setListener(AgentProcessListener listener) {
        this.listener = listener;
    }

    public ControlChannel controlChannel() {
        return controlChannel;
    }

    public synchronized boolean isRunning() {
        return current != null;
    }

    public synchronized Optional<String> agentSessionId() {
        return Optional.ofNullable(agentSessionId);
    }

    public synchronized void setAgentSessionId(String agentSessionId) {
        this.agentSessionId = agentSessionId;
    }

    /**
     * Starts a run for one turn and returns its run number. Events, end and error arrive on
     * the listener from the supervisor's own threads, stamped with that number; a spawn
     * failure is reported the same way. The user turn is written to stdin off the caller's
     * thread, after the readers have started.
     *
     * @throws IllegalStateException if a run is already in flight
     */
    public long send(TurnPayload payload, AgentLaunchOptions options) {
        AgentRun run;
        synchronized (this) {
            if (current != null) {
                throw new IllegalStateException("Agent process already running (run " + current.generation + ")");
            }
            agentSessionId = options.agentSessionId();
            run = new AgentRun(generations.incrementAndGet());
            current = run;
        }

        List<String> command = AgentCommandLine.build(settings.agentBinary(), options);
        Path cwd = options.workingDirectory() != null ? options.workingDirectory() : settings.workingDirectory();
        log.info("Starting agent run {} in {}{}", run.generation, cwd,
                options.agentSessionId() != null ? " resuming " + options.agentSessionId() : "");
        log.debug("Agent command: {}", command);

        try {
            run.process = launcher.launch(command, cwd, AGENT_ENV);
        } catch (IOException e) {
            log.warn("Failed to start agent binary '{}': {}", settings.agentBinary(), e.getMessage());
            synchronized (this) {
                if (current == run) {
                    current = null;
                }
            }
            controlChannel.discardAll();
            AgentFailure failure = AgentFailure.spawnFailed(settings.agentBinary(), e.getMessage());
            executor.submit(() -> {
                listener.onEnd(run.generation);
                listener.onError(run.generation, failure);
            });
            return run.generation;
        }

        if (!run.active) {
            // stopped while spawning
            run.process.destroy();
            return run.generation;
        }
        run.attachInput(run.process.getOutputStream());
        run.stderrReader = executor.submit(() -> drainStderr(run));
        executor.submit(() -> readStdout(run));
        String turn = encoder.userTurn(payload, options.agentSessionId());
        executor.submit(() -> run.writeTurn(turn));
        return run.generation;
    }

    /**
     * Aborts the current run: input closed, pending control requests dropped, the process
     * tree terminated (forcibly after the grace period). The run's end is not reported; a
     * notification already in flight may still arrive, carrying the stopped run's number.
     * A no-op when nothing is running.
     */
    public void stop() {
        AgentRun run;
        synchronized (this) {
            run = current;
            if (run == null) {
                return;
            }
            current = null;
        }
        run.active = false;
        run.closeInput();
        controlChannel.discardAll();
        log.info("Stopping agent run {}", run.generation);
        if (run.process != null) {
            Process process = run.process;
            List<ProcessHandle> descendants = process.descendants().toList();
            descendants.forEach(ProcessHandle::destroy);
            process.destroy();
            executor.submit(() -> escalate(process, descendants));
        }
    }

    /**
     * Answers a permission request of the current run; unknown ids are ignored.
     */
    public Optional<PendingControlRequest> respondToControl(String requestId, boolean approved, boolean alwaysAllow) {
        return controlChannel.respond(requestId, approved, alwaysAllow);
    }

    @PreDestroy
    public void shutdown() {
        stop();
        executor.shutdownNow();
    }

    private void readStdout(AgentRun run) {
        LineFramer framer = new LineFramer();
        byte[] buf = new byte[READ_BUFFER];
        try (InputStream in = run.process.getInputStream()) {
            int n;
            while ((n = in.read(buf)) != -1) {
                for (String line : framer.feed(buf, 0, n)) {
                    dispatch(run, line);
                }
            }
        } catch (IOException e) {
            if (run.active) {
                log.warn("Agent stdout closed unexpectedly: {}", e.getMessage());
            }
        }
        framer.flush().ifPresent(line -> dispatch(run, line));
        finish(run);
    }

    private void dispatch(AgentRun run, String line) {
        if (!run.active) {
            return;
        }
        Optional<ProtocolEvent> decoded = decoder.decode(line);
        if (decoded.isEmpty()) {
            return;
        }
        ProtocolEvent event = decoded.get();
        if (event instanceof ProtocolEvent.ControlRequest request) {
            listener.onControlRequest(run.generation, controlChannel.register(request));
            return;
        }
        if (event instanceof ProtocolEvent.SystemInit init && init.sessionId() != null) {
            setAgentSessionId(init.sessionId());
        }
        if (event instanceof ProtocolEvent.Result result) {
            run.lastResult = result;
            if (result.sessionId() != null) {
                setAgentSessionId(result.sessionId());
            }
            run.closeInputAfterTurn();
        }
        listener.onMessage(run.generation, event);
    }

    private void finish(AgentRun run) {
        int exitCode;
        try {
            exitCode = run.process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        String stderr = awaitStderr(run);

        synchronized (this) {
            if (current != run) {
                log.debug("Agent run {} exited with {} after stop", run.generation, exitCode);
                return;
            }
            current = null;
        }
        run.active = false;
        run.closeInput();
        controlChannel.discardAll();
        log.info("Agent run {} exited with code {}", run.generation, exitCode);

        listener.onEnd(run.generation);
        if (exitCode != 0) {
            listener.onError(run.generation, AgentFailure.exited(exitCode, stderr));
        } else if (run.lastResult != null && !run.lastResult.successful()) {
            listener.onError(run.generation, AgentFailure.fromResult(run.lastResult));
        }
    }

    private void drainStderr(AgentRun run) {
        byte[] buf = new byte[READ_BUFFER];
        try (InputStream err = run.process.getErrorStream()) {
            int n;
            while ((n = err.read(buf)) != -1) {
                run.stderr.append(new String(buf, 0, n, StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            log.debug("Agent stderr closed: {}", e.getMessage());
        }
    }

    private String awaitStderr(AgentRun run) {
        try {
            run.stderrReader.get(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Agent stderr not fully drained: {}", e.toString());
        }
        return run.stderr.toString().trim();
    }

    private void escalate(Process process, List<ProcessHandle> descendants) {
        try {
            if (!process.waitFor(settings.stopGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Agent process ignored termination, killing process tree");
                descendants.forEach(ProcessHandle::destroyForcibly);
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private boolean writeToCurrentRun(String line) {
        AgentRun run;
        synchronized (this) {
            run = current;
        }
        return run != null && run.writeLine(line);
    }

    private static final class AgentRun {
        final long generation;
        final StringBuffer stderr = new StringBuffer();
        volatile boolean active = true;
        volatile Process process;
        volatile ProtocolEvent.Result lastResult;
        Future<?> stderrReader;
        private OutputStream stdin;
        private boolean inputClosed;
        private boolean turnWritten;
        private boolean closeAfterTurn;

        AgentRun(long generation) {
            this.generation = generation;
        }

        synchronized boolean writeLine(String line) {
            if (stdin == null || inputClosed) {
                return false;
            }
            try {
                stdin.write((line + "\n").getBytes(StandardCharsets.UTF_8));
                stdin.flush();
                return true;
            } catch (IOException e) {
                log.warn("Could not write to agent stdin: {}", e.getMessage());
                return false;
            }
        }

        synchronized void attachInput(OutputStream stdin) {
            this.stdin = stdin;
        }

        synchronized void writeTurn(String line) {
            if (!writeLine(line)) {
                closeInput();
                return;
            }
            turnWritten = true;
            if (closeAfterTurn) {
                closeInput();
            }
        }

        /** Closes stdin once the user turn is out; a turn still queued is written first. */
        synchronized void closeInputAfterTurn() {
            if (turnWritten) {
                closeInput();
            } else {
                closeAfterTurn = true;
            }
        }

        synchronized void closeInput() {
            if (stdin == null || inputClosed) {
                inputClosed = true;
                return;
            }
            inputClosed = true;
            try {
                stdin.close();
            } catch (IOException e) {
                log.debug("Agent stdin already closed: {}", e.getMessage());
            }
        }
    }
}
