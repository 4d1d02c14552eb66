package io.github.drompincen.agentchat.runtime.process;

import io.github.drompincen.agentchat.protocol.api.AgentErrorCategory;
import io.github.drompincen.agentchat.protocol.event.ProtocolEvent;
import io.github.drompincen.agentchat.protocol.wire.TurnPayload;
import io.github.drompincen.agentchat.runtime.config.EngineSettings;
import io.github.drompincen.agentchat.runtime.control.PendingControlRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentProcessSupervisorTest {

    private static final String INIT = "{\"type\":\"system\",\"subtype\":\"init\",\"session_id\":\"s-1\",\"tools\":[]}";
    private static final String ASSISTANT = "{\"type\":\"assistant\",\"message\":{\"content\":[{\"type\":\"text\",\"text\":\"Hi\"}]}}";
    private static final String SUCCESS = "{\"type\":\"result\",\"subtype\":\"success\",\"session_id\":\"s-1\","
            + "\"total_cost_usd\":0.01,\"duration_ms\":900,\"is_error\":false,\"result\":\"Hi\"}";
    private static final String CONTROL = "{\"type\":\"control_request\",\"request_id\":\"req-1\","
            + "\"request\":{\"subtype\":\"can_use_tool\",\"tool_name\":\"Bash\",\"input\":{\"command\":\"ls\"},\"tool_use_id\":\"tu-1\"}}";

    private final Queue<ScriptedProcess> processes = new ConcurrentLinkedQueue<>();
    private final List<List<String>> commands = new CopyOnWriteArrayList<>();
    private final RecordingListener listener = new RecordingListener();
    private final AgentProcessSupervisor supervisor = new AgentProcessSupervisor(
            new EngineSettings(null, null, Duration.ofMillis(200), false, null, 0, null, null, null, null),
            (command, cwd, env) -> {
                commands.add(command);
                ScriptedProcess next = processes.poll();
                if (next == null) {
                    throw new IOException("Cannot run program \"claude\": error=2, No such file or directory");
                }
                return next;
            });

    {
        supervisor.setListener(listener);
    }

    @AfterEach
    void tearDown() {
        supervisor.shutdown();
    }

    @Test
    void runDeliversEventsThenEnd() throws Exception {
        ScriptedProcess process = ScriptedProcess.exiting(0, "", INIT, ASSISTANT, SUCCESS);
        processes.add(process);

        long run = supervisor.send(TurnPayload.text("hello"), AgentLaunchOptions.builder().build());

        assertThat(process.written.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(process.stdinText()).contains("\"type\":\"user\"").contains("\"text\":\"hello\"");
        assertThat(listener.ended.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(listener.runs).containsOnly(run);
        assertThat(listener.messages).hasSize(3);
        assertThat(listener.messages.get(0)).isInstanceOf(ProtocolEvent.SystemInit.class);
        assertThat(listener.messages.get(2)).isInstanceOf(ProtocolEvent.Result.class);
        assertThat(listener.errors).isEmpty();
        assertThat(listener.endCount).hasValue(1);
        assertThat(supervisor.isRunning()).isFalse();
        assertThat(supervisor.agentSessionId()).contains("s-1");
    }

    @Test
    void turnIsWrittenEvenWhenResultArrivesFirst() throws Exception {
        ScriptedProcess process = ScriptedProcess.exiting(0, "", SUCCESS);
        processes.add(process);

        supervisor.send(TurnPayload.text("quick"), AgentLaunchOptions.builder().build());

        assertThat(listener.ended.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(process.written.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(process.stdinText()).contains("\"text\":\"quick\"");
    }

    @Test
    void everyRunGetsItsOwnNumber() throws Exception {
        long failed = supervisor.send(TurnPayload.text("hi"), AgentLaunchOptions.builder().build());
        assertThat(listener.failed.await(5, TimeUnit.SECONDS)).isTrue();

        processes.add(ScriptedProcess.exiting(0, "", SUCCESS));
        long next = supervisor.send(TurnPayload.text("again"), AgentLaunchOptions.builder().build());

        assertThat(next).isGreaterThan(failed);
        assertThat(listener.awaitEnds(2)).isTrue();
        assertThat(listener.runs).containsExactly(failed, failed, next, next);
    }

    @Test
    void resumesGivenSession() throws Exception {
        processes.add(ScriptedProcess.exiting(0, "", SUCCESS));

        supervisor.send(TurnPayload.text("again"), AgentLaunchOptions.builder().agentSessionId("s-0").build());

        assertThat(listener.ended.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(commands.get(0)).endsWith("--resume", "s-0");
    }

    @Test
    void nonZeroExitReportsClassifiedStderr() throws Exception {
        processes.add(ScriptedProcess.exiting(1, "Invalid API key. Please run /login"));

        supervisor.send(TurnPayload.text("hi"), AgentLaunchOptions.builder().build());

        assertThat(listener.failed.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(listener.endCount).hasValue(1);
        assertThat(listener.errors).singleElement()
                .extracting(AgentFailure::category).isEqualTo(AgentErrorCategory.LOGIN_REQUIRED);
    }

    @Test
    void unsuccessfulResultWithCleanExitIsAnError() throws Exception {
        processes.add(ScriptedProcess.exiting(0, "",
                "{\"type\":\"result\",\"subtype\":\"error_max_turns\",\"is_error\":true}"));

        supervisor.send(TurnPayload.text("hi"), AgentLaunchOptions.builder().build());

        assertThat(listener.failed.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(listener.errors.get(0).message()).contains("error_max_turns");
    }

    @Test
    void spawnFailureIsReportedAsEndThenError() throws Exception {
        supervisor.send(TurnPayload.text("hi"), AgentLaunchOptions.builder().build());

        assertThat(listener.failed.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(listener.order).containsExactly("end", "error");
        assertThat(listener.errors.get(0).category()).isEqualTo(AgentErrorCategory.AGENT_NOT_INSTALLED);
        assertThat(supervisor.isRunning()).isFalse();
    }

    @Test
    void secondSendWhileRunningIsRejected() {
        processes.add(ScriptedProcess.blocking(INIT));

        supervisor.send(TurnPayload.text("first"), AgentLaunchOptions.builder().build());

        assertThat(supervisor.isRunning()).isTrue();
        assertThatThrownBy(() -> supervisor.send(TurnPayload.text("second"), AgentLaunchOptions.builder().build()))
                .isInstanceOf(IllegalStateException.class);
        assertThat(commands).hasSize(1);
    }

    @Test
    void stopKillsProcessWithoutNotifying() throws Exception {
        ScriptedProcess process = ScriptedProcess.blocking(INIT);
        processes.add(process);
        supervisor.send(TurnPayload.text("long task"), AgentLaunchOptions.builder().build());

        supervisor.stop();

        assertThat(process.destroyed.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(supervisor.isRunning()).isFalse();
        Thread.sleep(200);
        assertThat(listener.endCount).hasValue(0);
        assertThat(listener.errors).isEmpty();

        processes.add(ScriptedProcess.exiting(0, "", SUCCESS));
        supervisor.send(TurnPayload.text("next"), AgentLaunchOptions.builder().build());
        assertThat(listener.ended.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void controlRequestsAreRoutedAndAnswered() throws Exception {
        ScriptedProcess process = ScriptedProcess.blocking(CONTROL);
        processes.add(process);
        supervisor.send(TurnPayload.text("list files"), AgentLaunchOptions.builder().build());

        assertThat(listener.controlled.await(5, TimeUnit.SECONDS)).isTrue();
        PendingControlRequest request = listener.controlRequests.get(0);
        assertThat(request.requestId()).isEqualTo("req-1");
        assertThat(request.suggestedPattern()).isEqualTo("ls");
        assertThat(listener.messages).isEmpty();

        assertThat(supervisor.respondToControl("req-1", true, false)).isPresent();
        assertThat(supervisor.respondToControl("req-1", true, false)).isEmpty();

        assertThat(process.stdinText()).contains("\"behavior\":\"allow\"").contains("\"toolUseID\":\"tu-1\"");
    }

    @Test
    void stopDiscardsPendingControlRequests() throws Exception {
        ScriptedProcess process = ScriptedProcess.blocking(CONTROL);
        processes.add(process);
        supervisor.send(TurnPayload.text("list files"), AgentLaunchOptions.builder().build());
        assertThat(listener.controlled.await(5, TimeUnit.SECONDS)).isTrue();

        supervisor.stop();

        assertThat(supervisor.controlChannel().pending()).isEmpty();
        assertThat(supervisor.respondToControl("req-1", true, false)).isEmpty();
    }

    static class RecordingListener implements AgentProcessListener {
        final List<ProtocolEvent> messages = new CopyOnWriteArrayList<>();
        final List<PendingControlRequest> controlRequests = new CopyOnWriteArrayList<>();
        final List<AgentFailure> errors = new CopyOnWriteArrayList<>();
        final List<String> order = new CopyOnWriteArrayList<>();
        final List<Long> runs = new CopyOnWriteArrayList<>();
        final AtomicInteger endCount = new AtomicInteger();
        final CountDownLatch ended = new CountDownLatch(1);
        final CountDownLatch failed = new CountDownLatch(1);
        final CountDownLatch controlled = new CountDownLatch(1);

        @Override
        public void onMessage(long run, ProtocolEvent event) {
            runs.add(run);
            messages.add(event);
        }

        @Override
        public void onControlRequest(long run, PendingControlRequest request) {
            runs.add(run);
            controlRequests.add(request);
            controlled.countDown();
        }

        @Override
        public synchronized void onEnd(long run) {
            runs.add(run);
            order.add("end");
            endCount.incrementAndGet();
            ended.countDown();
            notifyAll();
        }

        @Override
        public void onError(long run, AgentFailure failure) {
            runs.add(run);
            order.add("error");
            errors.add(failure);
            failed.countDown();
        }

        synchronized boolean awaitEnds(int count) throws InterruptedException {
            long deadline = System.currentTimeMillis() + 5000;
            while (endCount.get() < count) {
                long left = deadline - System.currentTimeMillis();
                if (left <= 0) {
                    return false;
                }
                wait(left);
            }
            return true;
        }
    }

    /** A process whose stdout replays fixed lines, then ends or blocks until destroyed. */
    static class ScriptedProcess extends Process {
        final CountDownLatch destroyed = new CountDownLatch(1);
        final CountDownLatch written = new CountDownLatch(1);
        private final CountDownLatch exited;
        private final ByteArrayOutputStream stdin = new ByteArrayOutputStream();
        private final InputStream stdout;
        private final InputStream stderr;
        private final int exitCode;

        private ScriptedProcess(int exitCode, String stderr, boolean blocking, String... lines) {
            this.exitCode = exitCode;
            this.exited = new CountDownLatch(blocking ? 1 : 0);
            this.stderr = new ByteArrayInputStream(stderr.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder();
            for (String line : lines) {
                out.append(line).append('\n');
            }
            this.stdout = new ScriptedStdout(out.toString().getBytes(StandardCharsets.UTF_8), exited);
        }

        static ScriptedProcess exiting(int exitCode, String stderr, String... lines) {
            return new ScriptedProcess(exitCode, stderr, false, lines);
        }

        static ScriptedProcess blocking(String... lines) {
            return new ScriptedProcess(143, "", true, lines);
        }

        String stdinText() {
            synchronized (stdin) {
                return stdin.toString(StandardCharsets.UTF_8);
            }
        }

        @Override
        public OutputStream getOutputStream() {
            return new OutputStream() {
                @Override
                public void write(int b) {
                    synchronized (stdin) {
                        stdin.write(b);
                    }
                    written.countDown();
                }

                @Override
                public void write(byte[] b, int off, int len) {
                    synchronized (stdin) {
                        stdin.write(b, off, len);
                    }
                    written.countDown();
                }
            };
        }

        @Override
        public InputStream getInputStream() {
            return stdout;
        }

        @Override
        public InputStream getErrorStream() {
            return stderr;
        }

        @Override
        public int waitFor() throws InterruptedException {
            exited.await();
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            return exited.await(timeout, unit);
        }

        @Override
        public int exitValue() {
            if (exited.getCount() > 0) {
                throw new IllegalThreadStateException("still running");
            }
            return exitCode;
        }

        @Override
        public void destroy() {
            destroyed.countDown();
            exited.countDown();
        }

        @Override
        public Process destroyForcibly() {
            destroy();
            return this;
        }

        @Override
        public boolean isAlive() {
            return exited.getCount() > 0;
        }

        @Override
        public Stream<ProcessHandle> descendants() {
            return Stream.empty();
        }
    }

    static class ScriptedStdout extends InputStream {
        private final byte[] data;
        private final CountDownLatch exited;
        private int pos;

        ScriptedStdout(byte[] data, CountDownLatch exited) {
            this.data = data;
            this.exited = exited;
        }

        @Override
        public int read() throws IOException {
            byte[] one = new byte[1];
            return read(one, 0, 1) == -1 ? -1 : one[0] & 0xff;
        }

        @Override
        public synchronized int read(byte[] b, int off, int len) throws IOException {
            if (pos < data.length) {
                int n = Math.min(len, data.length - pos);
                System.arraycopy(data, pos, b, off, n);
                pos += n;
                return n;
            }
            try {
                exited.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException();
            }
            return -1;
        }
    }
}
