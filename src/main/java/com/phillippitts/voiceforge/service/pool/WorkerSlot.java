package com.phillippitts.voiceforge.service.pool;

import com.phillippitts.voiceforge.domain.TaskType;
import com.phillippitts.voiceforge.exception.WorkerProtocolException;
import com.phillippitts.voiceforge.service.worker.protocol.WorkerMessage;
import com.phillippitts.voiceforge.service.worker.protocol.WorkerMessageCodec;
import com.phillippitts.voiceforge.util.LogSanitizer;
import com.phillippitts.voiceforge.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * One managed worker process and its bookkeeping.
 *
 * <p>All state is read and written on the owning pool's dispatch thread. The only other
 * threads involved are the stdout reader (which posts decoded messages through
 * {@link SlotListener}), the stderr drainer, and the reaper that destroys detached processes.
 */
final class WorkerSlot {

    private static final Logger LOG = LogManager.getLogger(WorkerSlot.class);

    private static final int MAX_LOGGED_LINE_CHARS = 200;

    private final int index;
    private final TaskType type;
    private final RestartBudget budget;

    private SlotState state = SlotState.STARTING;
    private Process process;
    private Writer stdin;
    private long generation;
    private Thread stdoutReader;
    private Thread stderrReader;

    private PendingTask currentTask;
    private Instant startedAt;
    private Instant lastHeartbeatAt;
    private Instant pingSentAt;
    private String pingNonce;
    private int restartCount;

    WorkerSlot(int index, TaskType type, RestartBudget budget) {
        this.index = index;
        this.type = type;
        this.budget = budget;
    }

    /**
     * Takes ownership of a freshly started process and starts its reader threads.
     */
    void attach(Process newProcess, long newGeneration, SlotListener listener, Instant now) {
        this.process = newProcess;
        this.generation = newGeneration;
        this.stdin = new OutputStreamWriter(newProcess.getOutputStream(), StandardCharsets.UTF_8);
        this.state = SlotState.STARTING;
        this.startedAt = now;
        this.lastHeartbeatAt = null;
        this.pingSentAt = null;
        this.pingNonce = null;
        this.currentTask = null;
        this.stdoutReader = startThread(new StdoutReader(newProcess.getInputStream(), listener, newGeneration),
                name("out"));
        this.stderrReader = startThread(new StderrDrainer(newProcess.getErrorStream()), name("err"));
    }

    /**
     * Writes one message to the worker's stdin.
     *
     * @throws IOException if the process is gone or the pipe is broken
     */
    void send(WorkerMessage message) throws IOException {
        if (stdin == null) {
            throw new IOException("slot " + index + " has no attached process");
        }
        stdin.write(WorkerMessageCodec.encode(message));
        stdin.write('\n');
        stdin.flush();
    }

    /**
     * Sends a liveness ping and starts its timeout clock.
     */
    void ping(Instant now) throws IOException {
        String nonce = UUID.randomUUID().toString();
        send(WorkerMessage.ping(nonce));
        this.pingNonce = nonce;
        this.pingSentAt = now;
    }

    /**
     * Records a pong; returns false if it does not answer the outstanding ping.
     */
    boolean acceptPong(String nonce, Instant now) {
        if (pingNonce == null || (nonce != null && !pingNonce.equals(nonce))) {
            return false;
        }
        pingNonce = null;
        pingSentAt = null;
        lastHeartbeatAt = now;
        return true;
    }

    boolean isPingOverdue(Instant now, Duration timeout) {
        return pingSentAt != null && now.isAfter(pingSentAt.plus(timeout));
    }

    boolean isPingOutstanding() {
        return pingSentAt != null;
    }

    boolean isStartupOverdue(Instant now, Duration timeout) {
        return state == SlotState.STARTING && startedAt != null && now.isAfter(startedAt.plus(timeout));
    }

    boolean hasProcess() {
        return process != null;
    }

    boolean isProcessAlive() {
        return process != null && process.isAlive();
    }

    /**
     * Detaches the process and destroys it on the reaper. A process is detached at most once,
     * so it is never terminated twice.
     *
     * @param waitForExit how long to let the process exit on its own before destroying it
     * @return completes once the process is gone and its readers have stopped
     */
    CompletableFuture<Void> terminate(Duration waitForExit, Executor reaper) {
        Process p = this.process;
        Thread out = this.stdoutReader;
        Thread err = this.stderrReader;
        Writer in = this.stdin;
        this.process = null;
        this.stdin = null;
        this.stdoutReader = null;
        this.stderrReader = null;
        this.pingNonce = null;
        this.pingSentAt = null;
        if (p == null) {
            return CompletableFuture.completedFuture(null);
        }
        String label = type + "#" + index;
        return CompletableFuture.runAsync(() -> {
            if (!waitForExit.isZero()) {
                awaitExit(p, waitForExit);
            }
            if (p.isAlive()) {
                destroyProcess(p, label);
            }
            closeQuietly(in, label);
            joinQuietly(out, ProcessTimeouts.READER_JOIN_TIMEOUT);
            joinQuietly(err, ProcessTimeouts.READER_JOIN_TIMEOUT);
        }, reaper);
    }

    private static void awaitExit(Process p, Duration timeout) {
        try {
            p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess(Process process, String label) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Worker {} still alive after destroyForcibly", label);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying worker {}", label);
        } catch (RuntimeException e) {
            LOG.warn("Error destroying worker {}: {}", label, e.toString());
        }
    }

    private static void closeQuietly(Writer writer, String label) {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            LOG.debug("Closing stdin of worker {} failed: {}", label, e.toString());
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private String name(String stream) {
        return "worker-" + type.wireName() + "-" + index + "-" + stream;
    }

    private static Thread startThread(Runnable runnable, String name) {
        Thread thread = new Thread(runnable, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    int index() {
        return index;
    }

    TaskType type() {
        return type;
    }

    RestartBudget budget() {
        return budget;
    }

    SlotState state() {
        return state;
    }

    void state(SlotState newState) {
        this.state = newState;
    }

    long generation() {
        return generation;
    }

    PendingTask currentTask() {
        return currentTask;
    }

    void assign(PendingTask task, Instant now) {
        this.currentTask = task;
        this.state = SlotState.BUSY;
        task.markDispatched(now);
    }

    /** Clears and returns the in-flight task, if any. */
    PendingTask takeCurrentTask() {
        PendingTask t = currentTask;
        currentTask = null;
        return t;
    }

    Instant startedAt() {
        return startedAt;
    }

    Instant lastHeartbeatAt() {
        return lastHeartbeatAt;
    }

    void heartbeat(Instant now) {
        this.lastHeartbeatAt = now;
    }

    int restartCount() {
        return restartCount;
    }

    void incrementRestartCount() {
        restartCount++;
    }

    PoolStatus.SlotStatus toStatus() {
        return new PoolStatus.SlotStatus(index, state,
                currentTask == null ? null : currentTask.id(), restartCount);
    }

    /**
     * Decodes stdout lines into messages for the pool. Reports end of stream once.
     */
    private final class StdoutReader implements Runnable {
        private final InputStream stream;
        private final SlotListener listener;
        private final long readerGeneration;

        StdoutReader(InputStream stream, SlotListener listener, long readerGeneration) {
            this.stream = stream;
            this.listener = listener;
            this.readerGeneration = readerGeneration;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = br.readLine()) != null) {
                    if (line.isBlank()) {
                        continue;
                    }
                    try {
                        listener.onMessage(index, readerGeneration, WorkerMessageCodec.decode(line));
                    } catch (WorkerProtocolException e) {
                        LOG.warn("Worker {}#{} wrote non-protocol output ({}): {}", type, index,
                                e.getMessage(), LogSanitizer.truncate(line, MAX_LOGGED_LINE_CHARS));
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stdout reader for worker {}#{} stopped: {}", type, index, e.toString());
            } finally {
                listener.onStdoutClosed(index, readerGeneration);
            }
        }
    }

    /**
     * Forwards worker stderr into the pool log at DEBUG.
     */
    private final class StderrDrainer implements Runnable {
        private final InputStream stream;

        StderrDrainer(InputStream stream) {
            this.stream = stream;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = br.readLine()) != null) {
                    LOG.debug("[{}#{}] {}", type, index, LogSanitizer.truncate(line, MAX_LOGGED_LINE_CHARS));
                }
            } catch (IOException e) {
                LOG.debug("Stderr drainer for worker {}#{} stopped: {}", type, index, e.toString());
            }
        }
    }
}
