package com.phillippitts.voiceforge.service.worker;

import com.phillippitts.voiceforge.domain.TaskErrorKind;
import com.phillippitts.voiceforge.domain.TaskType;
import com.phillippitts.voiceforge.exception.WorkerProtocolException;
import com.phillippitts.voiceforge.service.worker.protocol.WorkerMessage;
import com.phillippitts.voiceforge.service.worker.protocol.WorkerMessageCodec;
import com.phillippitts.voiceforge.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Message loop of a worker process.
 *
 * <p>The calling thread reads stdin line by line and answers {@code ping} immediately. Tasks run
 * on a dedicated execution thread, one at a time; a task arriving while another executes is
 * answered with a {@code busy} error. Handler faults are reported as {@code error} messages and
 * never end the loop. The loop ends on {@code shutdown} or end of input, after the executing
 * task (if any) has finished.
 */
public final class WorkerRuntime {

    private static final Logger LOG = LogManager.getLogger(WorkerRuntime.class);

    static final String BUSY_MESSAGE = "busy";

    /** Exit code after a clean shutdown. */
    public static final int EXIT_OK = 0;
    /** Exit code when the handler fails to initialize. */
    public static final int EXIT_INIT_FAILED = 2;

    private final TaskType servedType;
    private final TaskHandler handler;
    private final InputStream in;
    private final Writer out;
    private final ExecutorService execution;
    private final AtomicBoolean busy = new AtomicBoolean(false);
    private final long drainTimeoutMs;

    public WorkerRuntime(TaskType servedType, TaskHandler handler, InputStream in, OutputStream out) {
        this(servedType, handler, in, out, 30_000L);
    }

    WorkerRuntime(TaskType servedType, TaskHandler handler, InputStream in, OutputStream out,
                  long drainTimeoutMs) {
        this.servedType = Objects.requireNonNull(servedType, "servedType");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.in = Objects.requireNonNull(in, "in");
        this.out = new OutputStreamWriter(Objects.requireNonNull(out, "out"), StandardCharsets.UTF_8);
        this.drainTimeoutMs = drainTimeoutMs;
        this.execution = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "worker-exec-" + servedType.wireName());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Initializes the handler, reports ready and processes messages until shutdown.
     *
     * @return process exit code
     */
    public int run() {
        long start = System.nanoTime();
        try {
            handler.initialize();
        } catch (Exception e) {
            LOG.error("Handler {} failed to initialize for type={}: {}",
                    handler.getClass().getSimpleName(), servedType, e.toString(), e);
            execution.shutdownNow();
            return EXIT_INIT_FAILED;
        }
        LOG.info("Worker ready: type={}, handler={}, initMs={}",
                servedType, handler.getClass().getSimpleName(), TimeUtils.elapsedMillis(start));
        send(WorkerMessage.ready());

        try {
            readLoop();
        } finally {
            drainAndClose();
        }
        return EXIT_OK;
    }

    private void readLoop() {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                if (!dispatch(line)) {
                    LOG.info("Shutdown requested for worker type={}", servedType);
                    return;
                }
            }
            LOG.info("Input closed for worker type={}; exiting", servedType);
        } catch (IOException e) {
            LOG.warn("Worker input failed for type={}: {}", servedType, e.toString());
        }
    }

    /**
     * Handles one inbound line.
     *
     * @return false when the loop must stop
     */
    private boolean dispatch(String line) {
        WorkerMessage msg;
        try {
            msg = WorkerMessageCodec.decode(line);
        } catch (WorkerProtocolException e) {
            LOG.warn("Ignoring undecodable message: {}", e.getMessage());
            return true;
        }
        switch (msg.kind()) {
            case PING -> send(WorkerMessage.pong(msg.id()));
            case TASK -> accept(msg);
            case SHUTDOWN -> {
                return false;
            }
            default -> LOG.debug("Ignoring unexpected message kind={}", msg.kind());
        }
        return true;
    }

    private void accept(WorkerMessage msg) {
        if (!busy.compareAndSet(false, true)) {
            LOG.warn("Rejecting task id={} while another task executes", msg.id());
            send(WorkerMessage.error(msg.id(), TaskErrorKind.TASK_FAILED, BUSY_MESSAGE));
            return;
        }
        try {
            execution.execute(() -> execute(msg));
        } catch (RejectedExecutionException e) {
            busy.set(false);
            send(WorkerMessage.error(msg.id(), TaskErrorKind.TASK_FAILED, "worker is shutting down"));
        }
    }

    private void execute(WorkerMessage msg) {
        long start = System.nanoTime();
        try {
            ChunkEmitter chunks = payload -> send(WorkerMessage.chunk(msg.id(), payload));
            JSONObject result = handler.handle(msg.type(), msg.payloadJson(), chunks);
            send(WorkerMessage.result(msg.id(), result));
            LOG.debug("Task id={} type={} done in {}ms", msg.id(), msg.type(), TimeUtils.elapsedMillis(start));
        } catch (Exception e) {
            LOG.warn("Task id={} type={} failed after {}ms: {}",
                    msg.id(), msg.type(), TimeUtils.elapsedMillis(start), e.toString());
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            send(WorkerMessage.error(msg.id(), TaskErrorKind.TASK_FAILED, message));
        } finally {
            busy.set(false);
        }
    }

    private void drainAndClose() {
        execution.shutdown();
        try {
            if (!execution.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
                LOG.warn("Executing task did not finish within {}ms; abandoning", drainTimeoutMs);
                execution.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            execution.shutdownNow();
        }
        handler.close();
    }

    /**
     * Writes one message line. Both the reader and execution threads write, so lines are
     * serialized on the writer.
     */
    private void send(WorkerMessage msg) {
        String line = WorkerMessageCodec.encode(msg);
        synchronized (out) {
            try {
                out.write(line);
                out.write('\n');
                out.flush();
            } catch (IOException e) {
                LOG.warn("Failed to write {} message: {}", msg.kind().wireName(), e.toString());
            }
        }
    }
}
