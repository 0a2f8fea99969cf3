package com.phillippitts.voiceforge.service.pool;

import com.phillippitts.voiceforge.domain.Task;
import com.phillippitts.voiceforge.domain.TaskError;
import com.phillippitts.voiceforge.domain.TaskErrorKind;
import com.phillippitts.voiceforge.domain.TaskResult;
import com.phillippitts.voiceforge.domain.TaskType;
import com.phillippitts.voiceforge.exception.TaskFailedException;
import com.phillippitts.voiceforge.exception.TaskFailureBuilder;
import com.phillippitts.voiceforge.service.pool.event.PoolDegradedEvent;
import com.phillippitts.voiceforge.service.pool.event.WorkerCrashedEvent;
import com.phillippitts.voiceforge.service.pool.event.WorkerRestartedEvent;
import com.phillippitts.voiceforge.service.worker.protocol.MessageKind;
import com.phillippitts.voiceforge.service.worker.protocol.WorkerMessage;
import com.phillippitts.voiceforge.util.ProcessTimeouts;
import com.phillippitts.voiceforge.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-size pool of persistent worker processes serving one {@link TaskType}.
 *
 * <p>Threading model: a single dispatch thread owns the slot table, the pending queue and every
 * counter. Submitters, stdout readers and the health-check timer never touch that state; they
 * post commands to the inbox. {@link #snapshot()} reads a status published by the dispatch
 * thread after each iteration.
 *
 * <p>Dispatch order is priority (highest first), then submission time, then submission
 * sequence. A task is resolved exactly once: with the worker's result, or exceptionally with a
 * {@link TaskFailedException} whose kind names the failure ({@code WORKER_CRASHED},
 * {@code QUEUE_TIMEOUT}, {@code EXECUTION_TIMEOUT}, {@code POOL_SHUTTING_DOWN},
 * {@code TASK_FAILED}, {@code CANCELLED}).
 *
 * <p>Futures are completed on the dispatch thread; dependent stages must not block.
 */
public final class WorkerPool {

    private static final Logger LOG = LogManager.getLogger(WorkerPool.class);

    private final WorkerPoolSettings settings;
    private final TaskType type;
    private final ProcessFactory processFactory;
    private final ApplicationEventPublisher publisher;

    private final BlockingQueue<PoolCommand> inbox = new LinkedBlockingQueue<>();
    private final Thread dispatchThread;
    private final ScheduledExecutorService ticker;
    private final ExecutorService reaper;
    private final SlotListener slotListener = new InboxSlotListener();

    // Dispatch-thread state
    private final WorkerSlot[] slots;
    private final PriorityQueue<PendingTask> queue = new PriorityQueue<>(PendingTask.ORDER);
    private final Map<String, WorkerSlot> inFlight = new HashMap<>();
    private final List<CompletableFuture<Void>> terminations = new ArrayList<>();
    private long nextGeneration;
    private boolean degraded;
    private boolean draining;
    private Instant drainDeadline;
    private long submittedCount;
    private long completedCount;
    private long failedCount;
    private long crashCount;
    private long restartCount;

    // Shared state
    private final Object submitLock = new Object();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean accepting = true;
    private volatile boolean running = true;
    private volatile PoolStatus status;
    private final CompletableFuture<Void> shutdownFuture = new CompletableFuture<>();

    public WorkerPool(WorkerPoolSettings settings, ProcessFactory processFactory,
                      ApplicationEventPublisher publisher) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.type = settings.type();
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.slots = new WorkerSlot[settings.size()];
        for (int i = 0; i < slots.length; i++) {
            slots[i] = new WorkerSlot(i, type,
                    new RestartBudget(settings.maxRestarts(), settings.restartWindow()));
        }
        this.dispatchThread = new Thread(this::runLoop, "pool-" + type.wireName() + "-dispatch");
        this.dispatchThread.setDaemon(true);
        this.ticker = Executors.newSingleThreadScheduledExecutor(daemonFactory("pool-" + type.wireName() + "-health"));
        this.reaper = Executors.newCachedThreadPool(daemonFactory("pool-" + type.wireName() + "-reaper"));
        this.status = computeStatus();
    }

    /**
     * Spawns all worker processes and starts dispatching. Idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        LOG.info("Starting worker pool type={} size={} command={}", type, slots.length, settings.command());
        inbox.offer(new Start());
        dispatchThread.start();
        long period = settings.healthCheckInterval().toMillis();
        ticker.scheduleAtFixedRate(() -> inbox.offer(new HealthTick()), period, period, TimeUnit.MILLISECONDS);
    }

    public TaskType type() {
        return type;
    }

    public WorkerPoolSettings settings() {
        return settings;
    }

    public CompletableFuture<TaskResult> submit(Task task) {
        return submit(task, TaskChunkListener.NONE);
    }

    /**
     * Submits a task for execution.
     *
     * @param task          task whose type matches this pool
     * @param chunkListener receives intermediate output of streaming tasks
     * @return future resolved with the worker's result, or exceptionally with
     *         {@link TaskFailedException}
     * @throws IllegalArgumentException if the task type does not match the pool
     */
    public CompletableFuture<TaskResult> submit(Task task, TaskChunkListener chunkListener) {
        Objects.requireNonNull(task, "task");
        if (task.type() != type) {
            throw new IllegalArgumentException("Pool " + type + " cannot run task of type " + task.type());
        }
        CompletableFuture<TaskResult> future = new CompletableFuture<>();
        Duration deadline = task.deadline() != null ? task.deadline() : settings.defaultDeadline();
        PendingTask pending = new PendingTask(task, future, chunkListener,
                sequence.incrementAndGet(), task.submittedAt().plus(deadline));
        synchronized (submitLock) {
            if (!accepting) {
                future.completeExceptionally(failure(TaskErrorKind.POOL_SHUTTING_DOWN,
                        "Pool is shutting down", task).build());
                return future;
            }
            inbox.offer(new Submit(pending));
        }
        return future;
    }

    /**
     * Requests cancellation. A queued task is removed and resolved {@code CANCELLED}; an
     * executing task keeps running and its result is still delivered.
     *
     * @return completes with true if the task was removed from the queue
     */
    public CompletableFuture<Boolean> cancel(String taskId) {
        CompletableFuture<Boolean> reply = new CompletableFuture<>();
        synchronized (submitLock) {
            if (!running || shutdownFuture.isDone()) {
                reply.complete(false);
                return reply;
            }
            inbox.offer(new Cancel(taskId, reply));
        }
        return reply;
    }

    /**
     * Drains the pool: rejects new and queued tasks, stops idle workers, gives busy workers up
     * to {@code grace} to finish, then destroys whatever is left. Every call returns the same
     * future.
     */
    public CompletableFuture<Void> shutdown(Duration grace) {
        synchronized (submitLock) {
            if (!accepting) {
                return shutdownFuture;
            }
            accepting = false;
            LOG.info("Shutting down worker pool type={} grace={}ms", type, grace.toMillis());
            if (!started.get()) {
                running = false;
                ticker.shutdownNow();
                reaper.shutdown();
                shutdownFuture.complete(null);
                return shutdownFuture;
            }
            inbox.offer(new Shutdown(grace));
        }
        return shutdownFuture;
    }

    public CompletableFuture<Void> shutdown() {
        return shutdown(settings.shutdownGrace());
    }

    public boolean isAccepting() {
        return accepting;
    }

    /**
     * Latest capacity report. Consistent within itself; may lag the dispatch thread by one
     * iteration.
     */
    public PoolStatus snapshot() {
        return status;
    }

    // ---------------------------------------------------------------- dispatch loop

    private void runLoop() {
        ThreadContext.put("pool", type.wireName());
        long pollMs = ProcessTimeouts.DISPATCH_POLL_INTERVAL.toMillis();
        while (running) {
            PoolCommand command;
            try {
                command = inbox.poll(pollMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Dispatch thread for pool {} interrupted; stopping", type);
                forceStop(Instant.now());
                break;
            }
            try {
                Instant now = Instant.now();
                if (command != null) {
                    handle(command, now);
                }
                checkTimers(now);
                if (draining) {
                    checkDrained(now);
                }
            } catch (RuntimeException e) {
                LOG.error("Dispatch error in pool {}: {}", type, e.toString(), e);
            }
            status = computeStatus();
        }
        drainInboxAfterStop();
        ThreadContext.remove("pool");
    }

    private void handle(PoolCommand command, Instant now) {
        if (command instanceof Submit submit) {
            onSubmit(submit.task(), now);
        } else if (command instanceof SlotMessage msg) {
            onSlotMessage(msg, now);
        } else if (command instanceof StdoutClosed closed) {
            onStdoutClosed(closed, now);
        } else if (command instanceof HealthTick) {
            onHealthTick(now);
        } else if (command instanceof Cancel cancel) {
            cancel.reply().complete(onCancel(cancel.taskId()));
        } else if (command instanceof Shutdown shutdown) {
            beginDrain(shutdown.grace(), now);
        } else if (command instanceof Start) {
            for (WorkerSlot slot : slots) {
                spawn(slot, now);
            }
        }
    }

    private void onSubmit(PendingTask pending, Instant now) {
        if (draining) {
            reject(pending, TaskErrorKind.POOL_SHUTTING_DOWN, "Pool is shutting down");
            return;
        }
        submittedCount++;
        queue.add(pending);
        dispatchNext(now);
    }

    private void dispatchNext(Instant now) {
        for (WorkerSlot slot : slots) {
            if (queue.isEmpty()) {
                return;
            }
            if (slot.state() != SlotState.IDLE) {
                continue;
            }
            PendingTask next = pollLive(now);
            if (next == null) {
                return;
            }
            slot.assign(next, now);
            inFlight.put(next.id(), slot);
            try {
                slot.send(WorkerMessage.task(next.task()));
                LOG.debug("Dispatched task id={} priority={} to {}#{}", next.id(),
                        next.task().priority(), type, slot.index());
            } catch (IOException e) {
                failSlot(slot, "task write failed: " + e.getMessage(), TaskErrorKind.WORKER_CRASHED, now);
            }
        }
    }

    /** Polls the queue, resolving expired entries on the way. */
    private PendingTask pollLive(Instant now) {
        PendingTask next;
        while ((next = queue.poll()) != null) {
            if (!next.isExpired(now)) {
                return next;
            }
            queueTimeout(next, now);
        }
        return null;
    }

    private void onSlotMessage(SlotMessage msg, Instant now) {
        WorkerSlot slot = slots[msg.slot()];
        if (msg.generation() != slot.generation() || !slot.hasProcess()) {
            LOG.debug("Dropping {} from replaced worker {}#{}", msg.message().kind().wireName(), type, msg.slot());
            return;
        }
        WorkerMessage message = msg.message();
        switch (message.kind()) {
            case READY -> onReady(slot, now);
            case PONG -> slot.acceptPong(message.id(), now);
            case RESULT, ERROR -> onTaskOutcome(slot, message, now);
            case CHUNK -> onChunk(slot, message);
            default -> LOG.debug("Ignoring {} from worker {}#{}", message.kind().wireName(), type, slot.index());
        }
    }

    private void onReady(WorkerSlot slot, Instant now) {
        if (slot.state() != SlotState.STARTING) {
            LOG.debug("Duplicate ready from worker {}#{}", type, slot.index());
            return;
        }
        slot.state(SlotState.IDLE);
        slot.heartbeat(now);
        LOG.info("Worker {}#{} ready in {}ms", type, slot.index(), TimeUtils.millisBetween(slot.startedAt(), now));
        if (draining) {
            stopSlot(slot, settings.shutdownGrace());
            return;
        }
        updateDegraded(now);
        dispatchNext(now);
    }

    private void onTaskOutcome(WorkerSlot slot, WorkerMessage message, Instant now) {
        PendingTask current = slot.currentTask();
        if (current == null || !current.id().equals(message.id())) {
            LOG.debug("Ignoring {} for id={} on worker {}#{} (not in flight)",
                    message.kind().wireName(), message.id(), type, slot.index());
            return;
        }
        slot.takeCurrentTask();
        inFlight.remove(current.id());
        slot.heartbeat(now);
        slot.state(SlotState.IDLE);

        long durationMs = TimeUtils.millisBetween(current.dispatchedAt(), now);
        if (message.kind() == MessageKind.RESULT) {
            completedCount++;
            current.future().complete(TaskResult.success(current.id(), message.payloadJson()));
            LOG.debug("Task id={} completed on {}#{} in {}ms", current.id(), type, slot.index(), durationMs);
        } else {
            TaskError error = message.error();
            failedCount++;
            current.future().completeExceptionally(failure(error.kind(), error.message(), current.task())
                    .slot(slot.index())
                    .durationMs(durationMs)
                    .build());
            LOG.warn("Task id={} failed on {}#{}: {}", current.id(), type, slot.index(), error.message());
        }

        if (draining) {
            stopSlot(slot, settings.shutdownGrace());
            return;
        }
        dispatchNext(now);
    }

    private void onChunk(WorkerSlot slot, WorkerMessage message) {
        PendingTask current = slot.currentTask();
        if (current == null || !current.id().equals(message.id())) {
            return;
        }
        try {
            current.chunkListener().onChunk(current.id(), message.payloadJson());
        } catch (RuntimeException e) {
            LOG.warn("Chunk listener for task id={} threw: {}", current.id(), e.toString());
        }
    }

    private void onStdoutClosed(StdoutClosed closed, Instant now) {
        WorkerSlot slot = slots[closed.slot()];
        if (closed.generation() != slot.generation() || !slot.hasProcess()) {
            return;
        }
        if (slot.state() == SlotState.TERMINATING) {
            return;
        }
        failSlot(slot, "worker process exited", TaskErrorKind.WORKER_CRASHED, now);
    }

    private void onHealthTick(Instant now) {
        for (WorkerSlot slot : slots) {
            switch (slot.state()) {
                case IDLE, BUSY -> ping(slot, now);
                case UNHEALTHY -> {
                    if (!draining && slot.budget().allows(now)) {
                        LOG.info("Restart budget available again for worker {}#{}", type, slot.index());
                        restart(slot, now);
                    }
                }
                default -> {
                    // STARTING is covered by the startup timeout; TERMINATING is draining
                }
            }
        }
        updateDegraded(now);
    }

    private void ping(WorkerSlot slot, Instant now) {
        if (!slot.isProcessAlive()) {
            failSlot(slot, "worker process exited", TaskErrorKind.WORKER_CRASHED, now);
            return;
        }
        if (slot.isPingOutstanding()) {
            return;
        }
        try {
            slot.ping(now);
        } catch (IOException e) {
            failSlot(slot, "ping write failed: " + e.getMessage(), TaskErrorKind.WORKER_CRASHED, now);
        }
    }

    private void checkTimers(Instant now) {
        for (WorkerSlot slot : slots) {
            if (slot.isStartupOverdue(now, settings.startupTimeout())) {
                failSlot(slot, "no ready within " + settings.startupTimeout().toMillis() + "ms",
                        TaskErrorKind.WORKER_CRASHED, now);
            } else if ((slot.state() == SlotState.IDLE || slot.state() == SlotState.BUSY)
                    && slot.isPingOverdue(now, settings.pingTimeout())) {
                failSlot(slot, "no pong within " + settings.pingTimeout().toMillis() + "ms",
                        TaskErrorKind.WORKER_CRASHED, now);
            } else if (slot.state() == SlotState.BUSY && slot.currentTask().isExpired(now)) {
                failSlot(slot, "execution deadline exceeded", TaskErrorKind.EXECUTION_TIMEOUT, now);
            }
        }
        if (!queue.isEmpty()) {
            Iterator<PendingTask> it = queue.iterator();
            List<PendingTask> expired = new ArrayList<>();
            while (it.hasNext()) {
                PendingTask p = it.next();
                if (p.isExpired(now)) {
                    it.remove();
                    expired.add(p);
                }
            }
            expired.forEach(p -> queueTimeout(p, now));
        }
    }

    private boolean onCancel(String taskId) {
        Iterator<PendingTask> it = queue.iterator();
        while (it.hasNext()) {
            PendingTask p = it.next();
            if (p.id().equals(taskId)) {
                it.remove();
                reject(p, TaskErrorKind.CANCELLED, "Task cancelled before dispatch");
                LOG.debug("Cancelled queued task id={}", taskId);
                return true;
            }
        }
        if (inFlight.containsKey(taskId)) {
            LOG.debug("Task id={} already executing; its result will still be delivered", taskId);
        }
        return false;
    }

    // ---------------------------------------------------------------- slot lifecycle

    private void spawn(WorkerSlot slot, Instant now) {
        long generation = ++nextGeneration;
        try {
            Process process = processFactory.start(settings.command(), null);
            slot.attach(process, generation, slotListener, now);
            LOG.debug("Spawned worker {}#{} generation={}", type, slot.index(), generation);
        } catch (IOException | RuntimeException e) {
            LOG.error("Failed to spawn worker {}#{}: {}", type, slot.index(), e.toString());
            slot.state(SlotState.UNHEALTHY);
            crashCount++;
            publisher.publishEvent(new WorkerCrashedEvent(type, slot.index(),
                    "spawn failed: " + e.getMessage(), null, now));
        }
    }

    /**
     * Marks a slot unhealthy, fails its in-flight task, destroys its process and restarts it if
     * the restart budget allows.
     */
    private void failSlot(WorkerSlot slot, String reason, TaskErrorKind inFlightKind, Instant now) {
        PendingTask current = slot.takeCurrentTask();
        if (current != null) {
            inFlight.remove(current.id());
            failedCount++;
            String message = inFlightKind == TaskErrorKind.EXECUTION_TIMEOUT
                    ? "Task exceeded its deadline while executing"
                    : "Worker failed while executing task";
            current.future().completeExceptionally(failure(inFlightKind, message, current.task())
                    .slot(slot.index())
                    .durationMs(TimeUtils.millisBetween(current.dispatchedAt(), now))
                    .metadata("reason", reason)
                    .build());
        }
        crashCount++;
        slot.state(SlotState.UNHEALTHY);
        LOG.warn("Worker {}#{} unhealthy: {}{}", type, slot.index(), reason,
                current == null ? "" : " (aborted task id=" + current.id() + ")");
        track(slot.terminate(Duration.ZERO, reaper));
        publisher.publishEvent(new WorkerCrashedEvent(type, slot.index(), reason,
                current == null ? null : current.id(), now));

        if (!draining) {
            if (slot.budget().allows(now)) {
                restart(slot, now);
            } else {
                LOG.error("Worker {}#{} exceeded {} restarts within {}m; leaving it down",
                        type, slot.index(), settings.maxRestarts(), settings.restartWindow().toMinutes());
            }
        }
        updateDegraded(now);
    }

    private void restart(WorkerSlot slot, Instant now) {
        if (!slot.budget().tryAcquire(now)) {
            return;
        }
        slot.incrementRestartCount();
        restartCount++;
        spawn(slot, now);
        if (slot.hasProcess()) {
            LOG.info("Restarted worker {}#{} (restart #{})", type, slot.index(), slot.restartCount());
            publisher.publishEvent(new WorkerRestartedEvent(type, slot.index(), slot.restartCount(), now));
        }
    }

    private void updateDegraded(Instant now) {
        boolean nowDegraded = false;
        int available = 0;
        for (WorkerSlot slot : slots) {
            if (slot.state() == SlotState.UNHEALTHY && !slot.budget().allows(now)) {
                nowDegraded = true;
            }
            if (slot.state() != SlotState.UNHEALTHY && slot.state() != SlotState.TERMINATING) {
                available++;
            }
        }
        if (nowDegraded != degraded) {
            degraded = nowDegraded;
            if (degraded) {
                LOG.error("Worker pool {} degraded: {}/{} slots available", type, available, slots.length);
            } else {
                LOG.info("Worker pool {} recovered: {}/{} slots available", type, available, slots.length);
            }
            publisher.publishEvent(new PoolDegradedEvent(type, degraded, available, slots.length, now));
        }
    }

    // ---------------------------------------------------------------- shutdown

    private void beginDrain(Duration grace, Instant now) {
        if (draining) {
            return;
        }
        draining = true;
        drainDeadline = now.plus(grace);
        PendingTask queued;
        while ((queued = queue.poll()) != null) {
            reject(queued, TaskErrorKind.POOL_SHUTTING_DOWN, "Pool shut down before task was dispatched");
        }
        for (WorkerSlot slot : slots) {
            switch (slot.state()) {
                case IDLE -> stopSlot(slot, grace);
                case STARTING, UNHEALTHY -> {
                    slot.state(SlotState.TERMINATING);
                    track(slot.terminate(Duration.ZERO, reaper));
                }
                default -> {
                    // BUSY slots finish their task first
                }
            }
        }
    }

    /** Asks an idle worker to exit and reaps it. */
    private void stopSlot(WorkerSlot slot, Duration grace) {
        slot.state(SlotState.TERMINATING);
        try {
            slot.send(WorkerMessage.shutdown());
        } catch (IOException e) {
            LOG.debug("Could not send shutdown to worker {}#{}: {}", type, slot.index(), e.toString());
        }
        track(slot.terminate(grace, reaper));
    }

    private void checkDrained(Instant now) {
        boolean anyBusy = false;
        for (WorkerSlot slot : slots) {
            if (slot.state() == SlotState.BUSY) {
                anyBusy = true;
                break;
            }
        }
        if (anyBusy && now.isBefore(drainDeadline)) {
            return;
        }
        forceStop(now);
    }

    private void forceStop(Instant now) {
        for (WorkerSlot slot : slots) {
            PendingTask current = slot.takeCurrentTask();
            if (current != null) {
                inFlight.remove(current.id());
                failedCount++;
                current.future().completeExceptionally(failure(TaskErrorKind.POOL_SHUTTING_DOWN,
                        "Pool shut down while task was executing", current.task())
                        .slot(slot.index())
                        .durationMs(TimeUtils.millisBetween(current.dispatchedAt(), now))
                        .build());
            }
            if (slot.state() != SlotState.TERMINATING) {
                slot.state(SlotState.TERMINATING);
            }
            track(slot.terminate(Duration.ZERO, reaper));
        }
        synchronized (submitLock) {
            accepting = false;
            running = false;
        }
        ticker.shutdownNow();
        CompletableFuture.allOf(terminations.toArray(new CompletableFuture[0]))
                .whenComplete((v, t) -> {
                    reaper.shutdown();
                    LOG.info("Worker pool {} stopped", type);
                    shutdownFuture.complete(null);
                });
    }

    /** Resolves commands that raced with the end of the loop. */
    private void drainInboxAfterStop() {
        PoolCommand command;
        while ((command = inbox.poll()) != null) {
            if (command instanceof Submit submit) {
                reject(submit.task(), TaskErrorKind.POOL_SHUTTING_DOWN, "Pool is shut down");
            } else if (command instanceof Cancel cancel) {
                cancel.reply().complete(false);
            }
        }
    }

    // ---------------------------------------------------------------- helpers

    private void track(CompletableFuture<Void> termination) {
        terminations.removeIf(CompletableFuture::isDone);
        terminations.add(termination);
    }

    private void queueTimeout(PendingTask pending, Instant now) {
        LOG.warn("Task id={} type={} expired after {}ms in queue", pending.id(), type,
                TimeUtils.millisBetween(pending.task().submittedAt(), now));
        reject(pending, TaskErrorKind.QUEUE_TIMEOUT, "Task deadline passed before a worker was free");
    }

    private void reject(PendingTask pending, TaskErrorKind kind, String message) {
        failedCount++;
        pending.future().completeExceptionally(failure(kind, message, pending.task()).build());
    }

    private static TaskFailureBuilder failure(TaskErrorKind kind, String message, Task task) {
        return TaskFailureBuilder.create(kind, message).task(task.id(), task.type());
    }

    private PoolStatus computeStatus() {
        int idle = 0;
        int busy = 0;
        int unhealthy = 0;
        int starting = 0;
        List<PoolStatus.SlotStatus> slotStatuses = new ArrayList<>(slots.length);
        for (WorkerSlot slot : slots) {
            switch (slot.state()) {
                case IDLE -> idle++;
                case BUSY -> busy++;
                case STARTING -> {
                    starting++;
                    unhealthy++;
                }
                default -> unhealthy++;
            }
            slotStatuses.add(slot.toStatus());
        }
        return new PoolStatus(type, slots.length, idle, busy, unhealthy, starting, queue.size(), degraded,
                submittedCount, completedCount, failedCount, crashCount, restartCount, slotStatuses);
    }

    private static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private final class InboxSlotListener implements SlotListener {
        @Override
        public void onMessage(int slot, long generation, WorkerMessage message) {
            inbox.offer(new SlotMessage(slot, generation, message));
        }

        @Override
        public void onStdoutClosed(int slot, long generation) {
            inbox.offer(new StdoutClosed(slot, generation));
        }
    }

    // ---------------------------------------------------------------- commands

    private interface PoolCommand {
    }

    private record Start() implements PoolCommand {
    }

    private record Submit(PendingTask task) implements PoolCommand {
    }

    private record SlotMessage(int slot, long generation, WorkerMessage message) implements PoolCommand {
    }

    private record StdoutClosed(int slot, long generation) implements PoolCommand {
    }

    private record HealthTick() implements PoolCommand {
    }

    private record Cancel(String taskId, CompletableFuture<Boolean> reply) implements PoolCommand {
    }

    private record Shutdown(Duration grace) implements PoolCommand {
    }
}
