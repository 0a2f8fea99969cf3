package com.phillippitts.voiceforge.service.pool;

import com.phillippitts.voiceforge.domain.Task;
import com.phillippitts.voiceforge.domain.TaskResult;
import com.phillippitts.voiceforge.domain.TaskType;
import com.phillippitts.voiceforge.exception.UnknownTaskTypeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Holds one {@link WorkerPool} per {@link TaskType} and routes tasks by type.
 *
 * <p>The pool map is fixed at construction. Construction fails if a required type has no pool,
 * so a misconfigured deployment never starts.
 */
public class PoolRegistry implements TaskRouter, AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(PoolRegistry.class);

    /** Extra time allowed on close beyond the longest pool grace, for process reaping. */
    private static final Duration CLOSE_MARGIN = Duration.ofSeconds(5);

    private final Map<TaskType, WorkerPool> pools;

    /**
     * @param pools         pools keyed by the type they serve
     * @param requiredTypes types that must be served
     * @throws UnknownTaskTypeException if a required type has no pool
     */
    public PoolRegistry(Map<TaskType, WorkerPool> pools, Collection<TaskType> requiredTypes) {
        Objects.requireNonNull(pools, "pools");
        EnumMap<TaskType, WorkerPool> copy = new EnumMap<>(TaskType.class);
        pools.forEach((type, pool) -> {
            if (pool.type() != type) {
                throw new IllegalArgumentException("Pool for " + pool.type() + " registered under " + type);
            }
            copy.put(type, pool);
        });
        for (TaskType required : requiredTypes) {
            if (!copy.containsKey(required)) {
                throw new UnknownTaskTypeException(required.wireName());
            }
        }
        this.pools = Collections.unmodifiableMap(copy);
        LOG.info("Pool registry created for types={}", this.pools.keySet());
    }

    /** Starts every pool. */
    public void start() {
        pools.values().forEach(WorkerPool::start);
    }

    @Override
    public CompletableFuture<TaskResult> route(Task task, TaskChunkListener chunkListener) {
        return poolFor(task.type()).submit(task, chunkListener);
    }

    @Override
    public CompletableFuture<Boolean> cancel(TaskType type, String taskId) {
        return poolFor(type).cancel(taskId);
    }

    @Override
    public Map<TaskType, PoolStatus> describe() {
        EnumMap<TaskType, PoolStatus> report = new EnumMap<>(TaskType.class);
        pools.forEach((type, pool) -> report.put(type, pool.snapshot()));
        return report;
    }

    public boolean supports(TaskType type) {
        return pools.containsKey(type);
    }

    public WorkerPool poolFor(TaskType type) {
        WorkerPool pool = pools.get(type);
        if (pool == null) {
            throw new UnknownTaskTypeException(type.wireName());
        }
        return pool;
    }

    /**
     * Shuts down all pools in parallel.
     *
     * @param grace drain time granted to busy workers of every pool
     */
    public CompletableFuture<Void> shutdown(Duration grace) {
        CompletableFuture<?>[] all = pools.values().stream()
                .map(pool -> pool.shutdown(grace))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(all);
    }

    /**
     * Shuts down every pool with its configured grace and waits for the workers to exit.
     */
    @Override
    public void close() {
        Duration longest = pools.values().stream()
                .map(p -> p.settings().shutdownGrace())
                .max(Duration::compareTo)
                .orElse(Duration.ZERO);
        CompletableFuture<?>[] all = pools.values().stream()
                .map(WorkerPool::shutdown)
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(all).get(longest.plus(CLOSE_MARGIN).toMillis(), TimeUnit.MILLISECONDS);
            LOG.info("All worker pools stopped");
        } catch (TimeoutException e) {
            LOG.warn("Worker pools did not stop within {}ms", longest.plus(CLOSE_MARGIN).toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while stopping worker pools");
        } catch (ExecutionException e) {
            LOG.warn("Worker pool shutdown failed: {}", e.getCause().toString());
        }
    }
}
