package com.phillippitts.voiceforge.service.pool;

import com.phillippitts.voiceforge.domain.Task;
import com.phillippitts.voiceforge.domain.TaskResult;

import java.time.Instant;
import java.util.Comparator;
import java.util.concurrent.CompletableFuture;

/**
 * A submitted task together with its completion handle, owned by the dispatch thread from
 * submission until it resolves.
 */
final class PendingTask {

    /** Priority descending, then submission time, then submission sequence. */
    static final Comparator<PendingTask> ORDER = Comparator
            .comparingInt((PendingTask p) -> -p.task.priority().level())
            .thenComparing(p -> p.task.submittedAt())
            .thenComparingLong(p -> p.sequence);

    private final Task task;
    private final CompletableFuture<TaskResult> future;
    private final TaskChunkListener chunkListener;
    private final long sequence;
    private final Instant deadlineAt;
    private Instant dispatchedAt;

    PendingTask(Task task, CompletableFuture<TaskResult> future, TaskChunkListener chunkListener,
                long sequence, Instant deadlineAt) {
        this.task = task;
        this.future = future;
        this.chunkListener = chunkListener == null ? TaskChunkListener.NONE : chunkListener;
        this.sequence = sequence;
        this.deadlineAt = deadlineAt;
    }

    Task task() {
        return task;
    }

    String id() {
        return task.id();
    }

    CompletableFuture<TaskResult> future() {
        return future;
    }

    TaskChunkListener chunkListener() {
        return chunkListener;
    }

    Instant deadlineAt() {
        return deadlineAt;
    }

    boolean isExpired(Instant now) {
        return now.isAfter(deadlineAt);
    }

    Instant dispatchedAt() {
        return dispatchedAt;
    }

    void markDispatched(Instant at) {
        this.dispatchedAt = at;
    }
}
