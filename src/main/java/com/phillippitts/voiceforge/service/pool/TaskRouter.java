package com.phillippitts.voiceforge.service.pool;

import com.phillippitts.voiceforge.domain.Task;
import com.phillippitts.voiceforge.domain.TaskResult;
import com.phillippitts.voiceforge.domain.TaskType;
import com.phillippitts.voiceforge.exception.UnknownTaskTypeException;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Routes tasks to the worker pool serving their type.
 */
public interface TaskRouter {

    /**
     * Submits a task to the pool for {@code task.type()}.
     *
     * @throws UnknownTaskTypeException if no pool serves the type
     */
    CompletableFuture<TaskResult> route(Task task, TaskChunkListener chunkListener);

    default CompletableFuture<TaskResult> route(Task task) {
        return route(task, TaskChunkListener.NONE);
    }

    /**
     * Best-effort cancellation; see {@link WorkerPool#cancel(String)}.
     */
    CompletableFuture<Boolean> cancel(TaskType type, String taskId);

    /**
     * Capacity report per registered type.
     */
    Map<TaskType, PoolStatus> describe();
}
