package com.phillippitts.voiceforge.service.worker;

import com.phillippitts.voiceforge.domain.TaskType;
import org.json.JSONObject;

/**
 * Inference backend hosted by a worker process.
 *
 * <p>Implementations are registered in {@code META-INF/services} and must have a public no-arg
 * constructor; the worker picks one by class name. {@link #handle} is only ever called from the worker's single execution thread,
 * so implementations need not be thread-safe.
 */
public interface TaskHandler {

    /**
     * Loads models and other expensive resources. Called once before the worker reports ready.
     *
     * @throws Exception if the backend cannot start; the worker exits without reporting ready
     */
    default void initialize() throws Exception {
    }

    /**
     * Executes one task.
     *
     * @param type    task type
     * @param payload task payload
     * @param chunks  emitter for intermediate output; may be ignored
     * @return final result payload
     * @throws Exception any fault; reported to the pool as {@code TASK_FAILED}
     */
    JSONObject handle(TaskType type, JSONObject payload, ChunkEmitter chunks) throws Exception;

    /**
     * Releases resources on worker shutdown.
     */
    default void close() {
    }
}
