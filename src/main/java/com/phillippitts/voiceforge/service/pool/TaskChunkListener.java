package com.phillippitts.voiceforge.service.pool;

import org.json.JSONObject;

/**
 * Receives intermediate {@code chunk} output of a streaming task. Invoked on the pool's
 * dispatch thread, so implementations must hand work off rather than block.
 */
@FunctionalInterface
public interface TaskChunkListener {

    TaskChunkListener NONE = (taskId, payload) -> { };

    void onChunk(String taskId, JSONObject payload);
}
