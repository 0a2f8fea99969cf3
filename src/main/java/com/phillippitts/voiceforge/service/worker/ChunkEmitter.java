package com.phillippitts.voiceforge.service.worker;

import org.json.JSONObject;

/**
 * Sink for intermediate output of a streaming task (audio frames, partial transcripts).
 * Each call becomes one {@code chunk} message on the worker's stdout.
 */
@FunctionalInterface
public interface ChunkEmitter {

    void emit(JSONObject payload);

    static ChunkEmitter discarding() {
        return payload -> { };
    }
}
