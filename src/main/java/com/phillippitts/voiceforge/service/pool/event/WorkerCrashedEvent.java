package com.phillippitts.voiceforge.service.pool.event;

import com.phillippitts.voiceforge.domain.TaskType;

import java.time.Instant;

/**
 * Published when a worker slot fails: process exit, closed stdout, missed ping, startup or
 * execution timeout.
 *
 * @param type   task type of the pool
 * @param slot   slot index
 * @param reason short technical reason (no payload content)
 * @param taskId id of the in-flight task aborted with the slot, or null
 * @param at     failure time
 */
public record WorkerCrashedEvent(TaskType type, int slot, String reason, String taskId, Instant at) {
    public WorkerCrashedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
