package com.phillippitts.voiceforge.service.pool.event;

import com.phillippitts.voiceforge.domain.TaskType;

import java.time.Instant;

/**
 * Published when a replacement worker process has been spawned into a failed slot.
 */
public record WorkerRestartedEvent(TaskType type, int slot, int restartCount, Instant at) {
    public WorkerRestartedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
