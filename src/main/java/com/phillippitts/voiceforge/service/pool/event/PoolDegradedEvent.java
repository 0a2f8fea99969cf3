package com.phillippitts.voiceforge.service.pool.event;

import com.phillippitts.voiceforge.domain.TaskType;

import java.time.Instant;

/**
 * Published when a pool enters or leaves degraded capacity: at least one slot has exhausted its
 * restart budget and is left down.
 *
 * @param type           task type of the pool
 * @param degraded       true on entering degraded state, false on recovery
 * @param availableSlots slots currently able to take work (idle, busy or starting)
 * @param totalSlots     configured pool size
 * @param at             transition time
 */
public record PoolDegradedEvent(TaskType type, boolean degraded, int availableSlots, int totalSlots,
                                Instant at) {
    public PoolDegradedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
