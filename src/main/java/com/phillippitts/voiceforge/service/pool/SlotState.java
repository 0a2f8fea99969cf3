package com.phillippitts.voiceforge.service.pool;

/**
 * Lifecycle state of a worker slot.
 */
public enum SlotState {
    /** Process spawned, waiting for its ready message. */
    STARTING,
    IDLE,
    BUSY,
    /** Failed a health check and was not (yet) replaced. */
    UNHEALTHY,
    /** Draining on pool shutdown. */
    TERMINATING
}
