package com.phillippitts.voiceforge.util;

import java.time.Duration;

/**
 * Standard timeout values for worker process and thread management.
 *
 * @see com.phillippitts.voiceforge.service.pool.WorkerSlot
 */
public final class ProcessTimeouts {

    /**
     * Grace period after {@link Process#destroy()} before escalating to a forcible kill.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Wait after {@link Process#destroyForcibly()}. Processes that survive this are reported
     * and abandoned.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Join timeout for stdout/stderr reader threads after their process is gone.
     */
    public static final Duration READER_JOIN_TIMEOUT = Duration.ofMillis(200);

    /**
     * Poll interval of the dispatch loop when idle; bounds the latency of deadline checks.
     */
    public static final Duration DISPATCH_POLL_INTERVAL = Duration.ofMillis(50);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
