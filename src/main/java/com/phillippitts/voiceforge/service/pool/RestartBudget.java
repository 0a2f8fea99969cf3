package com.phillippitts.voiceforge.service.pool;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window restart budget for one worker slot.
 *
 * <p>Each restart is timestamped; attempts older than the window are pruned before every check.
 * Once {@code maxRestarts} attempts fall within the window the budget is exhausted until the
 * oldest one ages out. Not thread-safe: owned by the pool's dispatch thread.
 */
final class RestartBudget {

    private final int maxRestarts;
    private final Duration window;
    private final Deque<Instant> attempts = new ArrayDeque<>();

    RestartBudget(int maxRestarts, Duration window) {
        this.maxRestarts = maxRestarts;
        this.window = window;
    }

    /**
     * Records a restart attempt if the budget allows one.
     *
     * @return true if the restart may proceed
     */
    boolean tryAcquire(Instant now) {
        if (!allows(now)) {
            return false;
        }
        attempts.addLast(now);
        return true;
    }

    /** Returns true if a restart would be allowed at {@code now}, after pruning. */
    boolean allows(Instant now) {
        prune(now);
        return attempts.size() < maxRestarts;
    }

    int attemptsInWindow(Instant now) {
        prune(now);
        return attempts.size();
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(window);
        while (!attempts.isEmpty() && attempts.peekFirst().isBefore(cutoff)) {
            attempts.removeFirst();
        }
    }
}
