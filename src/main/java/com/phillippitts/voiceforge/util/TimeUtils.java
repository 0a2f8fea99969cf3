package com.phillippitts.voiceforge.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Time conversions used by latency accounting.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Elapsed milliseconds since a {@link System#nanoTime()} timestamp.
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Milliseconds between two instants, never negative.
     */
    public static long millisBetween(Instant from, Instant to) {
        if (from == null || to == null) {
            return 0;
        }
        return Math.max(0, Duration.between(from, to).toMillis());
    }
}
