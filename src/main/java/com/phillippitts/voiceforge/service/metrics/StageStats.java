package com.phillippitts.voiceforge.service.metrics;

import org.json.JSONObject;

import java.util.Arrays;

/**
 * Latency statistics over a set of samples, in milliseconds.
 *
 * @param count samples
 * @param mean  arithmetic mean
 * @param p95   95th percentile (nearest rank)
 * @param max   largest sample
 */
public record StageStats(int count, double mean, long p95, long max) {

    public static final StageStats EMPTY = new StageStats(0, 0, 0, 0);

    /**
     * Computes statistics over the first {@code count} samples.
     */
    public static StageStats of(long[] samples, int count) {
        if (count == 0) {
            return EMPTY;
        }
        long[] values = Arrays.copyOf(samples, count);
        Arrays.sort(values);
        long sum = 0;
        for (long v : values) {
            sum += v;
        }
        int rank = (int) Math.ceil(0.95 * count);
        return new StageStats(count, (double) sum / count, values[Math.max(0, rank - 1)], values[count - 1]);
    }

    public JSONObject toJson() {
        return new JSONObject()
                .put("count", count)
                .put("meanMs", Math.round(mean * 10) / 10.0)
                .put("p95Ms", p95)
                .put("maxMs", max);
    }
}
