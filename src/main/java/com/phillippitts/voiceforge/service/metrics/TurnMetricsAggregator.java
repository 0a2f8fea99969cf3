package com.phillippitts.voiceforge.service.metrics;

import com.phillippitts.voiceforge.config.properties.TurnMetricsProperties;
import com.phillippitts.voiceforge.domain.PipelineStage;
import com.phillippitts.voiceforge.domain.StageResult;
import com.phillippitts.voiceforge.domain.TurnOutcome;
import com.phillippitts.voiceforge.domain.TurnRecord;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-capacity ring buffer of {@link TurnRecord}s with latency summaries.
 *
 * <p>Records leave the buffer only by eviction when it is full. Thread-safe; sessions record
 * concurrently from their mailbox threads.
 */
@Component
public class TurnMetricsAggregator {

    private final TurnRecord[] ring;
    private final ReentrantLock lock = new ReentrantLock();
    private int next;
    private int size;
    private long totalRecorded;

    @Autowired
    public TurnMetricsAggregator(TurnMetricsProperties properties) {
        this(properties.getCapacity());
    }

    public TurnMetricsAggregator(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.ring = new TurnRecord[capacity];
    }

    public void record(TurnRecord turn) {
        Objects.requireNonNull(turn, "turn");
        lock.lock();
        try {
            ring[next] = turn;
            next = (next + 1) % ring.length;
            if (size < ring.length) {
                size++;
            }
            totalRecorded++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Raw records, oldest first.
     */
    public List<TurnRecord> export() {
        lock.lock();
        try {
            List<TurnRecord> out = new ArrayList<>(size);
            int start = (next - size + ring.length) % ring.length;
            for (int i = 0; i < size; i++) {
                out.add(ring[(start + i) % ring.length]);
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    public TurnMetricsSummary summary() {
        List<TurnRecord> turns;
        long total;
        lock.lock();
        try {
            turns = export();
            total = totalRecorded;
        } finally {
            lock.unlock();
        }

        Map<PipelineStage, long[]> samples = new EnumMap<>(PipelineStage.class);
        Map<PipelineStage, Integer> counts = new EnumMap<>(PipelineStage.class);
        for (PipelineStage s : PipelineStage.values()) {
            samples.put(s, new long[turns.size()]);
            counts.put(s, 0);
        }
        long[] endToEnd = new long[turns.size()];
        int endToEndCount = 0;
        Map<TurnOutcome, Long> outcomes = new EnumMap<>(TurnOutcome.class);

        for (TurnRecord t : turns) {
            for (StageResult r : t.stages()) {
                if (!r.success()) {
                    continue;
                }
                int c = counts.get(r.stage());
                samples.get(r.stage())[c] = r.duration().toMillis();
                counts.put(r.stage(), c + 1);
            }
            if (t.endToEndMs() >= 0) {
                endToEnd[endToEndCount++] = t.endToEndMs();
            }
            outcomes.merge(t.outcome(), 1L, Long::sum);
        }

        Map<PipelineStage, StageStats> stages = new EnumMap<>(PipelineStage.class);
        for (PipelineStage s : PipelineStage.values()) {
            stages.put(s, StageStats.of(samples.get(s), counts.get(s)));
        }
        return new TurnMetricsSummary(turns.size(), total, stages, StageStats.of(endToEnd, endToEndCount), outcomes);
    }

    public int capacity() {
        return ring.length;
    }
}
