package com.phillippitts.voiceforge.service.events;

import com.phillippitts.voiceforge.service.pool.event.PoolDegradedEvent;
import com.phillippitts.voiceforge.service.pool.event.WorkerCrashedEvent;
import com.phillippitts.voiceforge.service.pool.event.WorkerRestartedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counts worker pool events in Micrometer and logs them, throttled per type and slot so a
 * crash-looping worker does not flood the log.
 */
@Component
class PoolEventsListener {
    private static final Logger LOG = LogManager.getLogger(PoolEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final MeterRegistry registry;
    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();

    PoolEventsListener(MeterRegistry registry) {
        this.registry = registry;
    }

    @EventListener
    void onWorkerCrashed(WorkerCrashedEvent e) {
        Counter.builder("voiceforge.pool.crashes")
                .description("Worker slot failures")
                .tag("type", e.type().wireName())
                .register(registry)
                .increment();
        if (shouldLog("crash-" + e.type() + '-' + e.slot())) {
            LOG.warn("Worker crashed: type={}, slot={}, reason={}, abortedTask={}",
                    e.type(), e.slot(), e.reason(), e.taskId());
        }
    }

    @EventListener
    void onWorkerRestarted(WorkerRestartedEvent e) {
        Counter.builder("voiceforge.pool.restarts")
                .description("Replacement worker processes spawned")
                .tag("type", e.type().wireName())
                .register(registry)
                .increment();
        if (shouldLog("restart-" + e.type() + '-' + e.slot())) {
            LOG.info("Worker restarted: type={}, slot={}, restartCount={}", e.type(), e.slot(), e.restartCount());
        }
    }

    @EventListener
    void onPoolDegraded(PoolDegradedEvent e) {
        Counter.builder("voiceforge.pool.degradations")
                .description("Transitions into or out of degraded capacity")
                .tag("type", e.type().wireName())
                .tag("degraded", String.valueOf(e.degraded()))
                .register(registry)
                .increment();
        // State transitions are rare and always logged
        if (e.degraded()) {
            LOG.error("Pool {} degraded: {}/{} slots available. Check worker logs.",
                    e.type(), e.availableSlots(), e.totalSlots());
        } else {
            LOG.info("Pool {} back to full restartable capacity: {}/{} slots available",
                    e.type(), e.availableSlots(), e.totalSlots());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
