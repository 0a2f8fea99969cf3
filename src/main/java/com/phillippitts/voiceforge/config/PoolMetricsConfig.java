package com.phillippitts.voiceforge.config;

import com.phillippitts.voiceforge.domain.TaskType;
import com.phillippitts.voiceforge.service.pool.PoolRegistry;
import com.phillippitts.voiceforge.service.pool.PoolStatus;
import com.phillippitts.voiceforge.service.pool.WorkerPool;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Exposes worker pool capacity via Micrometer, tagged by task type:
 * <ul>
 *   <li>voiceforge.pool.slots.total / idle / busy / unhealthy</li>
 *   <li>voiceforge.pool.queue.depth</li>
 *   <li>voiceforge.pool.degraded (1 or 0)</li>
 * </ul>
 *
 * <p>Also logs a capacity summary every 5 minutes.
 */
@Configuration
public class PoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(PoolMetricsConfig.class);

    private final PoolRegistry registry;

    public PoolMetricsConfig(PoolRegistry registry) {
        this.registry = registry;
    }

    @Bean
    public MeterBinder workerPoolMetrics() {
        return meters -> {
            for (Map.Entry<TaskType, PoolStatus> entry : registry.describe().entrySet()) {
                WorkerPool pool = registry.poolFor(entry.getKey());
                String type = entry.getKey().wireName();
                gauge(meters, "voiceforge.pool.slots.total", "Configured worker slots", pool, type,
                        PoolStatus::total);
                gauge(meters, "voiceforge.pool.slots.idle", "Worker slots ready for work", pool, type,
                        PoolStatus::idle);
                gauge(meters, "voiceforge.pool.slots.busy", "Worker slots executing a task", pool, type,
                        PoolStatus::busy);
                gauge(meters, "voiceforge.pool.slots.unhealthy", "Worker slots unable to take work", pool, type,
                        PoolStatus::unhealthy);
                gauge(meters, "voiceforge.pool.queue.depth", "Tasks waiting for a worker", pool, type,
                        PoolStatus::queueDepth);
                gauge(meters, "voiceforge.pool.degraded", "1 when a slot has exhausted its restart budget",
                        pool, type, s -> s.degraded() ? 1 : 0);
            }
            LOG.info("Worker pool metrics registered for types={}", registry.describe().keySet());
        };
    }

    private static void gauge(MeterRegistry meters, String name, String description,
                              WorkerPool pool, String type, ToDoubleFunction<PoolStatus> value) {
        Gauge.builder(name, pool, p -> value.applyAsDouble(p.snapshot()))
                .description(description)
                .tag("type", type)
                .register(meters);
    }

    /**
     * Logs pool capacity every 5 minutes for operational monitoring.
     */
    @Scheduled(fixedRate = 300_000)
    public void logPoolHealth() {
        registry.describe().forEach((type, s) ->
                LOG.info("Worker pool {}: idle={}, busy={}, unhealthy={}/{}, queued={}, degraded={}, "
                                + "completed={}, failed={}, restarts={}",
                        type, s.idle(), s.busy(), s.unhealthy(), s.total(), s.queueDepth(), s.degraded(),
                        s.completed(), s.failed(), s.restarts()));
    }
}
