package com.phillippitts.voiceforge.service.health;

import com.phillippitts.voiceforge.domain.TaskType;
import com.phillippitts.voiceforge.service.pool.PoolStatus;
import com.phillippitts.voiceforge.service.pool.TaskRouter;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Health indicator for worker pools.
 *
 * <ul>
 *   <li>UP: every pool has all slots available (idle, busy or starting)</li>
 *   <li>DEGRADED: every pool can still take work, but at least one runs below capacity</li>
 *   <li>DOWN: some pool has no available slot</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health.
 */
@Component
public class WorkerPoolHealthIndicator implements HealthIndicator {

    private final TaskRouter router;

    public WorkerPoolHealthIndicator(TaskRouter router) {
        this.router = router;
    }

    @Override
    public Health health() {
        Map<TaskType, PoolStatus> pools = router.describe();
        boolean allFull = true;
        boolean anyEmpty = false;

        Health.Builder builder = new Health.Builder();
        for (Map.Entry<TaskType, PoolStatus> entry : pools.entrySet()) {
            PoolStatus s = entry.getValue();
            int usable = s.available() + s.starting();
            if (usable < s.total()) {
                allFull = false;
            }
            if (usable == 0) {
                anyEmpty = true;
            }
            builder.withDetail(entry.getKey().wireName(), describe(s));
        }

        if (anyEmpty) {
            builder.down().withDetail("status", "At least one pool has no available workers");
        } else if (!allFull) {
            builder.status("DEGRADED").withDetail("status", "Reduced worker capacity");
        } else {
            builder.up().withDetail("status", "All worker pools operational");
        }
        return builder.build();
    }

    private static String describe(PoolStatus s) {
        return String.format("idle=%d busy=%d starting=%d unhealthy=%d/%d queued=%d%s",
                s.idle(), s.busy(), s.starting(), s.unhealthy() - s.starting(), s.total(), s.queueDepth(),
                s.degraded() ? " degraded" : "");
    }
}
