package com.phillippitts.voiceforge.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for per-turn latency aggregation ({@code metrics.turns.*}).
 */
@ConfigurationProperties(prefix = "metrics.turns")
@Validated
public class TurnMetricsProperties {

    /** Turn records kept in the ring buffer; older ones are evicted. */
    @Positive(message = "Turn metrics capacity must be positive")
    private int capacity = 1000;

    public int getCapacity() {
        return capacity;
    }

    public void setCapacity(int capacity) {
        this.capacity = capacity;
    }
}
