package com.phillippitts.voiceforge.service.metrics;

import com.phillippitts.voiceforge.domain.PipelineStage;
import com.phillippitts.voiceforge.domain.TaskErrorKind;
import com.phillippitts.voiceforge.domain.TurnOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer instrumentation for the session pipeline.
 *
 * <p>Provides:
 * <ul>
 *   <li>Stage latency per pipeline stage</li>
 *   <li>End-to-end latency from utterance boundary to first audio</li>
 *   <li>Stage failures by error kind, turn outcomes</li>
 *   <li>Active session gauge and client quality feedback</li>
 * </ul>
 *
 * <p>All metrics are available at /actuator/prometheus.
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "voiceforge.pipeline";

    private final MeterRegistry registry;
    private final AtomicInteger activeSessions = new AtomicInteger();

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
        registry.gauge("voiceforge.sessions.active", activeSessions);
    }

    public void recordStageLatency(PipelineStage stage, Duration duration) {
        Timer.builder(METRIC_PREFIX + ".stage.latency")
                .description("Wall-clock time of one pipeline stage")
                .tag("stage", stage.metricName())
                .register(registry)
                .record(duration);
    }

    public void recordEndToEnd(Duration duration) {
        Timer.builder(METRIC_PREFIX + ".end_to_end.latency")
                .description("Utterance boundary to first audio byte")
                .register(registry)
                .record(duration);
    }

    public void incrementStageFailure(PipelineStage stage, TaskErrorKind kind) {
        Counter.builder(METRIC_PREFIX + ".stage.failure")
                .description("Failed pipeline stages")
                .tag("stage", stage.metricName())
                .tag("reason", kind == null ? "unknown" : kind.name())
                .register(registry)
                .increment();
    }

    public void incrementTurn(TurnOutcome outcome) {
        Counter.builder(METRIC_PREFIX + ".turns")
                .description("Completed, failed and cancelled turns")
                .tag("outcome", outcome.name())
                .register(registry)
                .increment();
    }

    public void recordQualityFeedback(double score) {
        DistributionSummary.builder("voiceforge.session.quality_feedback")
                .description("Client-reported quality scores")
                .register(registry)
                .record(score);
    }

    public void sessionOpened() {
        activeSessions.incrementAndGet();
    }

    public void sessionClosed() {
        activeSessions.decrementAndGet();
    }

    public int activeSessions() {
        return activeSessions.get();
    }
}
