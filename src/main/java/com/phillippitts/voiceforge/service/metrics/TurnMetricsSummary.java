package com.phillippitts.voiceforge.service.metrics;

import com.phillippitts.voiceforge.domain.PipelineStage;
import com.phillippitts.voiceforge.domain.TurnOutcome;
import org.json.JSONObject;

import java.util.Map;

/**
 * Aggregate over the turns currently held by {@link TurnMetricsAggregator}.
 *
 * @param count         turns in the buffer
 * @param totalRecorded turns recorded since start, including evicted ones
 * @param stages        per-stage latency over successful stage runs
 * @param endToEnd      boundary-to-first-audio latency over turns that reached it
 * @param outcomes      turns per outcome
 */
public record TurnMetricsSummary(
        int count,
        long totalRecorded,
        Map<PipelineStage, StageStats> stages,
        StageStats endToEnd,
        Map<TurnOutcome, Long> outcomes
) {

    public TurnMetricsSummary {
        stages = Map.copyOf(stages);
        outcomes = Map.copyOf(outcomes);
    }

    public StageStats stage(PipelineStage stage) {
        return stages.getOrDefault(stage, StageStats.EMPTY);
    }

    public long outcome(TurnOutcome outcome) {
        return outcomes.getOrDefault(outcome, 0L);
    }

    public JSONObject toJson() {
        JSONObject stageJson = new JSONObject();
        for (PipelineStage s : PipelineStage.values()) {
            stageJson.put(s.metricName(), stage(s).toJson());
        }
        JSONObject outcomeJson = new JSONObject();
        for (TurnOutcome o : TurnOutcome.values()) {
            outcomeJson.put(o.name(), outcome(o));
        }
        return new JSONObject()
                .put("count", count)
                .put("totalRecorded", totalRecorded)
                .put("stages", stageJson)
                .put("endToEnd", endToEnd.toJson())
                .put("outcomes", outcomeJson);
    }
}
