package com.phillippitts.voiceforge.domain;

import org.json.JSONObject;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable per-turn latency summary consumed by the metrics aggregator.
 *
 * @param sessionId    owning session
 * @param turn         turn number within the session (1-based)
 * @param completedAt  when the turn ended
 * @param stages       stage results in pipeline order
 * @param endToEndMs   utterance boundary to first audio byte (or to reply for text-only turns),
 *                     -1 when the turn never got that far
 * @param outcome      how the turn ended
 */
public record TurnRecord(
        String sessionId,
        int turn,
        Instant completedAt,
        List<StageResult> stages,
        long endToEndMs,
        TurnOutcome outcome
) {

    public TurnRecord {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(completedAt, "completedAt must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        stages = stages == null ? List.of() : List.copyOf(stages);
    }

    public Optional<StageResult> stage(PipelineStage stage) {
        return stages.stream().filter(s -> s.stage() == stage).findFirst();
    }

    public Map<PipelineStage, Long> stageMillis() {
        Map<PipelineStage, Long> out = new EnumMap<>(PipelineStage.class);
        for (StageResult s : stages) {
            out.put(s.stage(), s.duration().toMillis());
        }
        return out;
    }

    public JSONObject toJson() {
        JSONObject stageJson = new JSONObject();
        for (StageResult s : stages) {
            stageJson.put(s.stage().metricName(), new JSONObject()
                    .put("ms", s.duration().toMillis())
                    .put("success", s.success())
                    .put("error", s.errorKind() == null ? JSONObject.NULL : s.errorKind().name()));
        }
        return new JSONObject()
                .put("sessionId", sessionId)
                .put("turn", turn)
                .put("completedAt", completedAt.toString())
                .put("stages", stageJson)
                .put("endToEndMs", endToEndMs)
                .put("outcome", outcome.name());
    }
}
