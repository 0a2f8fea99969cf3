package com.phillippitts.voiceforge.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of one pipeline stage's outcome for a session turn.
 *
 * @param stage     pipeline stage
 * @param startedAt when the stage task was submitted
 * @param endedAt   when its result (or error) arrived
 * @param success   whether the stage produced output
 * @param output    transcript, reply text or audio summary; empty on failure
 * @param errorKind failure kind, or null on success
 */
public record StageResult(
        PipelineStage stage,
        Instant startedAt,
        Instant endedAt,
        boolean success,
        String output,
        TaskErrorKind errorKind
) {

    public StageResult {
        Objects.requireNonNull(stage, "stage must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(endedAt, "endedAt must not be null");
        output = output == null ? "" : output;
    }

    public static StageResult success(PipelineStage stage, Instant startedAt, String output) {
        return new StageResult(stage, startedAt, Instant.now(), true, output, null);
    }

    public static StageResult failure(PipelineStage stage, Instant startedAt, TaskErrorKind kind) {
        return new StageResult(stage, startedAt, Instant.now(), false, "", kind);
    }

    public Duration duration() {
        return Duration.between(startedAt, endedAt);
    }
}
