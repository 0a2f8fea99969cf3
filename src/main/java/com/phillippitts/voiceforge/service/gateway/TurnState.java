package com.phillippitts.voiceforge.service.gateway;

import com.phillippitts.voiceforge.domain.PipelineStage;
import com.phillippitts.voiceforge.domain.StageResult;
import com.phillippitts.voiceforge.domain.TaskErrorKind;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable progress of the turn a session is currently running. Confined to the session mailbox.
 */
final class TurnState {

    private final int number;
    private final Instant boundaryAt;
    private final List<StageResult> stages = new ArrayList<>();

    private PipelineStage stage;
    private String taskId;
    private Instant stageStartedAt;
    private Instant firstOutputAt;
    private int audioSeq;
    private boolean audioStreamed;

    TurnState(int number, Instant boundaryAt) {
        this.number = number;
        this.boundaryAt = boundaryAt;
    }

    void begin(PipelineStage next, String nextTaskId) {
        this.stage = next;
        this.taskId = nextTaskId;
        this.stageStartedAt = Instant.now();
    }

    /**
     * True if a callback tagged with this turn and task id belongs to the outstanding stage.
     */
    boolean isCurrent(int turnNumber, String callbackTaskId) {
        return number == turnNumber && taskId != null && taskId.equals(callbackTaskId);
    }

    StageResult complete(String output) {
        StageResult result = StageResult.success(stage, stageStartedAt, output);
        stages.add(result);
        taskId = null;
        return result;
    }

    StageResult fail(TaskErrorKind kind) {
        StageResult result = StageResult.failure(stage, stageStartedAt, kind);
        stages.add(result);
        taskId = null;
        return result;
    }

    /** Marks the first audio byte (or text-only reply) of the turn. */
    void markFirstOutput() {
        if (firstOutputAt == null) {
            firstOutputAt = Instant.now();
        }
    }

    int nextAudioSeq() {
        audioStreamed = true;
        return audioSeq++;
    }

    int audioChunks() {
        return audioSeq;
    }

    boolean audioStreamed() {
        return audioStreamed;
    }

    long endToEndMs() {
        return firstOutputAt == null ? -1 : Duration.between(boundaryAt, firstOutputAt).toMillis();
    }

    int number() {
        return number;
    }

    PipelineStage stage() {
        return stage;
    }

    String taskId() {
        return taskId;
    }

    List<StageResult> stages() {
        return stages;
    }
}
