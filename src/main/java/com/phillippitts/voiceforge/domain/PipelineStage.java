package com.phillippitts.voiceforge.domain;

/**
 * Ordered phases of one conversational turn.
 */
public enum PipelineStage {
    TRANSCRIBE(TaskType.TRANSCRIBE),
    GENERATE(TaskType.GENERATE_REPLY),
    SYNTHESIZE(TaskType.SYNTHESIZE);

    private final TaskType taskType;

    PipelineStage(TaskType taskType) {
        this.taskType = taskType;
    }

    public TaskType taskType() {
        return taskType;
    }

    public String metricName() {
        return name().toLowerCase();
    }
}
