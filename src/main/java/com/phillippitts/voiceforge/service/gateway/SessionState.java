package com.phillippitts.voiceforge.service.gateway;

import com.phillippitts.voiceforge.domain.PipelineStage;

/**
 * Lifecycle of a streaming session.
 *
 * <pre>
 * INITIALIZING → LISTENING ⇄ TRANSCRIBING → GENERATING → SPEAKING → LISTENING
 * LISTENING ⇄ PAUSED
 * any → ENDED
 * </pre>
 */
public enum SessionState {
    INITIALIZING,
    LISTENING,
    TRANSCRIBING,
    GENERATING,
    SPEAKING,
    PAUSED,
    ENDED;

    /** True while a pipeline stage task is outstanding. */
    public boolean isTurnInFlight() {
        return this == TRANSCRIBING || this == GENERATING || this == SPEAKING;
    }

    static SessionState forStage(PipelineStage stage) {
        return switch (stage) {
            case TRANSCRIBE -> TRANSCRIBING;
            case GENERATE -> GENERATING;
            case SYNTHESIZE -> SPEAKING;
        };
    }
}
