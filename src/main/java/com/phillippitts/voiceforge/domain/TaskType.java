package com.phillippitts.voiceforge.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of inference task types. Each type is served by exactly one worker pool.
 *
 * <p>The wire name is the identifier used in the worker IPC protocol, the task submission
 * contract and configuration keys ({@code worker.pools.types.<wire-name>.*}).
 */
public enum TaskType {
    TRANSCRIBE("transcribe"),
    SYNTHESIZE("synthesize"),
    GENERATE_REPLY("generate-reply"),
    CLONE_VOICE("clone-voice"),
    DETECT_VOICE_ACTIVITY("detect-voice-activity");

    private final String wireName;

    TaskType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire name (case-insensitive). Enum constant names are accepted as well so that
     * relaxed property binding ({@code GENERATE_REPLY}) and wire names both work.
     *
     * @param name wire name or constant name
     * @return matching type, or empty if the name is unknown
     */
    public static Optional<TaskType> fromWire(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String n = name.trim();
        return Arrays.stream(values())
                .filter(t -> t.wireName.equalsIgnoreCase(n) || t.name().equalsIgnoreCase(n))
                .findFirst();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
