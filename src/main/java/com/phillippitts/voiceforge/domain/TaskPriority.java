package com.phillippitts.voiceforge.domain;

/**
 * Ordered priority tiers. Higher {@link #level()} is dispatched first.
 *
 * <p>The external submission contract carries an integer priority; {@link #fromLevel(int)}
 * maps it onto the highest tier whose level does not exceed the value.
 */
public enum TaskPriority {
    BATCH(0),
    NORMAL(50),
    INTERACTIVE(100);

    private final int level;

    TaskPriority(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    public static TaskPriority fromLevel(int level) {
        TaskPriority selected = BATCH;
        for (TaskPriority p : values()) {
            if (level >= p.level) {
                selected = p;
            }
        }
        return selected;
    }
}
