package com.phillippitts.voiceforge.service.pool;

import com.phillippitts.voiceforge.domain.TaskType;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Effective settings of one worker pool, resolved from configuration.
 *
 * @param type                task type served by the pool
 * @param size                number of worker slots
 * @param command             command line that starts one worker process
 * @param healthCheckInterval period of the ping round
 * @param pingTimeout         time a slot may take to answer a ping
 * @param startupTimeout      time a new worker may take to report ready
 * @param defaultDeadline     deadline for tasks that carry none
 * @param maxRestarts         restarts allowed per slot within {@code restartWindow}
 * @param restartWindow       sliding window of the restart budget
 * @param shutdownGrace       default drain time for busy slots on shutdown
 */
public record WorkerPoolSettings(
        TaskType type,
        int size,
        List<String> command,
        Duration healthCheckInterval,
        Duration pingTimeout,
        Duration startupTimeout,
        Duration defaultDeadline,
        int maxRestarts,
        Duration restartWindow,
        Duration shutdownGrace
) {

    public WorkerPoolSettings {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(command, "command");
        if (size < 1) {
            throw new IllegalArgumentException("size must be >= 1, got: " + size);
        }
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        if (maxRestarts < 0) {
            throw new IllegalArgumentException("maxRestarts must be >= 0, got: " + maxRestarts);
        }
        command = List.copyOf(command);
    }

    /**
     * Settings with the standard intervals (5s health check, 2s ping timeout, 30s startup and
     * deadline, 3 restarts per 10 minutes, 5s shutdown grace).
     */
    public static WorkerPoolSettings defaults(TaskType type, int size, List<String> command) {
        return new WorkerPoolSettings(type, size, command,
                Duration.ofSeconds(5), Duration.ofSeconds(2), Duration.ofSeconds(30),
                Duration.ofSeconds(30), 3, Duration.ofMinutes(10), Duration.ofSeconds(5));
    }

    public WorkerPoolSettings withHealthCheck(Duration interval, Duration timeout) {
        return new WorkerPoolSettings(type, size, command, interval, timeout, startupTimeout,
                defaultDeadline, maxRestarts, restartWindow, shutdownGrace);
    }

    public WorkerPoolSettings withDefaultDeadline(Duration deadline) {
        return new WorkerPoolSettings(type, size, command, healthCheckInterval, pingTimeout,
                startupTimeout, deadline, maxRestarts, restartWindow, shutdownGrace);
    }

    public WorkerPoolSettings withRestartBudget(int restarts, Duration window) {
        return new WorkerPoolSettings(type, size, command, healthCheckInterval, pingTimeout,
                startupTimeout, defaultDeadline, restarts, window, shutdownGrace);
    }

    public WorkerPoolSettings withStartupTimeout(Duration timeout) {
        return new WorkerPoolSettings(type, size, command, healthCheckInterval, pingTimeout,
                timeout, defaultDeadline, maxRestarts, restartWindow, shutdownGrace);
    }
}
