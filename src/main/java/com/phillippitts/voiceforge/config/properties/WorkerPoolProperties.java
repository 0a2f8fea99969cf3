package com.phillippitts.voiceforge.config.properties;

import com.phillippitts.voiceforge.domain.TaskType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration properties for worker pools ({@code worker.pools.*}).
 *
 * <p>One pool is created per entry of {@code types} that is enabled. Keys are task type wire
 * names, e.g. {@code worker.pools.types.generate-reply.size=2}.
 */
@ConfigurationProperties(prefix = "worker.pools")
@Validated
public class WorkerPoolProperties {

    /** Java launcher used for the default worker command. */
    @NotBlank(message = "worker.pools.java-command must not be blank")
    private String javaCommand = "java";

    /** Extra JVM arguments for the default worker command (e.g. -Xmx512m). */
    private List<String> jvmArgs = new ArrayList<>();

    /** Default {@code TaskHandler} implementation loaded by workers. */
    @NotBlank(message = "worker.pools.handler-class must not be blank")
    private String handlerClass = "com.phillippitts.voiceforge.service.worker.handler.EchoTaskHandler";

    /** Task types that must have a pool; application start fails otherwise. */
    private List<String> requiredTypes = new ArrayList<>();

    @Valid
    private Map<String, TypePool> types = new LinkedHashMap<>();

    public String getJavaCommand() {
        return javaCommand;
    }

    public void setJavaCommand(String javaCommand) {
        this.javaCommand = javaCommand;
    }

    public List<String> getJvmArgs() {
        return jvmArgs;
    }

    public void setJvmArgs(List<String> jvmArgs) {
        this.jvmArgs = jvmArgs;
    }

    public String getHandlerClass() {
        return handlerClass;
    }

    public void setHandlerClass(String handlerClass) {
        this.handlerClass = handlerClass;
    }

    public List<String> getRequiredTypes() {
        return requiredTypes;
    }

    public void setRequiredTypes(List<String> requiredTypes) {
        this.requiredTypes = requiredTypes;
    }

    public Map<String, TypePool> getTypes() {
        return types;
    }

    public void setTypes(Map<String, TypePool> types) {
        this.types = types;
    }

    /**
     * Looks up the settings for a type by wire name or constant name.
     */
    public Optional<TypePool> forType(TaskType type) {
        return types.entrySet().stream()
                .filter(e -> TaskType.fromWire(e.getKey()).filter(t -> t == type).isPresent())
                .map(Map.Entry::getValue)
                .findFirst();
    }

    /**
     * Settings of one task type's pool.
     */
    public static class TypePool {

        private boolean enabled = true;

        @Min(value = 1, message = "Pool size must be at least 1")
        private int size = 1;

        /** Full worker command line; empty means the default java command. */
        private List<String> command = new ArrayList<>();

        /** Handler class override for this type. */
        private String handlerClass;

        @Positive(message = "Health check interval must be positive")
        private long healthCheckIntervalMs = 5000;

        @Positive(message = "Ping timeout must be positive")
        private long pingTimeoutMs = 2000;

        @Positive(message = "Startup timeout must be positive")
        private long startupTimeoutMs = 30000;

        @Positive(message = "Default deadline must be positive")
        private long defaultDeadlineMs = 30000;

        @Min(value = 0, message = "Max restarts must not be negative")
        private int maxRestarts = 3;

        @Positive(message = "Restart window must be positive")
        private int restartWindowMinutes = 10;

        @Min(value = 0, message = "Shutdown grace must not be negative")
        private long shutdownGraceMs = 5000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getSize() {
            return size;
        }

        public void setSize(int size) {
            this.size = size;
        }

        public List<String> getCommand() {
            return command;
        }

        public void setCommand(List<String> command) {
            this.command = command;
        }

        public String getHandlerClass() {
            return handlerClass;
        }

        public void setHandlerClass(String handlerClass) {
            this.handlerClass = handlerClass;
        }

        public long getHealthCheckIntervalMs() {
            return healthCheckIntervalMs;
        }

        public void setHealthCheckIntervalMs(long healthCheckIntervalMs) {
            this.healthCheckIntervalMs = healthCheckIntervalMs;
        }

        public long getPingTimeoutMs() {
            return pingTimeoutMs;
        }

        public void setPingTimeoutMs(long pingTimeoutMs) {
            this.pingTimeoutMs = pingTimeoutMs;
        }

        public long getStartupTimeoutMs() {
            return startupTimeoutMs;
        }

        public void setStartupTimeoutMs(long startupTimeoutMs) {
            this.startupTimeoutMs = startupTimeoutMs;
        }

        public long getDefaultDeadlineMs() {
            return defaultDeadlineMs;
        }

        public void setDefaultDeadlineMs(long defaultDeadlineMs) {
            this.defaultDeadlineMs = defaultDeadlineMs;
        }

        public int getMaxRestarts() {
            return maxRestarts;
        }

        public void setMaxRestarts(int maxRestarts) {
            this.maxRestarts = maxRestarts;
        }

        public int getRestartWindowMinutes() {
            return restartWindowMinutes;
        }

        public void setRestartWindowMinutes(int restartWindowMinutes) {
            this.restartWindowMinutes = restartWindowMinutes;
        }

        public long getShutdownGraceMs() {
            return shutdownGraceMs;
        }

        public void setShutdownGraceMs(long shutdownGraceMs) {
            this.shutdownGraceMs = shutdownGraceMs;
        }
    }
}
