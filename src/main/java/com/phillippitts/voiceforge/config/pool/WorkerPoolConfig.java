package com.phillippitts.voiceforge.config.pool;

import com.phillippitts.voiceforge.config.properties.WorkerPoolProperties;
import com.phillippitts.voiceforge.domain.TaskType;
import com.phillippitts.voiceforge.exception.UnknownTaskTypeException;
import com.phillippitts.voiceforge.service.pool.DefaultProcessFactory;
import com.phillippitts.voiceforge.service.pool.PoolRegistry;
import com.phillippitts.voiceforge.service.pool.ProcessFactory;
import com.phillippitts.voiceforge.service.pool.WorkerPool;
import com.phillippitts.voiceforge.service.pool.WorkerPoolSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Creates one {@link WorkerPool} per enabled task type and the {@link PoolRegistry} over them.
 *
 * <p>Unknown type keys and missing required types fail the application context, so a broken
 * pool layout is caught at startup rather than on the first request.
 */
@Configuration
public class WorkerPoolConfig {

    private static final Logger LOG = LogManager.getLogger(WorkerPoolConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public ProcessFactory processFactory() {
        return new DefaultProcessFactory();
    }

    @Bean(destroyMethod = "close")
    public PoolRegistry poolRegistry(WorkerPoolProperties properties,
                                     ProcessFactory processFactory,
                                     ApplicationEventPublisher publisher) {
        WorkerCommandFactory commands = new WorkerCommandFactory(properties);
        Map<TaskType, WorkerPool> pools = new EnumMap<>(TaskType.class);

        properties.getTypes().forEach((key, typePool) -> {
            TaskType type = TaskType.fromWire(key).orElseThrow(() -> new UnknownTaskTypeException(key));
            if (!typePool.isEnabled()) {
                LOG.info("Worker pool for type={} disabled by configuration", type);
                return;
            }
            WorkerPoolSettings settings = toSettings(type, typePool, commands.commandFor(type, typePool));
            pools.put(type, new WorkerPool(settings, processFactory, publisher));
        });

        List<TaskType> required = new ArrayList<>();
        for (String name : properties.getRequiredTypes()) {
            if (name == null || name.isBlank()) {
                continue;
            }
            required.add(TaskType.fromWire(name).orElseThrow(() -> new UnknownTaskTypeException(name)));
        }

        PoolRegistry registry = new PoolRegistry(pools, required);
        registry.start();
        return registry;
    }

    static WorkerPoolSettings toSettings(TaskType type, WorkerPoolProperties.TypePool p, List<String> command) {
        return new WorkerPoolSettings(
                type,
                p.getSize(),
                command,
                Duration.ofMillis(p.getHealthCheckIntervalMs()),
                Duration.ofMillis(p.getPingTimeoutMs()),
                Duration.ofMillis(p.getStartupTimeoutMs()),
                Duration.ofMillis(p.getDefaultDeadlineMs()),
                p.getMaxRestarts(),
                Duration.ofMinutes(p.getRestartWindowMinutes()),
                Duration.ofMillis(p.getShutdownGraceMs()));
    }
}
