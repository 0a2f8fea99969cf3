package com.phillippitts.voiceforge.config.gateway;

import com.phillippitts.voiceforge.config.properties.GatewayProperties;
import com.phillippitts.voiceforge.config.properties.ThreadPoolProperties;
import com.phillippitts.voiceforge.service.gateway.SessionGateway;
import com.phillippitts.voiceforge.service.gateway.transport.RealtimeWebSocketServer;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.net.InetSocketAddress;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Session executor and WebSocket transport of the session gateway.
 */
@Configuration
public class GatewayConfig {

    /**
     * Shared pool that runs session mailboxes. Sized by {@code threadpool.gateway.*}.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}, so a saturated pool slows
     * the posting thread down instead of dropping session events.
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext of the submitting thread.
     */
    @Bean(name = "sessionExecutor")
    public Executor sessionExecutor(ThreadPoolProperties threadPoolProperties) {
        ThreadPoolProperties.GatewayPoolProperties props = threadPoolProperties.getGateway();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);

        executor.setTaskDecorator(runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        });

        executor.initialize();
        return executor;
    }

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    @ConditionalOnProperty(prefix = "gateway.transport", name = "enabled", havingValue = "true",
            matchIfMissing = true)
    public RealtimeWebSocketServer realtimeWebSocketServer(GatewayProperties properties,
                                                           SessionGateway gateway) {
        GatewayProperties.Transport transport = properties.getTransport();
        return new RealtimeWebSocketServer(
                new InetSocketAddress(transport.getHost(), transport.getPort()), gateway);
    }
}
