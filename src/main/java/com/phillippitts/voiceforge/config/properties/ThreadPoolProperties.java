package com.phillippitts.voiceforge.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for thread pools.
 *
 * <p>The gateway executor runs session mailboxes; it bounds how many sessions make progress at
 * the same time, not how many may be connected.
 */
@ConfigurationProperties(prefix = "threadpool")
@Validated
public class ThreadPoolProperties {

    @Valid
    private GatewayPoolProperties gateway = new GatewayPoolProperties();

    public GatewayPoolProperties getGateway() {
        return gateway;
    }

    public void setGateway(GatewayPoolProperties gateway) {
        this.gateway = gateway;
    }

    /**
     * Session executor pool configuration.
     */
    public static class GatewayPoolProperties {
        @Min(1)
        private int corePoolSize = 8;
        @Min(1)
        private int maxPoolSize = 32;
        @Min(0)
        private int queueCapacity = 1000;
        @Min(0)
        private int keepAliveSeconds = 60;
        @NotBlank
        private String threadNamePrefix = "session-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
