package com.phillippitts.livescribe.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Real-time distribution settings ({@code livescribe.distribution.*}).
 */
@ConfigurationProperties(prefix = "livescribe.distribution")
@Validated
public class DistributionProperties {

    /** Pending messages kept per subscriber; the oldest is dropped when full. */
    @Positive
    private int subscriberQueueCapacity = 256;

    /** Heartbeat sweep period. */
    @Positive
    private long heartbeatIntervalMs = 30_000;

    /** Subscribers idle for longer than this are pruned by the heartbeat. */
    @Positive
    private long staleAfterMs = 300_000;

    public int getSubscriberQueueCapacity() {
        return subscriberQueueCapacity;
    }

    public void setSubscriberQueueCapacity(int subscriberQueueCapacity) {
        this.subscriberQueueCapacity = subscriberQueueCapacity;
    }

    public long getHeartbeatIntervalMs() {
        return heartbeatIntervalMs;
    }

    public void setHeartbeatIntervalMs(long heartbeatIntervalMs) {
        this.heartbeatIntervalMs = heartbeatIntervalMs;
    }

    public long getStaleAfterMs() {
        return staleAfterMs;
    }

    public void setStaleAfterMs(long staleAfterMs) {
        this.staleAfterMs = staleAfterMs;
    }
}
