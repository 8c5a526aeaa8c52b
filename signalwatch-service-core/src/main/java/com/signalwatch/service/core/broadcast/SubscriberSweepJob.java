package com.signalwatch.service.core.broadcast;

import com.signalwatch.service.core.config.TelemetryProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Background sweep evicting idle and stalled subscribers; publish itself never sweeps. */
@Component
@RequiredArgsConstructor
@Slf4j
public class SubscriberSweepJob {

    private final BroadcastHub hub;
    private final TelemetryProperties properties;

    @Scheduled(
            fixedRateString = "${signalwatch.broadcast.sweep-rate-millis:30000}",
            initialDelayString = "${signalwatch.broadcast.sweep-rate-millis:30000}")
    public void sweep() {
        TelemetryProperties.Broadcast config = properties.getBroadcast();
        int stalled = hub.cleanupStalled(config.getPushTimeout());
        int idle = hub.cleanupStale(config.getIdleTimeout());
        if (log.isDebugEnabled()) {
            log.debug(
                    "Subscriber sweep removed idle={} stalled={} remaining={}",
                    idle,
                    stalled,
                    hub.subscriberCount());
        }
    }
}
