package com.signalwatch.service.core.retention;

import com.signalwatch.service.core.config.TelemetryProperties;
import com.signalwatch.service.core.state.StateStore;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Operator-controlled history purge. The schedule only fires when {@code signalwatch.retention.enabled}
 * is set; {@link #purge(Duration)} backs the admin endpoint either way.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HistoryRetentionJob {

    private final StateStore stateStore;
    private final TelemetryProperties properties;

    @Scheduled(
            fixedRateString = "${signalwatch.retention.rate-millis:3600000}",
            initialDelayString = "${signalwatch.retention.rate-millis:3600000}")
    public void purgeScheduled() {
        TelemetryProperties.Retention retention = properties.getRetention();
        if (!retention.isEnabled()) {
            return;
        }
        purge(retention.getMaxAge());
    }

    public int purge(Duration maxAge) {
        if (maxAge == null || maxAge.isNegative()) {
            throw new IllegalArgumentException("Retention age must be zero or positive");
        }
        int removed = stateStore.purgeOlderThan(maxAge);
        log.info("Retention run removed {} history entries older than {}", removed, maxAge);
        return removed;
    }

    public Duration defaultMaxAge() {
        return properties.getRetention().getMaxAge();
    }
}
