package com.signalwatch.service.core.stats;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Map;

/** Point-in-time view of a {@link RunningStats}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Statistics(
        long totalEvents,
        long totalRecords,
        long successfulRecords,
        long failedRecords,
        long errorCount,
        double averageProcessingTime,
        long minProcessingTime,
        long maxProcessingTime,
        double successRate,
        double ratePerHour,
        double eventsPerHour,
        Double averageConfidence,
        Map<String, Long> recordTypes,
        Instant firstObservation,
        Instant lastObservation) {

    public static Statistics empty() {
        return new Statistics(0, 0, 0, 0, 0, 0.0, 0, 0, 1.0, 0.0, 0.0, null, Map.of(), null, null);
    }

    /** Number of samples folded into {@link #averageProcessingTime()}. */
    public long observations() {
        return totalEvents + totalRecords;
    }
}
