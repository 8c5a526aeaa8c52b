package com.signalwatch.service.core.stats;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Duration;
import java.time.Instant;
import lombok.Builder;

/**
 * Dashboard row for one source. Ratios and averages are rounded to two decimals; a source is
 * {@code active} when its last observation falls inside the configured window.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SourceSummary(
        String sourceId,
        String name,
        long totalEvents,
        long totalRecords,
        long errorCount,
        double successRate,
        double averageProcessingTime,
        double ratePerHour,
        Instant lastActivity,
        String status) {

    public static final String ACTIVE = "active";
    public static final String INACTIVE = "inactive";

    public static SourceSummary of(
            String sourceId, String name, Statistics stats, Instant now, Duration activeWindow) {
        Instant last = stats.lastObservation();
        boolean active = last != null && Duration.between(last, now).compareTo(activeWindow) < 0;
        return SourceSummary.builder()
                .sourceId(sourceId)
                .name(name)
                .totalEvents(stats.totalEvents())
                .totalRecords(stats.totalRecords())
                .errorCount(stats.errorCount())
                .successRate(round(stats.successRate()))
                .averageProcessingTime(round(stats.averageProcessingTime()))
                .ratePerHour(round(stats.ratePerHour()))
                .lastActivity(last)
                .status(active ? ACTIVE : INACTIVE)
                .build();
    }

    static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
