package com.signalwatch.service.core.stats;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/** Roll-up across every known source. */
public record SystemStatistics(
        Instant timestamp,
        int totalSources,
        int activeSources,
        Duration uptime,
        long totalEvents,
        long totalRecords,
        long errorCount,
        double averageProcessingTime,
        String topPerformingSource,
        HistorySizes historySizes,
        Map<String, Statistics> sources) {

    public record HistorySizes(int memoryEntries, int emissions, int outcomes) {}
}
