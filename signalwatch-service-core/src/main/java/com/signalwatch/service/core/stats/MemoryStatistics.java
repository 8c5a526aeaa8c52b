package com.signalwatch.service.core.stats;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.signalwatch.service.core.model.SourceStatus;
import java.time.Instant;
import java.util.List;

/** How much history the store holds, overall and per source. */
public record MemoryStatistics(
        int totalSources,
        int activeSources,
        int totalMemoryEntries,
        int totalEmissions,
        int totalOutcomes,
        double entriesPerSource,
        double emissionsPerSource,
        double outcomesPerSource,
        List<SourceDetail> sources) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SourceDetail(
            String sourceId,
            String name,
            SourceStatus status,
            long totalEvents,
            long totalRecords,
            Instant lastActivity,
            int memoryEntries,
            int emissions,
            int outcomes) {}
}
