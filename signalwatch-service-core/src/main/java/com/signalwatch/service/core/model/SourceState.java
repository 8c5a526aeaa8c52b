package com.signalwatch.service.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;

/** Current state of one monitored source. Instances are immutable; updates produce a copy. */
@Builder(toBuilder = true)
public record SourceState(
        String sourceId,
        String name,
        SourceStatus status,
        Instant lastActivity,
        long totalEvents,
        long totalRecords,
        long triggerCount,
        Map<String, Object> metadata) {

    public SourceState {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
