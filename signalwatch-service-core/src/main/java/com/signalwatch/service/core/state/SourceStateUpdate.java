package com.signalwatch.service.core.state;

import com.signalwatch.service.core.model.SourceState;
import com.signalwatch.service.core.model.SourceStatus;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;

/**
 * Partial update of a {@link SourceState}. Absent fields keep their current value; metadata entries
 * are merged into the existing map.
 */
@Builder
public record SourceStateUpdate(
        SourceStatus status, Long totalEvents, Long totalRecords, Long triggerCount, Map<String, Object> metadata) {

    public static SourceStateUpdate status(SourceStatus status) {
        return SourceStateUpdate.builder().status(status).build();
    }

    SourceState applyTo(SourceState current, Instant now) {
        SourceState.SourceStateBuilder next = current.toBuilder().lastActivity(now);
        if (status != null) next.status(status);
        if (totalEvents != null) next.totalEvents(totalEvents);
        if (totalRecords != null) next.totalRecords(totalRecords);
        if (triggerCount != null) next.triggerCount(triggerCount);
        if (metadata != null && !metadata.isEmpty()) {
            Map<String, Object> merged = new LinkedHashMap<>(current.metadata());
            merged.putAll(metadata);
            next.metadata(merged);
        }
        return next.build();
    }

    /** Fields actually supplied, for the audit trail. */
    Map<String, Object> describe() {
        Map<String, Object> out = new LinkedHashMap<>();
        if (status != null) out.put("status", status.wireName());
        if (totalEvents != null) out.put("totalEvents", totalEvents);
        if (totalRecords != null) out.put("totalRecords", totalRecords);
        if (triggerCount != null) out.put("triggerCount", triggerCount);
        if (metadata != null && !metadata.isEmpty()) out.put("metadata", metadata);
        return out;
    }
}
