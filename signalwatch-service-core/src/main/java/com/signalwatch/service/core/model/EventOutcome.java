package com.signalwatch.service.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;

@Builder
public record EventOutcome(
        String eventId,
        String sourceId,
        String eventType,
        Instant timestamp,
        boolean processed,
        long processingTimeMs,
        Outcome outcome,
        Map<String, Object> payload)
        implements Timestamped {

    public EventOutcome {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
