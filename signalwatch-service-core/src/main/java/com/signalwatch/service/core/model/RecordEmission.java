package com.signalwatch.service.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;

/** A record a source produced (or tried to produce) while handling an event. */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecordEmission(
        String recordId,
        String sourceId,
        String recordType,
        String marker,
        Instant timestamp,
        Double confidence,
        boolean success,
        long processingTimeMs,
        Map<String, Object> payload)
        implements Timestamped {

    public RecordEmission {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
