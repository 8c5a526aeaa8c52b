package com.signalwatch.service.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;

/**
 * Broadcast projection of a {@link RecordEmission}. {@code id} is assigned at broadcast time and is
 * distinct from the emission's {@code recordId}.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamableRecord(
        String id,
        String recordId,
        String sourceId,
        String sourceName,
        String recordType,
        String marker,
        Instant timestamp,
        Double confidence,
        boolean success,
        long processingTimeMs,
        Map<String, Object> payload,
        RecordClassification classification)
        implements Timestamped {

    public StreamableRecord {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static StreamableRecord of(
            String broadcastId, String sourceName, RecordEmission emission, RecordClassification classification) {
        return StreamableRecord.builder()
                .id(broadcastId)
                .recordId(emission.recordId())
                .sourceId(emission.sourceId())
                .sourceName(sourceName)
                .recordType(emission.recordType())
                .marker(emission.marker())
                .timestamp(emission.timestamp())
                .confidence(emission.confidence())
                .success(emission.success())
                .processingTimeMs(emission.processingTimeMs())
                .payload(emission.payload())
                .classification(classification)
                .build();
    }
}
