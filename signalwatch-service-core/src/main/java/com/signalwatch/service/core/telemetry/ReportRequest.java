package com.signalwatch.service.core.telemetry;

import com.signalwatch.service.core.model.Outcome;
import java.util.Map;
import lombok.Builder;

/**
 * One "event processed" report from a source. {@code kind} names the event type; when the outcome
 * is {@link Outcome#TRIGGERED} it is also the type of the record the source emitted.
 */
@Builder
public record ReportRequest(
        String sourceId,
        String sourceName,
        String kind,
        Map<String, Object> payload,
        Outcome outcome,
        long processingTimeMs,
        Double confidence) {

    public ReportRequest {
        payload = payload == null ? Map.of() : payload;
    }
}
