package com.signalwatch.controller.rest;

import com.signalwatch.service.core.model.Outcome;
import com.signalwatch.service.core.telemetry.ReportRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.Map;

/** Inbound report from an out-of-process source. */
public record ReportBody(
        @NotBlank String sourceId,
        String sourceName,
        @NotBlank String kind,
        @NotNull Outcome outcome,
        Map<String, Object> payload,
        @PositiveOrZero Long processingTimeMs,
        Double confidence) {

    ReportRequest toRequest() {
        return ReportRequest.builder()
                .sourceId(sourceId)
                .sourceName(sourceName)
                .kind(kind)
                .outcome(outcome)
                .payload(payload)
                .processingTimeMs(processingTimeMs == null ? 0L : processingTimeMs)
                .confidence(confidence)
                .build();
    }
}
