package com.signalwatch.service.core.telemetry;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.signalwatch.service.core.model.SourceStatus;
import com.signalwatch.service.core.model.StreamableRecord;
import java.util.List;

/**
 * Outcome of {@link TelemetryFacade#report(ReportRequest)}. Rejections are values, not exceptions:
 * {@code accepted == false} carries the reasons in {@code errors}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportResult(boolean accepted, StreamableRecord record, List<String> errors, SourceStatus status) {

    public ReportResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    static ReportResult accepted(StreamableRecord record, SourceStatus status) {
        return new ReportResult(true, record, List.of(), status);
    }

    static ReportResult rejected(List<String> errors, SourceStatus status) {
        return new ReportResult(false, null, errors, status);
    }
}
