package com.signalwatch.controller.rest;

import com.signalwatch.service.core.model.SourceState;
import com.signalwatch.service.core.telemetry.ReportResult;
import com.signalwatch.service.core.telemetry.TelemetryFacade;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Report ingestion for sources running outside this process. A report that fails validation is
 * answered with 422 and the validation errors; the source's state records the failure either way.
 */
@RestController
@RequestMapping("/api/reports")
public class ReportController {

    private final TelemetryFacade telemetry;

    public ReportController(TelemetryFacade telemetry) {
        this.telemetry = telemetry;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ReportResult> report(@Valid @RequestBody ReportBody body) {
        ReportResult result = telemetry.report(body.toRequest());
        HttpStatus status = result.accepted() ? HttpStatus.ACCEPTED : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(result);
    }

    @PostMapping(value = "/errors", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.ACCEPTED)
    public SourceState reportError(@Valid @RequestBody ErrorReportBody body) {
        return telemetry.reportError(body.sourceId(), body.sourceName(), body.errorType(), body.message());
    }
}
