package com.signalwatch.controller.rest;

import com.signalwatch.service.core.model.SourceState;
import com.signalwatch.service.core.state.SourceSnapshot;
import com.signalwatch.service.core.telemetry.TelemetryFacade;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/sources")
public class SourceController {
    private final TelemetryFacade telemetry;

    public SourceController(TelemetryFacade telemetry) {
        this.telemetry = telemetry;
    }

    @GetMapping
    public List<SourceState> list() {
        return telemetry.states();
    }

    @GetMapping("/{sourceId}")
    public SourceState state(@PathVariable String sourceId) {
        return telemetry.getState(sourceId).orElseThrow(() -> notFound(sourceId));
    }

    @GetMapping("/{sourceId}/snapshot")
    public SourceSnapshot snapshot(@PathVariable String sourceId) {
        return telemetry.snapshot(sourceId).orElseThrow(() -> notFound(sourceId));
    }

    public static ResponseStatusException notFound(String sourceId) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown source: " + sourceId);
    }
}
