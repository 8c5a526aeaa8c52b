package com.signalwatch.controller.rest.stream;

import com.signalwatch.controller.rest.SourceController;
import com.signalwatch.service.core.telemetry.TelemetryFacade;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

/** Live statistics streams: system roll-up, one source, and the dashboard summary. */
@RestController
@RequestMapping("/api/metrics/stream")
@Slf4j
public class MetricsStreamController {

    private final TelemetryFacade telemetry;
    private final MetricsStreamHub hub;

    public MetricsStreamController(TelemetryFacade telemetry, MetricsStreamHub hub) {
        this.telemetry = telemetry;
        this.hub = hub;
    }

    @GetMapping(value = "/system", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<ResponseBodyEmitter> system() {
        return open(MetricsStreamHub.Kind.SYSTEM, null);
    }

    @GetMapping(value = "/sources/{sourceId}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<ResponseBodyEmitter> source(@PathVariable String sourceId) {
        if (telemetry.getState(sourceId).isEmpty()) {
            throw SourceController.notFound(sourceId);
        }
        return open(MetricsStreamHub.Kind.SOURCE, sourceId);
    }

    @GetMapping(value = "/summary", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<ResponseBodyEmitter> summary() {
        return open(MetricsStreamHub.Kind.SUMMARY, null);
    }

    private ResponseEntity<ResponseBodyEmitter> open(MetricsStreamHub.Kind kind, String sourceId) {
        String clientId = "metrics_" + UUID.randomUUID();
        ResponseBodyEmitter emitter = new ResponseBodyEmitter(0L);
        emitter.onCompletion(() -> hub.remove(clientId));
        emitter.onTimeout(() -> hub.remove(clientId));
        emitter.onError(ex -> {
            log.debug("Metrics stream {} errored: {}", clientId, ex.toString());
            hub.remove(clientId);
        });
        if (!hub.open(clientId, kind, sourceId, emitter)) {
            throw new IllegalStateException("Unable to open metrics stream");
        }
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .cacheControl(CacheControl.noCache())
                .body(emitter);
    }
}
