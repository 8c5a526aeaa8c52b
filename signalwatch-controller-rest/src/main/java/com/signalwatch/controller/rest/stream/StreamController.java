package com.signalwatch.controller.rest.stream;

import com.signalwatch.service.core.broadcast.BroadcastStats;
import com.signalwatch.service.core.broadcast.RecordFilter;
import com.signalwatch.service.core.config.TelemetryProperties;
import com.signalwatch.service.core.model.Priority;
import com.signalwatch.service.core.model.StreamableRecord;
import com.signalwatch.service.core.telemetry.TelemetryFacade;
import java.io.IOException;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

/**
 * Live record stream. Each open connection becomes one hub subscriber; the connection ending for
 * any reason unsubscribes it.
 */
@RestController
@RequestMapping("/api/stream")
@Slf4j
public class StreamController {

    private final TelemetryFacade telemetry;
    private final SseFrames frames;
    private final int historyReplay;

    public StreamController(TelemetryFacade telemetry, SseFrames frames, TelemetryProperties properties) {
        this.telemetry = telemetry;
        this.frames = frames;
        this.historyReplay = properties.getBroadcast().getHistoryReplay();
    }

    @GetMapping(value = "/records", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<ResponseBodyEmitter> records(
            @RequestParam(required = false) String sourceName,
            @RequestParam(required = false) String sourceId,
            @RequestParam(required = false) String recordType,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String priority,
            @RequestParam(required = false) Double minConfidence) {
        RecordFilter filter = filter(sourceName, sourceId, recordType, category, priority, minConfidence);
        String subscriberId = "sse_" + UUID.randomUUID();
        ResponseBodyEmitter emitter = new ResponseBodyEmitter(0L);
        SseRecordSink sink = new SseRecordSink(subscriberId, emitter, frames);

        emitter.onCompletion(() -> telemetry.unsubscribe(subscriberId));
        emitter.onTimeout(() -> telemetry.unsubscribe(subscriberId));
        emitter.onError(ex -> {
            log.debug("Stream {} errored: {}", subscriberId, ex.toString());
            telemetry.unsubscribe(subscriberId);
        });

        if (historyReplay > 0) {
            List<StreamableRecord> replay = telemetry.recentRecords(filter, historyReplay);
            if (!replay.isEmpty()) {
                try {
                    sink.write(frames.history(replay));
                } catch (IOException e) {
                    throw new IllegalStateException("Unable to open record stream", e);
                }
            }
        }
        telemetry.subscribe(subscriberId, sink, filter);

        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .cacheControl(CacheControl.noCache())
                .body(emitter);
    }

    @GetMapping("/recent")
    public List<StreamableRecord> recent(
            @RequestParam(required = false) String sourceName,
            @RequestParam(required = false) String sourceId,
            @RequestParam(required = false) String recordType,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String priority,
            @RequestParam(required = false) Double minConfidence,
            @RequestParam(defaultValue = "50") int limit) {
        return telemetry.recentRecords(filter(sourceName, sourceId, recordType, category, priority, minConfidence), limit);
    }

    @GetMapping("/stats")
    public BroadcastStats stats() {
        return telemetry.broadcastStats();
    }

    static RecordFilter filter(
            String sourceName,
            String sourceId,
            String recordType,
            String category,
            String priority,
            Double minConfidence) {
        if (minConfidence != null && (minConfidence < 0.0 || minConfidence > 1.0)) {
            throw new IllegalArgumentException("minConfidence must be within [0, 1]");
        }
        RecordFilter filter = RecordFilter.builder()
                .sourceName(blankToNull(sourceName))
                .sourceId(blankToNull(sourceId))
                .recordType(blankToNull(recordType))
                .category(blankToNull(category))
                .priority(blankToNull(priority) == null ? null : Priority.fromWire(priority))
                .minConfidence(minConfidence)
                .build();
        return filter.isEmpty() ? null : filter;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
