package com.signalwatch.controller.rest;

import com.signalwatch.service.core.model.MemoryEntry;
import com.signalwatch.service.core.model.MemoryEntryKind;
import com.signalwatch.service.core.state.HistorySearch;
import com.signalwatch.service.core.telemetry.TelemetryFacade;
import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Administrative reads over the memory log. Results are newest first. */
@RestController
@RequestMapping("/api/history")
@Slf4j
public class HistoryController {

    private static final int DEFAULT_ACTIVITY_LIMIT = 50;

    private final TelemetryFacade telemetry;

    public HistoryController(TelemetryFacade telemetry) {
        this.telemetry = telemetry;
    }

    @GetMapping("/search")
    public List<MemoryEntry> search(
            @RequestParam(required = false) String sourceId,
            @RequestParam(required = false) String kind,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        if (start != null && end != null && start.isAfter(end)) {
            throw new IllegalArgumentException("start must not be after end");
        }
        if (offset != null && offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        HistorySearch search = HistorySearch.builder()
                .sourceId(sourceId)
                .kind(kind == null || kind.isBlank() ? null : MemoryEntryKind.fromWire(kind))
                .start(start)
                .end(end)
                .limit(limit)
                .offset(offset)
                .build();
        List<MemoryEntry> entries = telemetry.searchHistory(search);
        log.debug("GET /api/history/search source={} kind={} -> {} entries", sourceId, kind, entries.size());
        return entries;
    }

    @GetMapping("/activity")
    public List<MemoryEntry> activity(@RequestParam(defaultValue = "" + DEFAULT_ACTIVITY_LIMIT) int limit) {
        return telemetry.searchHistory(HistorySearch.builder()
                .limit(limit <= 0 ? DEFAULT_ACTIVITY_LIMIT : limit)
                .build());
    }
}
