package com.signalwatch.service.core.telemetry;

import com.signalwatch.service.core.broadcast.BroadcastHub;
import com.signalwatch.service.core.broadcast.BroadcastStats;
import com.signalwatch.service.core.broadcast.RecordFilter;
import com.signalwatch.service.core.broadcast.RecordSink;
import com.signalwatch.service.core.model.EventOutcome;
import com.signalwatch.service.core.model.MemoryEntry;
import com.signalwatch.service.core.model.MemoryEntryKind;
import com.signalwatch.service.core.model.Outcome;
import com.signalwatch.service.core.model.RecordClassification;
import com.signalwatch.service.core.model.RecordEmission;
import com.signalwatch.service.core.model.SourceState;
import com.signalwatch.service.core.model.SourceStatus;
import com.signalwatch.service.core.model.StreamableRecord;
import com.signalwatch.service.core.registry.RecordTypeDefinition;
import com.signalwatch.service.core.registry.RecordTypeRegistry;
import com.signalwatch.service.core.registry.ValidationResult;
import com.signalwatch.service.core.state.HistorySearch;
import com.signalwatch.service.core.state.SourceSnapshot;
import com.signalwatch.service.core.state.SourceStateUpdate;
import com.signalwatch.service.core.state.StateStore;
import com.signalwatch.service.core.stats.MemoryStatistics;
import com.signalwatch.service.core.stats.RunningStats;
import com.signalwatch.service.core.stats.SourceSummary;
import com.signalwatch.service.core.stats.Statistics;
import com.signalwatch.service.core.stats.StatisticsComparison;
import com.signalwatch.service.core.stats.StatisticsReset;
import com.signalwatch.service.core.stats.SystemStatistics;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for sources reporting activity, and the read surface handed to the web layer.
 *
 * <p>A report runs entirely under the source's lock: status goes to processing, the payload is
 * validated, statistics and history are updated, the final status is set and, for an accepted
 * record, the record is published. Publishing only enqueues, so subscriber speed never reaches the
 * caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TelemetryFacade {

    private final StateStore stateStore;
    private final BroadcastHub hub;
    private final RecordTypeRegistry registry;
    private final Clock clock;

    public ReportResult report(ReportRequest request) {
        requireText(request.sourceId(), "sourceId");
        requireText(request.kind(), "kind");
        if (request.outcome() == null) {
            throw new IllegalArgumentException("outcome is required");
        }
        String sourceId = request.sourceId();
        stateStore.initialize(sourceId, request.sourceName());
        return stateStore.withSourceLock(sourceId, () -> {
            stateStore.update(sourceId, SourceStateUpdate.status(SourceStatus.PROCESSING));
            return switch (request.outcome()) {
                case TRIGGERED -> triggered(request);
                case IGNORED -> ignored(request);
                case ERROR -> sourceError(request);
            };
        });
    }

    /** Records an error that is not tied to a particular event and marks the source as failing. */
    public SourceState reportError(String sourceId, String sourceName, String errorType, String message) {
        requireText(sourceId, "sourceId");
        stateStore.initialize(sourceId, sourceName);
        return stateStore.withSourceLock(sourceId, () -> {
            stateStore.runningStats(sourceId).recordError();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("errorType", errorType == null ? "unknown" : errorType);
            details.put("message", message == null ? "" : message);
            stateStore.logEntry(sourceId, MemoryEntryKind.ERROR, details);
            log.warn("Source {} reported error {}: {}", sourceId, errorType, message);
            return stateStore.update(sourceId, SourceStateUpdate.status(SourceStatus.ERROR));
        });
    }

    // ---- read surface ----------------------------------------------------------------------

    public Optional<SourceState> getState(String sourceId) {
        return stateStore.get(sourceId);
    }

    public List<SourceState> states() {
        return stateStore.states();
    }

    public Optional<SourceSnapshot> snapshot(String sourceId) {
        return stateStore.snapshot(sourceId);
    }

    public List<MemoryEntry> searchHistory(HistorySearch search) {
        return stateStore.searchHistory(search);
    }

    public Optional<Statistics> statistics(String sourceId) {
        return stateStore.statistics(sourceId);
    }

    public SystemStatistics systemStatistics() {
        return stateStore.systemStatistics();
    }

    public List<SourceSummary> summaries() {
        return stateStore.summaries();
    }

    public StatisticsComparison comparison() {
        return StatisticsComparison.of(stateStore.systemStatistics().sources(), Instant.now(clock));
    }

    public MemoryStatistics memoryStatistics() {
        return stateStore.memoryStatistics();
    }

    public Optional<StatisticsReset> resetStatistics(String sourceId) {
        return stateStore.resetStatistics(sourceId);
    }

    public StatisticsReset resetAllStatistics() {
        return stateStore.resetAllStatistics();
    }

    public List<StreamableRecord> recentRecords(RecordFilter filter, Integer limit) {
        return hub.recentRecords(filter, limit);
    }

    public BroadcastStats broadcastStats() {
        return hub.stats();
    }

    public void subscribe(String subscriberId, RecordSink sink, RecordFilter filter) {
        hub.subscribe(subscriberId, sink, filter);
    }

    public void unsubscribe(String subscriberId) {
        hub.unsubscribe(subscriberId);
    }

    // ---- report paths ----------------------------------------------------------------------

    private ReportResult triggered(ReportRequest request) {
        String sourceId = request.sourceId();
        long elapsed = Math.max(0L, request.processingTimeMs());
        Instant now = Instant.now(clock);

        List<String> errors = new ArrayList<>();
        Double confidence = request.confidence();
        if (confidence != null && (confidence.isNaN() || confidence < 0.0 || confidence > 1.0)) {
            errors.add("confidence must be within [0, 1], got " + confidence);
        }
        ValidationResult validation = registry.validate(request.kind(), request.payload());
        if (!validation.valid()) {
            errors.addAll(validation.errors());
        }
        Optional<RecordTypeDefinition> definition = registry.definition(request.kind());
        boolean success = errors.isEmpty();

        RecordEmission emission = RecordEmission.builder()
                .recordId("rec_" + UUID.randomUUID())
                .sourceId(sourceId)
                .recordType(request.kind())
                .marker(definition.map(RecordTypeDefinition::marker).orElse(null))
                .timestamp(now)
                .confidence(confidence)
                .success(success)
                .processingTimeMs(elapsed)
                .payload(success ? request.payload() : Map.of("errors", errors))
                .build();

        RunningStats stats = stateStore.runningStats(sourceId);
        stats.recordEvent(success, elapsed);
        stats.recordEmission(request.kind(), success, elapsed, success ? confidence : null);
        stateStore.appendEmission(emission);
        stateStore.appendOutcome(outcome(request, now, success ? Outcome.TRIGGERED : Outcome.ERROR, elapsed));

        SourceState current = stateStore.get(sourceId).orElseThrow();
        if (!success) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("recordType", request.kind());
            details.put("errors", errors);
            stateStore.logEntry(sourceId, MemoryEntryKind.ERROR, details);
            SourceState updated = stateStore.update(
                    sourceId,
                    SourceStateUpdate.builder()
                            .status(SourceStatus.ERROR)
                            .totalEvents(current.totalEvents() + 1)
                            .totalRecords(current.totalRecords() + 1)
                            .build());
            log.warn("Rejected {} record from source {}: {}", request.kind(), sourceId, errors);
            return ReportResult.rejected(errors, updated.status());
        }

        stateStore.logEntry(sourceId, MemoryEntryKind.EVENT_PROCESSED, eventDetails(request, elapsed));
        Map<String, Object> emitted = new LinkedHashMap<>();
        emitted.put("recordType", request.kind());
        emitted.put("recordId", emission.recordId());
        emitted.put("success", true);
        if (confidence != null) emitted.put("confidence", confidence);
        stateStore.logEntry(sourceId, MemoryEntryKind.RECORD_EMITTED, emitted);

        SourceState updated = stateStore.update(
                sourceId,
                SourceStateUpdate.builder()
                        .status(SourceStatus.ACTIVE)
                        .totalEvents(current.totalEvents() + 1)
                        .totalRecords(current.totalRecords() + 1)
                        .triggerCount(current.triggerCount() + 1)
                        .build());

        RecordClassification classification = definition
                .map(d -> new RecordClassification(d.priority(), d.category(), sourceId))
                .orElse(null);
        StreamableRecord record =
                StreamableRecord.of("stream_" + UUID.randomUUID(), updated.name(), emission, classification);
        hub.publish(record);
        if (log.isDebugEnabled()) {
            log.debug(
                    "Source {} emitted {} record {} confidence={} in {}ms",
                    sourceId,
                    request.kind(),
                    emission.recordId(),
                    confidence,
                    elapsed);
        }
        return ReportResult.accepted(record, updated.status());
    }

    private ReportResult ignored(ReportRequest request) {
        String sourceId = request.sourceId();
        long elapsed = Math.max(0L, request.processingTimeMs());
        stateStore.runningStats(sourceId).recordEvent(true, elapsed);
        stateStore.appendOutcome(outcome(request, Instant.now(clock), Outcome.IGNORED, elapsed));
        stateStore.logEntry(sourceId, MemoryEntryKind.EVENT_PROCESSED, eventDetails(request, elapsed));
        SourceState current = stateStore.get(sourceId).orElseThrow();
        SourceState updated = stateStore.update(
                sourceId,
                SourceStateUpdate.builder()
                        .status(SourceStatus.IDLE)
                        .totalEvents(current.totalEvents() + 1)
                        .build());
        return ReportResult.accepted(null, updated.status());
    }

    private ReportResult sourceError(ReportRequest request) {
        String sourceId = request.sourceId();
        long elapsed = Math.max(0L, request.processingTimeMs());
        stateStore.runningStats(sourceId).recordEvent(false, elapsed);
        stateStore.appendOutcome(outcome(request, Instant.now(clock), Outcome.ERROR, elapsed));

        Object reported = request.payload().get("error");
        String message = reported == null ? "source reported an error handling " + request.kind() : reported.toString();
        Map<String, Object> details = eventDetails(request, elapsed);
        details.put("message", message);
        stateStore.logEntry(sourceId, MemoryEntryKind.ERROR, details);

        SourceState current = stateStore.get(sourceId).orElseThrow();
        SourceState updated = stateStore.update(
                sourceId,
                SourceStateUpdate.builder()
                        .status(SourceStatus.ERROR)
                        .totalEvents(current.totalEvents() + 1)
                        .build());
        return ReportResult.rejected(List.of(message), updated.status());
    }

    private EventOutcome outcome(ReportRequest request, Instant now, Outcome outcome, long elapsed) {
        return EventOutcome.builder()
                .eventId("evt_" + UUID.randomUUID())
                .sourceId(request.sourceId())
                .eventType(request.kind())
                .timestamp(now)
                .processed(outcome != Outcome.ERROR)
                .processingTimeMs(elapsed)
                .outcome(outcome)
                .payload(request.payload())
                .build();
    }

    private static Map<String, Object> eventDetails(ReportRequest request, long elapsed) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("eventType", request.kind());
        details.put("outcome", request.outcome().wireName());
        details.put("processingTime", elapsed);
        return details;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}
