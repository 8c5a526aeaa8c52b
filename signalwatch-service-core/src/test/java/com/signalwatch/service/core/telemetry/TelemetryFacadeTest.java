package com.signalwatch.service.core.telemetry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.signalwatch.service.core.broadcast.BroadcastHub;
import com.signalwatch.service.core.broadcast.RecordFilter;
import com.signalwatch.service.core.broadcast.RecordSink;
import com.signalwatch.service.core.config.TelemetryProperties;
import com.signalwatch.service.core.model.EventOutcome;
import com.signalwatch.service.core.model.MemoryEntry;
import com.signalwatch.service.core.model.MemoryEntryKind;
import com.signalwatch.service.core.model.Outcome;
import com.signalwatch.service.core.model.Priority;
import com.signalwatch.service.core.model.SourceState;
import com.signalwatch.service.core.model.SourceStatus;
import com.signalwatch.service.core.model.StreamableRecord;
import com.signalwatch.service.core.registry.RecordTypeDefinition;
import com.signalwatch.service.core.registry.RecordTypeRegistry;
import com.signalwatch.service.core.registry.ValidationResult;
import com.signalwatch.service.core.state.HistorySearch;
import com.signalwatch.service.core.state.SourceSnapshot;
import com.signalwatch.service.core.state.StateStore;
import com.signalwatch.service.core.stats.Statistics;
import com.signalwatch.service.core.support.MutableClock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TelemetryFacadeTest {

    /** Knows one type and insists on a "token" field. */
    static final class LaunchRegistry implements RecordTypeRegistry {
        private static final RecordTypeDefinition LAUNCH =
                new RecordTypeDefinition("launch_detected", "LAUNCH", Priority.HIGH, "detection", "new token");

        @Override
        public ValidationResult validate(String recordType, Map<String, Object> payload) {
            if (!LAUNCH.type().equals(recordType)) {
                return ValidationResult.invalid("Unknown record type: " + recordType);
            }
            return payload.containsKey("token") ? ValidationResult.ok() : ValidationResult.invalid("token is required");
        }

        @Override
        public Optional<RecordTypeDefinition> definition(String recordType) {
            return LAUNCH.type().equals(recordType) ? Optional.of(LAUNCH) : Optional.empty();
        }
    }

    static final class CollectingSink implements RecordSink {
        final List<StreamableRecord> received = new CopyOnWriteArrayList<>();

        @Override
        public void push(StreamableRecord record) {
            received.add(record);
        }

        @Override
        public void close() {}
    }

    private MutableClock clock;
    private StateStore store;
    private BroadcastHub hub;
    private TelemetryFacade facade;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T10:00:00Z");
        TelemetryProperties properties = new TelemetryProperties();
        store = new StateStore(properties, clock);
        hub = new BroadcastHub(properties.getBroadcast(), clock, Runnable::run);
        facade = new TelemetryFacade(store, hub, new LaunchRegistry(), clock);
    }

    private static ReportRequest launch(long elapsed, Double confidence) {
        return ReportRequest.builder()
                .sourceId("scanner-1")
                .sourceName("Launch Scanner")
                .kind("launch_detected")
                .outcome(Outcome.TRIGGERED)
                .payload(Map.of("token", "ABC"))
                .processingTimeMs(elapsed)
                .confidence(confidence)
                .build();
    }

    @Test
    void triggeredReportsFeedStatistics() {
        facade.report(launch(10, null));
        facade.report(launch(20, null));
        facade.report(launch(30, null));

        Statistics stats = store.statistics("scanner-1").orElseThrow();
        SourceState state = facade.getState("scanner-1").orElseThrow();

        assertThat(stats.averageProcessingTime()).isCloseTo(20.0, within(1e-9));
        assertThat(stats.successRate()).isEqualTo(1.0);
        assertThat(stats.totalRecords()).isEqualTo(3);
        assertThat(state.totalRecords()).isEqualTo(3);
        assertThat(state.totalEvents()).isEqualTo(3);
        assertThat(state.triggerCount()).isEqualTo(3);
        assertThat(state.status()).isEqualTo(SourceStatus.ACTIVE);
    }

    @Test
    void acceptedRecordIsClassifiedAndPushedToMatchingSubscribers() {
        CollectingSink detection = new CollectingSink();
        CollectingSink critical = new CollectingSink();
        facade.subscribe(
                "dashboard",
                detection,
                RecordFilter.builder().minConfidence(0.9).category("detection").build());
        facade.subscribe("pager", critical, RecordFilter.builder().priority(Priority.CRITICAL).build());

        ReportResult result = facade.report(launch(12, 0.95));

        assertThat(result.accepted()).isTrue();
        StreamableRecord record = result.record();
        assertThat(record.id()).startsWith("stream_");
        assertThat(record.recordId()).startsWith("rec_");
        assertThat(record.marker()).isEqualTo("LAUNCH");
        assertThat(record.sourceName()).isEqualTo("Launch Scanner");
        assertThat(record.classification().priority()).isEqualTo(Priority.HIGH);
        assertThat(record.classification().category()).isEqualTo("detection");
        assertThat(detection.received).containsExactly(record);
        assertThat(critical.received).isEmpty();
        assertThat(facade.recentRecords(null, 10)).containsExactly(record);
    }

    @Test
    void invalidPayloadIsRejectedWithoutBroadcast() {
        CollectingSink sink = new CollectingSink();
        facade.subscribe("all", sink, null);

        ReportResult result = facade.report(ReportRequest.builder()
                .sourceId("scanner-1")
                .kind("launch_detected")
                .outcome(Outcome.TRIGGERED)
                .payload(Map.of("other", 1))
                .processingTimeMs(5)
                .build());

        assertThat(result.accepted()).isFalse();
        assertThat(result.errors()).containsExactly("token is required");
        assertThat(result.status()).isEqualTo(SourceStatus.ERROR);
        assertThat(sink.received).isEmpty();
        assertThat(hub.stats().totalPublished()).isZero();

        Statistics stats = store.statistics("scanner-1").orElseThrow();
        assertThat(stats.failedRecords()).isEqualTo(1);
        assertThat(stats.successRate()).isZero();
        assertThat(facade.searchHistory(HistorySearch.builder()
                        .sourceId("scanner-1")
                        .kind(MemoryEntryKind.ERROR)
                        .build()))
                .singleElement()
                .satisfies(entry -> assertThat(entry.payload()).containsEntry("recordType", "launch_detected"));
    }

    @Test
    void unknownTypeAndOutOfRangeConfidenceAreRejected() {
        ReportResult unknown = facade.report(ReportRequest.builder()
                .sourceId("scanner-1")
                .kind("mystery")
                .outcome(Outcome.TRIGGERED)
                .build());
        ReportResult tooSure = facade.report(launch(1, 1.2));

        assertThat(unknown.errors()).containsExactly("Unknown record type: mystery");
        assertThat(tooSure.accepted()).isFalse();
        assertThat(tooSure.errors()).hasSize(1);
        assertThat(tooSure.errors().get(0)).startsWith("confidence must be within");
    }

    @Test
    void ignoredEventLeavesSourceIdle() {
        ReportResult result = facade.report(ReportRequest.builder()
                .sourceId("scanner-1")
                .kind("block_scanned")
                .outcome(Outcome.IGNORED)
                .processingTimeMs(3)
                .build());

        assertThat(result.accepted()).isTrue();
        assertThat(result.record()).isNull();
        SourceState state = facade.getState("scanner-1").orElseThrow();
        assertThat(state.status()).isEqualTo(SourceStatus.IDLE);
        assertThat(state.totalEvents()).isEqualTo(1);
        assertThat(state.totalRecords()).isZero();
        assertThat(hub.stats().totalPublished()).isZero();
    }

    @Test
    void errorOutcomeMarksSourceFailing() {
        ReportResult result = facade.report(ReportRequest.builder()
                .sourceId("scanner-1")
                .kind("block_scanned")
                .outcome(Outcome.ERROR)
                .payload(Map.of("error", "rpc timeout"))
                .build());

        assertThat(result.accepted()).isFalse();
        assertThat(result.errors()).containsExactly("rpc timeout");
        assertThat(facade.getState("scanner-1")).get().extracting(SourceState::status).isEqualTo(SourceStatus.ERROR);
        assertThat(store.statistics("scanner-1").orElseThrow().errorCount()).isEqualTo(1);
    }

    @Test
    void reportErrorCountsErrorAndLogsIt() {
        SourceState state = facade.reportError("scanner-1", null, "connection", "node unreachable");

        assertThat(state.status()).isEqualTo(SourceStatus.ERROR);
        assertThat(store.statistics("scanner-1").orElseThrow().errorCount()).isEqualTo(1);
        SourceSnapshot snapshot = facade.snapshot("scanner-1").orElseThrow();
        assertThat(snapshot.memoryEntries())
                .extracting(MemoryEntry::kind)
                .contains(MemoryEntryKind.ERROR, MemoryEntryKind.STATE_CHANGE);
    }

    @Test
    void missingFieldsAreRejectedBeforeAnyStateExists() {
        assertThatThrownBy(() -> facade.report(ReportRequest.builder().kind("x").outcome(Outcome.IGNORED).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("sourceId is required");
        assertThatThrownBy(() -> facade.report(ReportRequest.builder().sourceId("s").kind("x").build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(facade.states()).isEmpty();
    }

    @Test
    void snapshotReflectsCompletedReports() {
        facade.report(launch(8, 0.7));

        SourceSnapshot snapshot = facade.snapshot("scanner-1").orElseThrow();

        assertThat(snapshot.state().status()).isEqualTo(SourceStatus.ACTIVE);
        assertThat(snapshot.recentEmissions()).hasSize(1);
        assertThat(snapshot.recentOutcomes())
                .singleElement()
                .extracting(EventOutcome::outcome)
                .isEqualTo(Outcome.TRIGGERED);
        assertThat(snapshot.statistics().averageConfidence()).isCloseTo(0.7, within(1e-9));
        assertThat(facade.systemStatistics().totalSources()).isEqualTo(1);
    }

    @Test
    void concurrentReportsForOneSourceAreSerialized() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<ReportResult>> tasks = new ArrayList<>();
            for (int i = 0; i < 400; i++) {
                tasks.add(() -> facade.report(launch(5, 0.8)));
            }
            for (Future<ReportResult> future : pool.invokeAll(tasks)) {
                assertThat(future.get().accepted()).isTrue();
            }
        } finally {
            pool.shutdownNow();
        }

        SourceState state = facade.getState("scanner-1").orElseThrow();
        Statistics stats = store.statistics("scanner-1").orElseThrow();
        assertThat(state.totalEvents()).isEqualTo(400);
        assertThat(state.triggerCount()).isEqualTo(400);
        assertThat(stats.totalRecords()).isEqualTo(400);
        assertThat(hub.stats().totalPublished()).isEqualTo(400);
        assertThat(store.emissions("scanner-1", 0)).hasSize(400);
    }

    @Test
    void reportInProgressIsInvisibleToHistorySearch() throws Exception {
        CountDownLatch validating = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        LaunchRegistry launches = new LaunchRegistry();
        RecordTypeRegistry gated = new RecordTypeRegistry() {
            @Override
            public ValidationResult validate(String recordType, Map<String, Object> payload) {
                validating.countDown();
                try {
                    proceed.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return launches.validate(recordType, payload);
            }

            @Override
            public Optional<RecordTypeDefinition> definition(String recordType) {
                return launches.definition(recordType);
            }
        };
        TelemetryFacade gatedFacade = new TelemetryFacade(store, hub, gated, clock);
        store.initialize("scanner-1", "Launch Scanner");
        HistorySearch bySource = HistorySearch.builder().sourceId("scanner-1").build();
        List<MemoryEntry> before = gatedFacade.searchHistory(bySource);

        ExecutorService reporter = Executors.newSingleThreadExecutor();
        try {
            Future<ReportResult> pending = reporter.submit(() -> gatedFacade.report(launch(5, 0.9)));
            assertThat(validating.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(gatedFacade.searchHistory(bySource)).isEqualTo(before);
            assertThat(gatedFacade.searchHistory(HistorySearch.builder().build())).isEqualTo(before);
            assertThat(store.emissions("scanner-1", 0)).isEmpty();

            proceed.countDown();
            assertThat(pending.get(5, TimeUnit.SECONDS).accepted()).isTrue();
        } finally {
            proceed.countDown();
            reporter.shutdownNow();
        }

        assertThat(gatedFacade.searchHistory(bySource))
                .extracting(MemoryEntry::kind)
                .contains(MemoryEntryKind.EVENT_PROCESSED, MemoryEntryKind.RECORD_EMITTED);
        assertThat(store.emissions("scanner-1", 0)).hasSize(1);
    }
}
