package com.signalwatch.controller.rest.stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.signalwatch.controller.rest.MockMvcSupport;
import com.signalwatch.service.core.model.SourceState;
import com.signalwatch.service.core.model.SourceStatus;
import com.signalwatch.service.core.stats.SourceSummary;
import com.signalwatch.service.core.stats.Statistics;
import com.signalwatch.service.core.stats.SystemStatistics;
import com.signalwatch.service.core.telemetry.TelemetryFacade;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

class MetricsStreamHubTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private TelemetryFacade telemetry;
    private MetricsStreamHub hub;

    @BeforeEach
    void setUp() {
        telemetry = mock(TelemetryFacade.class);
        hub = new MetricsStreamHub(telemetry, new SseFrames(MockMvcSupport.MAPPER, Clock.systemUTC()));
        when(telemetry.systemStatistics())
                .thenReturn(new SystemStatistics(
                        NOW,
                        1,
                        1,
                        Duration.ofMinutes(5),
                        3,
                        2,
                        0,
                        12.5,
                        "scanner-1",
                        new SystemStatistics.HistorySizes(4, 2, 2),
                        Map.of("scanner-1", Statistics.empty())));
        when(telemetry.summaries())
                .thenReturn(List.of(SourceSummary.builder()
                        .sourceId("scanner-1")
                        .status(SourceSummary.ACTIVE)
                        .build()));
    }

    @Test
    void eachClientGetsItsKindOnOpenAndOnEveryPush() {
        RecordingEmitter system = new RecordingEmitter();
        RecordingEmitter summary = new RecordingEmitter();

        assertThat(hub.open("metrics_a", MetricsStreamHub.Kind.SYSTEM, null, system)).isTrue();
        assertThat(hub.open("metrics_b", MetricsStreamHub.Kind.SUMMARY, null, summary)).isTrue();
        hub.pushUpdates();

        assertThat(system.frames).hasSize(2).allSatisfy(frame -> assertThat(frame)
                .startsWith("data: {")
                .contains("\"type\":\"system_metrics\"")
                .contains("\"topPerformingSource\":\"scanner-1\""));
        assertThat(summary.frames).hasSize(2).allSatisfy(frame -> assertThat(frame)
                .contains("\"type\":\"metrics_summary\"")
                .contains("\"count\":1"));
        assertThat(hub.clientCount()).isEqualTo(2);
    }

    @Test
    void pushReadsSharedStatisticsOncePerRound() {
        hub.open("metrics_a", MetricsStreamHub.Kind.SYSTEM, null, new RecordingEmitter());
        hub.open("metrics_b", MetricsStreamHub.Kind.SYSTEM, null, new RecordingEmitter());

        hub.pushUpdates();

        // two opens plus one shared read for the push
        verify(telemetry, times(3)).systemStatistics();
    }

    @Test
    void sourceStreamFollowsItsSource() {
        SourceState state = SourceState.builder()
                .sourceId("scanner-1")
                .name("Launch Scanner")
                .status(SourceStatus.ACTIVE)
                .build();
        when(telemetry.getState("scanner-1")).thenReturn(Optional.of(state));
        when(telemetry.statistics("scanner-1")).thenReturn(Optional.of(Statistics.empty()));
        RecordingEmitter emitter = new RecordingEmitter();

        hub.open("metrics_s", MetricsStreamHub.Kind.SOURCE, "scanner-1", emitter);

        assertThat(emitter.frames).singleElement().satisfies(frame -> assertThat(frame)
                .contains("\"type\":\"source_metrics\"")
                .contains("\"sourceId\":\"scanner-1\"")
                .contains("\"name\":\"Launch Scanner\""));
    }

    @Test
    void sourceStreamRequiresSourceId() {
        assertThatThrownBy(() -> hub.open("metrics_s", MetricsStreamHub.Kind.SOURCE, null, new RecordingEmitter()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(hub.clientCount()).isZero();
    }

    @Test
    void failedWriteDropsOnlyThatClient() {
        RecordingEmitter healthy = new RecordingEmitter();
        RecordingEmitter broken = new RecordingEmitter();
        hub.open("metrics_ok", MetricsStreamHub.Kind.SYSTEM, null, healthy);
        hub.open("metrics_broken", MetricsStreamHub.Kind.SYSTEM, null, broken);

        broken.failing = true;
        hub.pushUpdates();
        hub.pushUpdates();

        assertThat(hub.clientCount()).isEqualTo(1);
        assertThat(broken.completed).isTrue();
        assertThat(broken.frames).hasSize(1);
        assertThat(healthy.frames).hasSize(3);
    }

    @Test
    void failingFirstWriteIsNotRegistered() {
        RecordingEmitter broken = new RecordingEmitter();
        broken.failing = true;

        assertThat(hub.open("metrics_x", MetricsStreamHub.Kind.SUMMARY, null, broken)).isFalse();
        assertThat(hub.clientCount()).isZero();
    }

    @Test
    void removeAndShutdownForgetClients() {
        RecordingEmitter first = new RecordingEmitter();
        RecordingEmitter second = new RecordingEmitter();
        hub.open("metrics_1", MetricsStreamHub.Kind.SYSTEM, null, first);
        hub.open("metrics_2", MetricsStreamHub.Kind.SYSTEM, null, second);

        hub.remove("metrics_1");
        hub.remove("unknown");
        assertThat(hub.clientCount()).isEqualTo(1);

        hub.shutdown();
        assertThat(hub.clientCount()).isZero();
        assertThat(second.completed).isTrue();
        assertThat(first.completed).isFalse();
    }

    private static final class RecordingEmitter extends ResponseBodyEmitter {
        private final List<String> frames = new ArrayList<>();
        private volatile boolean failing;
        private volatile boolean completed;

        RecordingEmitter() {
            super(0L);
        }

        @Override
        public synchronized void send(Object object, MediaType mediaType) throws IOException {
            if (failing) {
                throw new IOException("Broken pipe");
            }
            frames.add((String) object);
        }

        @Override
        public synchronized void complete() {
            completed = true;
            super.complete();
        }
    }
}
