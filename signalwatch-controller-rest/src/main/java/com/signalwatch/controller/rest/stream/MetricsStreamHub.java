package com.signalwatch.controller.rest.stream;

import com.signalwatch.service.core.model.SourceState;
import com.signalwatch.service.core.stats.SourceSummary;
import com.signalwatch.service.core.stats.Statistics;
import com.signalwatch.service.core.stats.SystemStatistics;
import com.signalwatch.service.core.telemetry.TelemetryFacade;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

/**
 * Open metrics streams. Each client gets a frame when it connects and then one per tick of
 * {@code signalwatch.metrics.stream-rate-millis}. A write that fails removes the client; nothing is
 * retried.
 */
@Component
@Slf4j
public class MetricsStreamHub {

    public enum Kind {
        SYSTEM,
        SOURCE,
        SUMMARY
    }

    private final TelemetryFacade telemetry;
    private final SseFrames frames;
    private final ConcurrentMap<String, Client> clients = new ConcurrentHashMap<>();

    public MetricsStreamHub(TelemetryFacade telemetry, SseFrames frames) {
        this.telemetry = telemetry;
        this.frames = frames;
    }

    /**
     * Writes the first frame and registers the client. Returns {@code false} when that first write
     * already fails.
     */
    public boolean open(String clientId, Kind kind, String sourceId, ResponseBodyEmitter emitter) {
        Objects.requireNonNull(clientId, "clientId");
        if (kind == Kind.SOURCE && sourceId == null) {
            throw new IllegalArgumentException("sourceId is required for a source metrics stream");
        }
        Client client = new Client(clientId, kind, sourceId, emitter);
        Optional<String> first = render(client, new Tick());
        if (first.isPresent() && !client.write(first.get())) {
            return false;
        }
        clients.put(clientId, client);
        log.info("Metrics stream {} opened ({}{})", clientId, kind, sourceId == null ? "" : " " + sourceId);
        return true;
    }

    /** Forgets a client whose connection already ended. Unknown ids are ignored. */
    public void remove(String clientId) {
        if (clientId != null && clients.remove(clientId) != null) {
            log.info("Metrics stream {} closed", clientId);
        }
    }

    @Scheduled(
            fixedRateString = "${signalwatch.metrics.stream-rate-millis:2000}",
            initialDelayString = "${signalwatch.metrics.stream-rate-millis:2000}")
    public void pushUpdates() {
        if (clients.isEmpty()) {
            return;
        }
        Tick tick = new Tick();
        for (Client client : List.copyOf(clients.values())) {
            Optional<String> frame = render(client, tick);
            if (frame.isPresent() && !client.write(frame.get())) {
                drop(client);
            }
        }
    }

    public int clientCount() {
        return clients.size();
    }

    @PreDestroy
    public void shutdown() {
        List.copyOf(clients.values()).forEach(this::drop);
    }

    private Optional<String> render(Client client, Tick tick) {
        return switch (client.kind) {
            case SYSTEM -> Optional.of(frames.systemMetrics(tick.system()));
            case SUMMARY -> Optional.of(frames.metricsSummary(tick.summaries()));
            case SOURCE -> {
                Optional<SourceState> state = telemetry.getState(client.sourceId);
                Optional<Statistics> stats = telemetry.statistics(client.sourceId);
                yield state.isPresent() && stats.isPresent()
                        ? Optional.of(frames.sourceMetrics(state.get(), stats.get()))
                        : Optional.empty();
            }
        };
    }

    private void drop(Client client) {
        if (clients.remove(client.id, client)) {
            try {
                client.emitter.complete();
            } catch (RuntimeException ex) {
                log.debug("Metrics stream {} already finished: {}", client.id, ex.toString());
            }
        }
    }

    /** Shared reads for one push round, computed on first use. */
    private final class Tick {
        private SystemStatistics system;
        private List<SourceSummary> summaries;

        SystemStatistics system() {
            if (system == null) {
                system = telemetry.systemStatistics();
            }
            return system;
        }

        List<SourceSummary> summaries() {
            if (summaries == null) {
                summaries = telemetry.summaries();
            }
            return summaries;
        }
    }

    private static final class Client {
        private final String id;
        private final Kind kind;
        private final String sourceId;
        private final ResponseBodyEmitter emitter;

        Client(String id, Kind kind, String sourceId, ResponseBodyEmitter emitter) {
            this.id = id;
            this.kind = kind;
            this.sourceId = sourceId;
            this.emitter = emitter;
        }

        boolean write(String frame) {
            try {
                emitter.send(frame, SseRecordSink.FRAME_TYPE);
                return true;
            } catch (IOException | IllegalStateException ex) {
                log.warn("Metrics stream {} write failed, closing it: {}", id, ex.toString());
                return false;
            }
        }
    }
}
