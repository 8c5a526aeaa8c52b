package com.signalwatch.service.core.state;

import com.signalwatch.service.core.config.TelemetryProperties;
import com.signalwatch.service.core.history.BoundedHistory;
import com.signalwatch.service.core.history.HistoryQuery;
import com.signalwatch.service.core.model.EventOutcome;
import com.signalwatch.service.core.model.MemoryEntry;
import com.signalwatch.service.core.model.MemoryEntryKind;
import com.signalwatch.service.core.model.RecordEmission;
import com.signalwatch.service.core.model.SourceState;
import com.signalwatch.service.core.model.SourceStatus;
import com.signalwatch.service.core.stats.MemoryStatistics;
import com.signalwatch.service.core.stats.RunningStats;
import com.signalwatch.service.core.stats.SourceSummary;
import com.signalwatch.service.core.stats.Statistics;
import com.signalwatch.service.core.stats.StatisticsReset;
import com.signalwatch.service.core.stats.SystemStatistics;
import com.signalwatch.service.core.support.ContentFingerprint;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Owns every source's state, history and running statistics.
 *
 * <p>Each source has its own {@link ReentrantLock}: writes for one source are serialized while
 * different sources proceed independently. {@link #withSourceLock(String, Supplier)} lets a caller
 * run a multi-step update as one unit: history written inside it is held back and appended in one
 * step when the action returns, so neither lock-taking reads nor lock-free history searches ever
 * observe it half-done.
 *
 * <p>Sources live for the lifetime of the store. {@link #purgeOlderThan(Duration)} trims history
 * only; state and counters are untouched. Running statistics go back to zero only through an
 * explicit {@link #resetStatistics(String)} or {@link #resetAllStatistics()}.
 */
@Component
@Slf4j
public class StateStore {

    private final Clock clock;
    private final TelemetryProperties.Snapshot snapshotLimits;
    private final int defaultSearchLimit;
    private final Duration activeWindow;
    private final Instant startedAt;

    private final ConcurrentMap<String, SourceSlot> slots = new ConcurrentHashMap<>();
    private final BoundedHistory<MemoryEntry> memory;
    private final BoundedHistory<RecordEmission> emissions;
    private final BoundedHistory<EventOutcome> outcomes;

    public StateStore(TelemetryProperties properties, Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.snapshotLimits = properties.getSnapshot();
        this.defaultSearchLimit = properties.getSearch().getDefaultLimit();
        this.activeWindow = properties.getMetrics().getActiveWindow();
        this.startedAt = Instant.now(clock);
        TelemetryProperties.History caps = properties.getHistory();
        this.memory = new BoundedHistory<>(caps.getMemoryCapacity(), clock);
        this.emissions = new BoundedHistory<>(caps.getEmissionCapacity(), clock);
        this.outcomes = new BoundedHistory<>(caps.getOutcomeCapacity(), clock);
    }

    /** Creates the source on first sight. Later calls return the existing state untouched. */
    public SourceState initialize(String sourceId, String name) {
        Objects.requireNonNull(sourceId, "sourceId");
        SourceSlot existing = slots.get(sourceId);
        if (existing != null) {
            return existing.state;
        }
        Instant now = Instant.now(clock);
        SourceState initial = SourceState.builder()
                .sourceId(sourceId)
                .name(name == null || name.isBlank() ? sourceId : name)
                .status(SourceStatus.IDLE)
                .lastActivity(now)
                .build();
        SourceSlot created = new SourceSlot(initial, new RunningStats(clock));
        created.lock.lock();
        try {
            SourceSlot raced = slots.putIfAbsent(sourceId, created);
            if (raced != null) {
                return raced.state;
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("action", "initialized");
            payload.put("name", initial.name());
            appendMemory(created, sourceId, MemoryEntryKind.STATE_CHANGE, payload);
            log.info("Initialized source {} ({})", sourceId, initial.name());
            return initial;
        } finally {
            created.lock.unlock();
        }
    }

    /**
     * Applies a partial update and stamps last-activity. Every call leaves a {@code state_change}
     * entry carrying the previous and new status.
     *
     * @throws SourceNotInitializedException if the source was never initialized
     */
    public SourceState update(String sourceId, SourceStateUpdate update) {
        SourceSlot slot = requireSlot(sourceId);
        slot.lock.lock();
        try {
            SourceState previous = slot.state;
            SourceState next = (update == null ? SourceStateUpdate.builder().build() : update)
                    .applyTo(previous, Instant.now(clock));
            slot.state = next;
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("previous", previous.status().wireName());
            payload.put("new", next.status().wireName());
            payload.put("updates", update == null ? Map.of() : update.describe());
            appendMemory(slot, sourceId, MemoryEntryKind.STATE_CHANGE, payload);
            return next;
        } finally {
            slot.lock.unlock();
        }
    }

    /** Current state. Waits for an in-flight report on the source to finish. */
    public Optional<SourceState> get(String sourceId) {
        SourceSlot slot = sourceId == null ? null : slots.get(sourceId);
        return slot == null ? Optional.empty() : Optional.of(slot.read(() -> slot.state));
    }

    public boolean contains(String sourceId) {
        return sourceId != null && slots.containsKey(sourceId);
    }

    public List<SourceState> states() {
        List<SourceState> out = new ArrayList<>(slots.size());
        slots.values().forEach(slot -> out.add(slot.read(() -> slot.state)));
        out.sort(Comparator.comparing(SourceState::sourceId));
        return out;
    }

    /**
     * Runs {@code action} holding the source's lock. Memory entries, emissions and outcomes it
     * appends become visible together when it returns, whether it completes or throws.
     */
    public <T> T withSourceLock(String sourceId, Supplier<T> action) {
        SourceSlot slot = requireSlot(sourceId);
        slot.lock.lock();
        boolean outermost = slot.pending == null;
        if (outermost) {
            slot.pending = new PendingWrites();
        }
        try {
            return action.get();
        } finally {
            if (outermost) {
                PendingWrites writes = slot.pending;
                slot.pending = null;
                writes.flush(sourceId);
            }
            slot.lock.unlock();
        }
    }

    /** Live aggregator for one source. Mutate it only while holding the source's lock. */
    public RunningStats runningStats(String sourceId) {
        return requireSlot(sourceId).stats;
    }

    public Optional<Statistics> statistics(String sourceId) {
        SourceSlot slot = sourceId == null ? null : slots.get(sourceId);
        return slot == null ? Optional.empty() : Optional.of(slot.read(slot.stats::snapshot));
    }

    public MemoryEntry logEntry(String sourceId, MemoryEntryKind kind, Map<String, Object> payload) {
        SourceSlot slot = requireSlot(sourceId);
        slot.lock.lock();
        try {
            return appendMemory(slot, sourceId, kind, payload);
        } finally {
            slot.lock.unlock();
        }
    }

    public void appendEmission(RecordEmission emission) {
        SourceSlot slot = requireSlot(emission.sourceId());
        slot.lock.lock();
        try {
            if (slot.pending != null) {
                slot.pending.emissions.add(emission);
            } else {
                emissions.append(emission.sourceId(), emission);
            }
        } finally {
            slot.lock.unlock();
        }
    }

    public void appendOutcome(EventOutcome outcome) {
        SourceSlot slot = requireSlot(outcome.sourceId());
        slot.lock.lock();
        try {
            if (slot.pending != null) {
                slot.pending.outcomes.add(outcome);
            } else {
                outcomes.append(outcome.sourceId(), outcome);
            }
        } finally {
            slot.lock.unlock();
        }
    }

    public Optional<SourceSnapshot> snapshot(String sourceId) {
        SourceSlot slot = sourceId == null ? null : slots.get(sourceId);
        if (slot == null) {
            return Optional.empty();
        }
        slot.lock.lock();
        try {
            SourceState state = slot.state;
            return Optional.of(new SourceSnapshot(
                    sourceId,
                    state.name(),
                    Instant.now(clock),
                    state,
                    emissions.recent(sourceId, snapshotLimits.getRecentEmissions()),
                    outcomes.recent(sourceId, snapshotLimits.getRecentOutcomes()),
                    memory.recent(sourceId, snapshotLimits.getRecentEntries()),
                    slot.stats.snapshot()));
        } finally {
            slot.lock.unlock();
        }
    }

    /** Memory entries across sources, newest first. Unknown sources yield an empty list. */
    public List<MemoryEntry> searchHistory(HistorySearch search) {
        HistorySearch s = search == null ? HistorySearch.builder().build() : search;
        MemoryEntryKind kind = s.kind();
        return memory.query(HistoryQuery.<MemoryEntry>builder()
                .key(s.sourceId())
                .filter(kind == null ? null : entry -> entry.kind() == kind)
                .from(s.start())
                .to(s.end())
                .offset(s.offset() == null ? 0 : Math.max(0, s.offset()))
                .limit(s.limit() == null ? defaultSearchLimit : s.limit())
                .build());
    }

    public List<RecordEmission> emissions(String sourceId, int limit) {
        return emissions.query(HistoryQuery.<RecordEmission>builder()
                .key(sourceId)
                .limit(limit)
                .build());
    }

    /**
     * Zeroes one source's running statistics and records the reset in its history. State counters
     * and history stay as they are.
     */
    public Optional<StatisticsReset> resetStatistics(String sourceId) {
        if (!contains(sourceId)) {
            return Optional.empty();
        }
        Instant now = Instant.now(clock);
        withSourceLock(sourceId, () -> {
            resetSlot(sourceId, slots.get(sourceId));
            return null;
        });
        log.info("Statistics reset for source {}", sourceId);
        return Optional.of(new StatisticsReset(sourceId, 1, now));
    }

    public StatisticsReset resetAllStatistics() {
        Instant now = Instant.now(clock);
        List<String> ids = new ArrayList<>(slots.keySet());
        ids.sort(Comparator.naturalOrder());
        for (String id : ids) {
            withSourceLock(id, () -> {
                resetSlot(id, slots.get(id));
                return null;
            });
        }
        log.info("Statistics reset for all {} sources", ids.size());
        return new StatisticsReset(null, ids.size(), now);
    }

    /**
     * One row per source, best success rate first; equal rates order by source id. Activity is
     * judged against {@code signalwatch.metrics.active-window}.
     */
    public List<SourceSummary> summaries() {
        Instant now = Instant.now(clock);
        List<SourceSummary> out = new ArrayList<>(slots.size());
        slots.forEach((id, slot) -> out.add(slot.read(
                () -> SourceSummary.of(id, slot.state.name(), slot.stats.snapshot(), now, activeWindow))));
        out.sort(Comparator.comparingDouble(SourceSummary::successRate)
                .reversed()
                .thenComparing(SourceSummary::sourceId));
        return out;
    }

    public MemoryStatistics memoryStatistics() {
        List<MemoryStatistics.SourceDetail> details = new ArrayList<>(slots.size());
        int active = 0;
        for (SourceState state : states()) {
            String id = state.sourceId();
            if (state.status().isBusy()) {
                active++;
            }
            details.add(new MemoryStatistics.SourceDetail(
                    id,
                    state.name(),
                    state.status(),
                    state.totalEvents(),
                    state.totalRecords(),
                    state.lastActivity(),
                    memory.size(id),
                    emissions.size(id),
                    outcomes.size(id)));
        }
        int sources = details.size();
        int entries = memory.totalSize();
        int emitted = emissions.totalSize();
        int outcomeCount = outcomes.totalSize();
        return new MemoryStatistics(
                sources,
                active,
                entries,
                emitted,
                outcomeCount,
                sources == 0 ? 0.0 : (double) entries / sources,
                sources == 0 ? 0.0 : (double) emitted / sources,
                sources == 0 ? 0.0 : (double) outcomeCount / sources,
                details);
    }

    /** Drops history entries older than {@code age} from all three kinds and returns how many went. */
    public int purgeOlderThan(Duration age) {
        int removedEntries = memory.purgeOlderThan(age);
        int removedEmissions = emissions.purgeOlderThan(age);
        int removedOutcomes = outcomes.purgeOlderThan(age);
        int total = removedEntries + removedEmissions + removedOutcomes;
        log.info(
                "History purge olderThan={} entriesRemoved={} emissionsRemoved={} outcomesRemoved={}",
                age,
                removedEntries,
                removedEmissions,
                removedOutcomes);
        return total;
    }

    public SystemStatistics systemStatistics() {
        Instant now = Instant.now(clock);
        Map<String, Statistics> perSource = new LinkedHashMap<>();
        long totalEvents = 0;
        long totalRecords = 0;
        long errorCount = 0;
        double weightedTime = 0.0;
        long observations = 0;
        int active = 0;
        String top = null;
        double topRate = -1.0;

        List<String> ids = new ArrayList<>(slots.keySet());
        ids.sort(Comparator.naturalOrder());
        for (String id : ids) {
            SourceSlot slot = slots.get(id);
            SourceState state;
            Statistics stats;
            slot.lock.lock();
            try {
                state = slot.state;
                stats = slot.stats.snapshot();
            } finally {
                slot.lock.unlock();
            }
            perSource.put(state.sourceId(), stats);
            totalEvents += stats.totalEvents();
            totalRecords += stats.totalRecords();
            errorCount += stats.errorCount();
            weightedTime += stats.averageProcessingTime() * stats.observations();
            observations += stats.observations();
            if (state.status().isBusy()) {
                active++;
            }
            if (stats.totalRecords() > 0 && stats.successRate() > topRate) {
                topRate = stats.successRate();
                top = state.sourceId();
            }
        }

        return new SystemStatistics(
                now,
                perSource.size(),
                active,
                Duration.between(startedAt, now),
                totalEvents,
                totalRecords,
                errorCount,
                observations == 0 ? 0.0 : weightedTime / observations,
                top,
                new SystemStatistics.HistorySizes(memory.totalSize(), emissions.totalSize(), outcomes.totalSize()),
                perSource);
    }

    private MemoryEntry appendMemory(SourceSlot slot, String sourceId, MemoryEntryKind kind, Map<String, Object> payload) {
        MemoryEntry entry = new MemoryEntry(
                "mem_" + UUID.randomUUID(),
                sourceId,
                Instant.now(clock),
                kind,
                payload,
                ContentFingerprint.of(sourceId, kind.wireName(), payload));
        if (slot.pending != null) {
            slot.pending.memory.add(entry);
        } else {
            memory.append(sourceId, entry);
        }
        return entry;
    }

    private void resetSlot(String sourceId, SourceSlot slot) {
        slot.stats.reset();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", "statistics_reset");
        appendMemory(slot, sourceId, MemoryEntryKind.STATE_CHANGE, payload);
    }

    private SourceSlot requireSlot(String sourceId) {
        SourceSlot slot = sourceId == null ? null : slots.get(sourceId);
        if (slot == null) {
            throw new SourceNotInitializedException(sourceId);
        }
        return slot;
    }

    /** History held back until the enclosing {@link #withSourceLock} action returns. */
    private final class PendingWrites {
        private final List<MemoryEntry> memory = new ArrayList<>();
        private final List<RecordEmission> emissions = new ArrayList<>();
        private final List<EventOutcome> outcomes = new ArrayList<>();

        void flush(String sourceId) {
            // memory last: a search that sees the report's entries also finds its emission
            StateStore.this.emissions.appendAll(sourceId, emissions);
            StateStore.this.outcomes.appendAll(sourceId, outcomes);
            StateStore.this.memory.appendAll(sourceId, memory);
        }
    }

    private static final class SourceSlot {
        private final ReentrantLock lock = new ReentrantLock();
        private final RunningStats stats;
        private volatile SourceState state;
        // guarded by lock
        private PendingWrites pending;

        SourceSlot(SourceState state, RunningStats stats) {
            this.state = state;
            this.stats = stats;
        }

        <T> T read(Supplier<T> reader) {
            lock.lock();
            try {
                return reader.get();
            } finally {
                lock.unlock();
            }
        }
    }
}
