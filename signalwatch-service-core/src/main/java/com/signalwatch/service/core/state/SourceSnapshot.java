package com.signalwatch.service.core.state;

import com.signalwatch.service.core.model.EventOutcome;
import com.signalwatch.service.core.model.MemoryEntry;
import com.signalwatch.service.core.model.RecordEmission;
import com.signalwatch.service.core.model.SourceState;
import com.signalwatch.service.core.stats.Statistics;
import java.time.Instant;
import java.util.List;

/** State, recent history (oldest first) and all-time statistics of one source, read together. */
public record SourceSnapshot(
        String sourceId,
        String name,
        Instant snapshotTime,
        SourceState state,
        List<RecordEmission> recentEmissions,
        List<EventOutcome> recentOutcomes,
        List<MemoryEntry> memoryEntries,
        Statistics statistics) {}
