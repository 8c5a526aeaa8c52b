package com.signalwatch.service.core.state;

import com.signalwatch.service.core.model.MemoryEntryKind;
import java.time.Instant;
import lombok.Builder;

/** Administrative search over memory entries. Every criterion is optional. */
@Builder
public record HistorySearch(
        String sourceId, MemoryEntryKind kind, Instant start, Instant end, Integer offset, Integer limit) {}
