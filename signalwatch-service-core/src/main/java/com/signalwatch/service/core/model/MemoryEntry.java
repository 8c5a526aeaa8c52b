package com.signalwatch.service.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generic audit record for a source. The fingerprint is a digest of source, kind and payload,
 * so identical activity hashes identically regardless of when it happened.
 */
public record MemoryEntry(
        String id,
        String sourceId,
        Instant timestamp,
        MemoryEntryKind kind,
        Map<String, Object> payload,
        String fingerprint)
        implements Timestamped {

    public MemoryEntry {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
