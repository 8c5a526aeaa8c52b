package com.signalwatch.service.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum MemoryEntryKind {
    EVENT_PROCESSED,
    RECORD_EMITTED,
    STATE_CHANGE,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Accepts both {@code record_emitted} and {@code RECORD_EMITTED}. */
    public static MemoryEntryKind fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Memory entry kind cannot be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (MemoryEntryKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown memory entry kind: " + value);
    }
}
