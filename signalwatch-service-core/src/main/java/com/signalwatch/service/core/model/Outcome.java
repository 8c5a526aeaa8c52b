package com.signalwatch.service.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** What a source decided about an event it was offered. */
public enum Outcome {
    TRIGGERED,
    IGNORED,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Outcome fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Outcome cannot be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown outcome: " + value, ex);
        }
    }
}
