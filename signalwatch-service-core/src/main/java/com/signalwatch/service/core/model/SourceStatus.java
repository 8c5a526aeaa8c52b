package com.signalwatch.service.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Lifecycle status of a monitored source. */
public enum SourceStatus {
    IDLE,
    PROCESSING,
    ACTIVE,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isBusy() {
        return this == ACTIVE || this == PROCESSING;
    }
}
