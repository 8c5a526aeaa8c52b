package com.signalwatch.service.core.model;

import java.time.Instant;

/** Anything kept in a bounded history carries the instant it was recorded. */
public interface Timestamped {
    Instant timestamp();
}
