package com.signalwatch.service.core.stats;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/** Outcome of a statistics reset. {@code sourceId} is absent for a system-wide reset. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatisticsReset(String sourceId, int sourcesReset, Instant resetAt) {}
