package com.signalwatch.service.core.stats;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Incremental aggregator over every observation ever made for one source. Nothing here is derived
 * from history windows, so evicting history never moves these numbers.
 *
 * <p>Every event and every record contributes one processing-time sample; the mean is maintained
 * with {@code mean += (x - mean) / n} where {@code n = totalEvents + totalRecords}.
 *
 * <p>Success rate covers records only and reports {@code 1.0} until the first record arrives.
 *
 * <p>{@link #reset()} is the only way numbers go back down.
 */
public final class RunningStats {

    private static final double MILLIS_PER_HOUR = Duration.ofHours(1).toMillis();

    private final Clock clock;

    private long totalEvents;
    private long totalRecords;
    private long successfulRecords;
    private long failedRecords;
    private long errorCount;

    private double meanProcessingTime;
    private long minProcessingTime = Long.MAX_VALUE;
    private long maxProcessingTime;

    private long confidenceSamples;
    private double meanConfidence;

    private final Map<String, Long> recordTypes = new LinkedHashMap<>();

    private Instant firstObservation;
    private Instant lastObservation;

    public RunningStats(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public synchronized void recordEvent(boolean success, long processingTimeMs) {
        totalEvents++;
        if (!success) {
            errorCount++;
        }
        observe(processingTimeMs);
    }

    public synchronized void recordEmission(String recordType, boolean success, long processingTimeMs, Double confidence) {
        totalRecords++;
        if (success) {
            successfulRecords++;
        } else {
            failedRecords++;
        }
        if (recordType != null) {
            recordTypes.merge(recordType, 1L, Long::sum);
        }
        if (confidence != null && !confidence.isNaN()) {
            double clamped = Math.max(0.0, Math.min(1.0, confidence));
            confidenceSamples++;
            meanConfidence += (clamped - meanConfidence) / confidenceSamples;
        }
        observe(processingTimeMs);
    }

    public synchronized void recordError() {
        errorCount++;
        touch();
    }

    /** Forgets every observation; the next one starts a fresh rate window. */
    public synchronized void reset() {
        totalEvents = 0;
        totalRecords = 0;
        successfulRecords = 0;
        failedRecords = 0;
        errorCount = 0;
        meanProcessingTime = 0.0;
        minProcessingTime = Long.MAX_VALUE;
        maxProcessingTime = 0;
        confidenceSamples = 0;
        meanConfidence = 0.0;
        recordTypes.clear();
        firstObservation = null;
        lastObservation = null;
    }

    public synchronized Statistics snapshot() {
        long samples = totalEvents + totalRecords;
        double successRate = totalRecords == 0 ? 1.0 : (double) successfulRecords / totalRecords;
        double ratePerHour = 0.0;
        double eventsPerHour = 0.0;
        if (firstObservation != null) {
            long elapsedMillis = Duration.between(firstObservation, Instant.now(clock)).toMillis();
            if (elapsedMillis > 0) {
                double hours = elapsedMillis / MILLIS_PER_HOUR;
                ratePerHour = totalRecords / hours;
                eventsPerHour = totalEvents / hours;
            }
        }
        return new Statistics(
                totalEvents,
                totalRecords,
                successfulRecords,
                failedRecords,
                errorCount,
                samples == 0 ? 0.0 : meanProcessingTime,
                samples == 0 ? 0L : minProcessingTime,
                maxProcessingTime,
                successRate,
                ratePerHour,
                eventsPerHour,
                confidenceSamples == 0 ? null : meanConfidence,
                Map.copyOf(recordTypes),
                firstObservation,
                lastObservation);
    }

    private void observe(long processingTimeMs) {
        long sample = Math.max(0L, processingTimeMs);
        long n = totalEvents + totalRecords;
        meanProcessingTime += (sample - meanProcessingTime) / n;
        minProcessingTime = Math.min(minProcessingTime, sample);
        maxProcessingTime = Math.max(maxProcessingTime, sample);
        touch();
    }

    private void touch() {
        Instant now = Instant.now(clock);
        if (firstObservation == null) {
            firstObservation = now;
        }
        lastObservation = now;
    }
}
