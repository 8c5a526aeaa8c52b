package com.signalwatch.service.core.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "signalwatch")
public class TelemetryProperties {
    private History history = new History();
    private Snapshot snapshot = new Snapshot();
    private Broadcast broadcast = new Broadcast();
    private Retention retention = new Retention();
    private Search search = new Search();
    private Metrics metrics = new Metrics();

    public History getHistory() {
        return history;
    }

    public void setHistory(History history) {
        this.history = history;
    }

    public Snapshot getSnapshot() {
        return snapshot;
    }

    public void setSnapshot(Snapshot snapshot) {
        this.snapshot = snapshot;
    }

    public Broadcast getBroadcast() {
        return broadcast;
    }

    public void setBroadcast(Broadcast broadcast) {
        this.broadcast = broadcast;
    }

    public Retention getRetention() {
        return retention;
    }

    public void setRetention(Retention retention) {
        this.retention = retention;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public void setMetrics(Metrics metrics) {
        this.metrics = metrics;
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    /** Per-source caps for each history kind. */
    public static class History {
        private int memoryCapacity = 1000;
        private int emissionCapacity = 500;
        private int outcomeCapacity = 500;

        public int getMemoryCapacity() {
            return memoryCapacity;
        }

        public void setMemoryCapacity(int memoryCapacity) {
            this.memoryCapacity = memoryCapacity;
        }

        public int getEmissionCapacity() {
            return emissionCapacity;
        }

        public void setEmissionCapacity(int emissionCapacity) {
            this.emissionCapacity = emissionCapacity;
        }

        public int getOutcomeCapacity() {
            return outcomeCapacity;
        }

        public void setOutcomeCapacity(int outcomeCapacity) {
            this.outcomeCapacity = outcomeCapacity;
        }
    }

    /** How many recent entries of each kind a source snapshot carries. */
    public static class Snapshot {
        private int recentEmissions = 10;
        private int recentOutcomes = 10;
        private int recentEntries = 20;

        public int getRecentEmissions() {
            return recentEmissions;
        }

        public void setRecentEmissions(int recentEmissions) {
            this.recentEmissions = recentEmissions;
        }

        public int getRecentOutcomes() {
            return recentOutcomes;
        }

        public void setRecentOutcomes(int recentOutcomes) {
            this.recentOutcomes = recentOutcomes;
        }

        public int getRecentEntries() {
            return recentEntries;
        }

        public void setRecentEntries(int recentEntries) {
            this.recentEntries = recentEntries;
        }
    }

    public static class Broadcast {
        private int bufferCapacity = 1000;
        private int queueCapacity = 256;
        private Duration idleTimeout = Duration.ofSeconds(60);
        private Duration pushTimeout = Duration.ofSeconds(5);
        private long sweepRateMillis = 30000;
        private int historyReplay = 10;

        public int getBufferCapacity() {
            return bufferCapacity;
        }

        public void setBufferCapacity(int bufferCapacity) {
            this.bufferCapacity = bufferCapacity;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public Duration getIdleTimeout() {
            return idleTimeout;
        }

        public void setIdleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
        }

        public Duration getPushTimeout() {
            return pushTimeout;
        }

        public void setPushTimeout(Duration pushTimeout) {
            this.pushTimeout = pushTimeout;
        }

        public long getSweepRateMillis() {
            return sweepRateMillis;
        }

        public void setSweepRateMillis(long sweepRateMillis) {
            this.sweepRateMillis = sweepRateMillis;
        }

        public int getHistoryReplay() {
            return historyReplay;
        }

        public void setHistoryReplay(int historyReplay) {
            this.historyReplay = historyReplay;
        }
    }

    public static class Retention {
        private boolean enabled = false;
        private Duration maxAge = Duration.ofDays(7);
        private long rateMillis = 3600000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getMaxAge() {
            return maxAge;
        }

        public void setMaxAge(Duration maxAge) {
            this.maxAge = maxAge;
        }

        public long getRateMillis() {
            return rateMillis;
        }

        public void setRateMillis(long rateMillis) {
            this.rateMillis = rateMillis;
        }
    }

    public static class Search {
        private int defaultLimit = 100;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }
    }

    /** Dashboard summaries and the live metrics streams. */
    public static class Metrics {
        private Duration activeWindow = Duration.ofHours(1);
        private long streamRateMillis = 2000;

        public Duration getActiveWindow() {
            return activeWindow;
        }

        public void setActiveWindow(Duration activeWindow) {
            this.activeWindow = activeWindow;
        }

        public long getStreamRateMillis() {
            return streamRateMillis;
        }

        public void setStreamRateMillis(long streamRateMillis) {
            this.streamRateMillis = streamRateMillis;
        }
    }
}
