package com.signalwatch.controller.rest.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalwatch.service.core.model.SourceState;
import com.signalwatch.service.core.model.StreamableRecord;
import com.signalwatch.service.core.stats.SourceSummary;
import com.signalwatch.service.core.stats.Statistics;
import com.signalwatch.service.core.stats.SystemStatistics;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Encodes stream frames as {@code data: <json>\n\n}. The JSON envelope is
 * {@code {timestamp, type, data}}. Record streams use {@code record_emission} for a live record and
 * {@code record_history} for the replay sent when a stream opens; metrics streams use
 * {@code system_metrics}, {@code source_metrics} and {@code metrics_summary}.
 */
@Component
public class SseFrames {

    public static final String RECORD_EMISSION = "record_emission";
    public static final String RECORD_HISTORY = "record_history";
    public static final String SYSTEM_METRICS = "system_metrics";
    public static final String SOURCE_METRICS = "source_metrics";
    public static final String METRICS_SUMMARY = "metrics_summary";

    private final ObjectMapper mapper;
    private final Clock clock;

    public SseFrames(ObjectMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.clock = clock;
    }

    public String emission(StreamableRecord record) {
        return frame(RECORD_EMISSION, record);
    }

    public String history(List<StreamableRecord> records) {
        return frame(RECORD_HISTORY, records);
    }

    public String systemMetrics(SystemStatistics statistics) {
        return frame(SYSTEM_METRICS, statistics);
    }

    public String sourceMetrics(SourceState state, Statistics statistics) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sourceId", state.sourceId());
        data.put("name", state.name());
        data.put("status", state.status());
        data.put("statistics", statistics);
        return frame(SOURCE_METRICS, data);
    }

    public String metricsSummary(List<SourceSummary> summaries) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("count", summaries.size());
        data.put("sources", summaries);
        return frame(METRICS_SUMMARY, data);
    }

    String frame(String type, Object data) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("timestamp", Instant.now(clock));
        envelope.put("type", type);
        envelope.put("data", data);
        try {
            return "data: " + mapper.writeValueAsString(envelope) + "\n\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to encode " + type + " frame", e);
        }
    }
}
