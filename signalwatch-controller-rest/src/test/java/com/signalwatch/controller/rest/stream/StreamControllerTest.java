package com.signalwatch.controller.rest.stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.signalwatch.controller.rest.MockMvcSupport;
import com.signalwatch.service.core.broadcast.BroadcastStats;
import com.signalwatch.service.core.broadcast.RecordFilter;
import com.signalwatch.service.core.broadcast.RecordSink;
import com.signalwatch.service.core.config.TelemetryProperties;
import com.signalwatch.service.core.model.Priority;
import com.signalwatch.service.core.model.StreamableRecord;
import com.signalwatch.service.core.telemetry.TelemetryFacade;
import java.time.Clock;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

class StreamControllerTest {

    private TelemetryFacade telemetry;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        telemetry = mock(TelemetryFacade.class);
        SseFrames frames = new SseFrames(MockMvcSupport.MAPPER, Clock.systemUTC());
        mvc = MockMvcSupport.standalone(new StreamController(telemetry, frames, new TelemetryProperties()));
    }

    @Test
    void openingStreamSubscribesWithRequestedFilter() throws Exception {
        when(telemetry.recentRecords(any(), anyInt())).thenReturn(List.of());

        MvcResult result = mvc.perform(get("/api/stream/records")
                        .param("category", "detection")
                        .param("priority", "high")
                        .param("minConfidence", "0.9"))
                .andExpect(request().asyncStarted())
                .andReturn();

        ArgumentCaptor<String> id = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<RecordFilter> filter = ArgumentCaptor.forClass(RecordFilter.class);
        verify(telemetry).subscribe(id.capture(), any(RecordSink.class), filter.capture());
        assertThat(id.getValue()).startsWith("sse_");
        assertThat(filter.getValue())
                .isEqualTo(RecordFilter.builder()
                        .category("detection")
                        .priority(Priority.HIGH)
                        .minConfidence(0.9)
                        .build());
        verify(telemetry).recentRecords(filter.getValue(), 10);
        assertThat(result.getResponse().getContentType()).startsWith("text/event-stream");
    }

    @Test
    void openingStreamReplaysRecentRecordsFirst() throws Exception {
        StreamableRecord recent = StreamableRecord.builder()
                .id("stream_9")
                .recordType("launch_detected")
                .build();
        when(telemetry.recentRecords(isNull(), eq(10))).thenReturn(List.of(recent));

        MvcResult result = mvc.perform(get("/api/stream/records"))
                .andExpect(request().asyncStarted())
                .andReturn();

        String body = result.getResponse().getContentAsString();
        assertThat(body).startsWith("data: {").contains("\"type\":\"record_history\"").contains("stream_9");
        verify(telemetry).subscribe(any(), any(), isNull());
    }

    @Test
    void invalidFilterIsRejectedWithoutSubscribing() throws Exception {
        mvc.perform(get("/api/stream/records").param("priority", "urgent")).andExpect(status().isBadRequest());
        mvc.perform(get("/api/stream/records").param("minConfidence", "1.5")).andExpect(status().isBadRequest());

        verify(telemetry, never()).subscribe(any(), any(), any());
    }

    @Test
    void recentAndStatsAreJson() throws Exception {
        when(telemetry.recentRecords(isNull(), eq(5)))
                .thenReturn(List.of(StreamableRecord.builder().id("stream_1").build()));
        when(telemetry.broadcastStats()).thenReturn(new BroadcastStats(7, 3, 0, List.of()));

        mvc.perform(get("/api/stream/recent").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("stream_1"));
        mvc.perform(get("/api/stream/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalPublished").value(7))
                .andExpect(jsonPath("$.bufferedCount").value(3));
    }
}
