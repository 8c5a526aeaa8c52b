package com.signalwatch.controller.rest;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.signalwatch.service.core.model.SourceState;
import com.signalwatch.service.core.model.SourceStatus;
import com.signalwatch.service.core.stats.Statistics;
import com.signalwatch.service.core.telemetry.TelemetryFacade;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;

class SourceControllerTest {

    private TelemetryFacade telemetry;
    private MockMvc mvc;

    private final SourceState scanner = SourceState.builder()
            .sourceId("scanner-1")
            .name("Launch Scanner")
            .status(SourceStatus.ACTIVE)
            .lastActivity(Instant.parse("2024-05-01T10:00:00Z"))
            .totalEvents(4)
            .totalRecords(2)
            .triggerCount(2)
            .build();

    @BeforeEach
    void setUp() {
        telemetry = mock(TelemetryFacade.class);
        mvc = MockMvcSupport.standalone(new SourceController(telemetry), new StatisticsController(telemetry));
    }

    @Test
    void listsKnownSources() throws Exception {
        when(telemetry.states()).thenReturn(List.of(scanner));

        mvc.perform(get("/api/sources"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].sourceId").value("scanner-1"))
                .andExpect(jsonPath("$[0].status").value("active"))
                .andExpect(jsonPath("$[0].lastActivity").value("2024-05-01T10:00:00Z"));
    }

    @Test
    void returnsSingleSource() throws Exception {
        when(telemetry.getState("scanner-1")).thenReturn(Optional.of(scanner));

        mvc.perform(get("/api/sources/scanner-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Launch Scanner"))
                .andExpect(jsonPath("$.triggerCount").value(2));
    }

    @Test
    void unknownSourceIs404() throws Exception {
        when(telemetry.getState("ghost")).thenReturn(Optional.empty());
        when(telemetry.snapshot("ghost")).thenReturn(Optional.empty());
        when(telemetry.statistics("ghost")).thenReturn(Optional.empty());

        mvc.perform(get("/api/sources/ghost")).andExpect(status().isNotFound());
        mvc.perform(get("/api/sources/ghost/snapshot")).andExpect(status().isNotFound());
        mvc.perform(get("/api/statistics/sources/ghost")).andExpect(status().isNotFound());
    }

    @Test
    void perSourceStatisticsAreServed() throws Exception {
        when(telemetry.statistics("scanner-1")).thenReturn(Optional.of(Statistics.empty()));

        mvc.perform(get("/api/statistics/sources/scanner-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.successRate").value(1.0))
                .andExpect(jsonPath("$.totalRecords").value(0));
    }
}
