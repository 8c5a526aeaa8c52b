package com.signalwatch.controller.rest;

import com.signalwatch.service.core.stats.MemoryStatistics;
import com.signalwatch.service.core.stats.SourceSummary;
import com.signalwatch.service.core.stats.Statistics;
import com.signalwatch.service.core.stats.StatisticsComparison;
import com.signalwatch.service.core.stats.StatisticsReset;
import com.signalwatch.service.core.stats.SystemStatistics;
import com.signalwatch.service.core.telemetry.TelemetryFacade;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/statistics")
@Slf4j
public class StatisticsController {
    private final TelemetryFacade telemetry;

    public StatisticsController(TelemetryFacade telemetry) {
        this.telemetry = telemetry;
    }

    @GetMapping("/system")
    public SystemStatistics system() {
        return telemetry.systemStatistics();
    }

    @GetMapping("/sources/{sourceId}")
    public Statistics source(@PathVariable String sourceId) {
        return telemetry.statistics(sourceId).orElseThrow(() -> SourceController.notFound(sourceId));
    }

    @GetMapping("/summary")
    public List<SourceSummary> summary() {
        return telemetry.summaries();
    }

    @GetMapping("/comparison")
    public StatisticsComparison comparison() {
        return telemetry.comparison();
    }

    @GetMapping("/memory")
    public MemoryStatistics memory() {
        return telemetry.memoryStatistics();
    }

    @DeleteMapping("/sources/{sourceId}")
    public StatisticsReset resetSource(@PathVariable String sourceId) {
        return telemetry.resetStatistics(sourceId).orElseThrow(() -> SourceController.notFound(sourceId));
    }

    /** Wipes every source's statistics; refuses unless {@code confirm=true}. */
    @DeleteMapping("/system")
    public StatisticsReset resetSystem(@RequestParam(defaultValue = "false") boolean confirm) {
        if (!confirm) {
            throw new IllegalArgumentException("Confirmation required: add ?confirm=true to reset all statistics");
        }
        StatisticsReset reset = telemetry.resetAllStatistics();
        log.warn("System-wide statistics reset covered {} sources", reset.sourcesReset());
        return reset;
    }
}
