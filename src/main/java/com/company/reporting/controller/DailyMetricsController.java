package com.company.reporting.controller;

import com.company.reporting.domain.DailyMetrics;
import com.company.reporting.service.MetricsQueryService;
import com.company.reporting.util.MetricTimestamps;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

@RestController
@RequestMapping("/metrics/{projectId}")
@Tag(name = "Daily Metrics", description = "Single-day aggregates for a project")
@RequiredArgsConstructor
@Slf4j
public class DailyMetricsController {

    private final MetricsQueryService queryService;
    private final MeterRegistry meterRegistry;

    @GetMapping("/by-date")
    @Operation(summary = "Aggregate one calendar day", description = "404 when no rows were recorded on that day")
    public ResponseEntity<DailyMetrics> getByDate(
            @PathVariable("projectId") String projectId,
            @Parameter(description = "Day in dd/MM/yyyy form", example = "31/01/2024")
            @RequestParam("date") String date) {

        LocalDate day = MetricTimestamps.parseRequestDate(date);

        meterRegistry.counter("api.metrics.daily.requests", "mode", "by-date").increment();
        log.debug("Daily metrics for project {} on {}", projectId, day);

        return ResponseEntity.ok(queryService.getDailyMetrics(projectId, day));
    }

    @GetMapping("/today")
    @Operation(summary = "Aggregate the current day")
    public ResponseEntity<DailyMetrics> getToday(@PathVariable("projectId") String projectId) {
        meterRegistry.counter("api.metrics.daily.requests", "mode", "today").increment();

        return ResponseEntity.ok(queryService.getTodayMetrics(projectId));
    }
}
