package com.company.reporting.controller;

import com.company.reporting.domain.MetricsSummary;
import com.company.reporting.domain.enums.Dimension;
import com.company.reporting.dto.response.*;
import com.company.reporting.service.MetricsQueryService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.EnumSet;
import java.util.Set;

/**
 * Summary and per-dimension projections over the default metrics table.
 * Every projection is wrapped under the summary field it comes from.
 */
@RestController
@RequestMapping("/metrics")
@Tag(name = "Metrics", description = "Aggregated update metrics for the default metrics table")
@RequiredArgsConstructor
public class MetricsController {

    private final MetricsQueryService queryService;
    private final MeterRegistry meterRegistry;

    @GetMapping
    @Operation(summary = "Full metrics summary")
    public ResponseEntity<MetricsSummary> getSummary() {
        return ResponseEntity.ok(summary("summary", Dimension.all()));
    }

    @GetMapping("/top-user")
    @Operation(summary = "User credited with the most updates")
    public ResponseEntity<TopUserResponse> getTopUser() {
        return ResponseEntity.ok(TopUserResponse.from(summary("top-user", EnumSet.of(Dimension.USER))));
    }

    @GetMapping("/total-updates")
    @Operation(summary = "Total number of updates")
    public ResponseEntity<TotalUpdatesResponse> getTotalUpdates() {
        return ResponseEntity.ok(TotalUpdatesResponse.from(summary("total-updates", Dimension.none())));
    }

    @GetMapping("/total-users")
    @Operation(summary = "Total users reported by the last row received")
    public ResponseEntity<TotalUsersResponse> getTotalUsers() {
        return ResponseEntity.ok(TotalUsersResponse.from(summary("total-users", Dimension.none())));
    }

    @GetMapping("/per-day")
    @Operation(summary = "Updates per calendar day")
    public ResponseEntity<UpdatesPerDayResponse> getUpdatesPerDay() {
        return ResponseEntity.ok(UpdatesPerDayResponse.from(summary("per-day", EnumSet.of(Dimension.DAY))));
    }

    @GetMapping({"/per-month", "/monthly"})
    @Operation(summary = "Updates per year-month")
    public ResponseEntity<UpdatesPerMonthResponse> getUpdatesPerMonth() {
        return ResponseEntity.ok(UpdatesPerMonthResponse.from(summary("per-month", EnumSet.of(Dimension.MONTH))));
    }

    @GetMapping({"/per-weekday", "/weekday"})
    @Operation(summary = "Updates per weekday name")
    public ResponseEntity<UpdatesPerWeekdayResponse> getUpdatesPerWeekday() {
        return ResponseEntity.ok(UpdatesPerWeekdayResponse.from(summary("per-weekday", EnumSet.of(Dimension.WEEKDAY))));
    }

    @GetMapping("/tables")
    @Operation(summary = "Update count and freshness per table")
    public ResponseEntity<TableMetricsResponse> getTableMetrics() {
        return ResponseEntity.ok(TableMetricsResponse.from(summary("tables", EnumSet.of(Dimension.TABLE))));
    }

    private MetricsSummary summary(String dimension, Set<Dimension> dimensions) {
        meterRegistry.counter("api.metrics.requests",
                "scope", "default",
                "dimension", dimension
        ).increment();

        return queryService.getSummary(dimensions);
    }
}
