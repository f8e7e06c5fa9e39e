package com.company.reporting.controller;

import com.company.reporting.domain.MetricsSummary;
import com.company.reporting.domain.Project;
import com.company.reporting.domain.enums.Dimension;
import com.company.reporting.dto.response.*;
import com.company.reporting.service.MetricsQueryService;
import com.company.reporting.service.ProjectService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@RestController
@RequestMapping("/projects")
@Tag(name = "Projects", description = "Known projects and their project-scoped metrics")
@RequiredArgsConstructor
public class ProjectController {

    private final ProjectService projectService;
    private final MetricsQueryService queryService;
    private final MeterRegistry meterRegistry;

    @GetMapping
    @Operation(summary = "List active projects")
    public ResponseEntity<List<Project>> getProjects() {
        return ResponseEntity.ok(projectService.getActiveProjects());
    }

    @GetMapping("/{projectId}")
    @Operation(summary = "Get one project")
    public ResponseEntity<Project> getProject(@PathVariable("projectId") String projectId) {
        return ResponseEntity.ok(projectService.getProject(projectId));
    }

    @GetMapping("/{projectId}/tables")
    @Operation(summary = "Tables reported in the project's metrics table")
    public ResponseEntity<ProjectTablesResponse> getTables(@PathVariable("projectId") String projectId) {
        return ResponseEntity.ok(projectService.getProjectTables(projectId));
    }

    @GetMapping("/{projectId}/metrics")
    @Operation(summary = "Full metrics summary for a project")
    public ResponseEntity<MetricsSummary> getSummary(@PathVariable("projectId") String projectId) {
        return ResponseEntity.ok(summary(projectId, "summary", Dimension.all()));
    }

    @GetMapping("/{projectId}/metrics/top-user")
    @Operation(summary = "Project user credited with the most updates")
    public ResponseEntity<TopUserResponse> getTopUser(@PathVariable("projectId") String projectId) {
        return ResponseEntity.ok(TopUserResponse.from(summary(projectId, "top-user", EnumSet.of(Dimension.USER))));
    }

    @GetMapping("/{projectId}/metrics/total-updates")
    @Operation(summary = "Total project updates")
    public ResponseEntity<TotalUpdatesResponse> getTotalUpdates(@PathVariable("projectId") String projectId) {
        return ResponseEntity.ok(TotalUpdatesResponse.from(summary(projectId, "total-updates", Dimension.none())));
    }

    @GetMapping("/{projectId}/metrics/total-users")
    @Operation(summary = "Project total users reported by the last row received")
    public ResponseEntity<TotalUsersResponse> getTotalUsers(@PathVariable("projectId") String projectId) {
        return ResponseEntity.ok(TotalUsersResponse.from(summary(projectId, "total-users", Dimension.none())));
    }

    @GetMapping("/{projectId}/metrics/per-day")
    @Operation(summary = "Project updates per calendar day")
    public ResponseEntity<UpdatesPerDayResponse> getUpdatesPerDay(@PathVariable("projectId") String projectId) {
        return ResponseEntity.ok(UpdatesPerDayResponse.from(summary(projectId, "per-day", EnumSet.of(Dimension.DAY))));
    }

    @GetMapping({"/{projectId}/metrics/per-month", "/{projectId}/metrics/monthly"})
    @Operation(summary = "Project updates per year-month")
    public ResponseEntity<UpdatesPerMonthResponse> getUpdatesPerMonth(@PathVariable("projectId") String projectId) {
        return ResponseEntity.ok(UpdatesPerMonthResponse.from(summary(projectId, "per-month", EnumSet.of(Dimension.MONTH))));
    }

    @GetMapping({"/{projectId}/metrics/per-weekday", "/{projectId}/metrics/weekday"})
    @Operation(summary = "Project updates per weekday name")
    public ResponseEntity<UpdatesPerWeekdayResponse> getUpdatesPerWeekday(@PathVariable("projectId") String projectId) {
        return ResponseEntity.ok(UpdatesPerWeekdayResponse.from(summary(projectId, "per-weekday", EnumSet.of(Dimension.WEEKDAY))));
    }

    @GetMapping("/{projectId}/metrics/tables")
    @Operation(summary = "Project update count and freshness per table")
    public ResponseEntity<TableMetricsResponse> getTableMetrics(@PathVariable("projectId") String projectId) {
        return ResponseEntity.ok(TableMetricsResponse.from(summary(projectId, "tables", EnumSet.of(Dimension.TABLE))));
    }

    private MetricsSummary summary(String projectId, String dimension, Set<Dimension> dimensions) {
        meterRegistry.counter("api.metrics.requests",
                "scope", "project",
                "dimension", dimension
        ).increment();

        return queryService.getProjectSummary(projectId, dimensions);
    }
}
