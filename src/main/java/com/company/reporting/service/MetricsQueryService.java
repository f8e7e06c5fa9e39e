package com.company.reporting.service;

import com.company.reporting.aggregation.MetricsAggregator;
import com.company.reporting.config.ReportingProperties;
import com.company.reporting.domain.DailyMetrics;
import com.company.reporting.domain.MetricRow;
import com.company.reporting.domain.MetricsSummary;
import com.company.reporting.domain.enums.Dimension;
import com.company.reporting.exception.MetricsNotFoundException;
import com.company.reporting.repository.MetricRowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsQueryService {

    private final MetricsSummaryService summaryService;
    private final ProjectService projectService;
    private final MetricRowRepository rowRepository;
    private final MetricsAggregator aggregator;
    private final ReportingProperties properties;
    private final Clock clock;

    /**
     * Summary of the default table. Breakdown maps outside {@code dimensions} are left empty.
     */
    public MetricsSummary getSummary(Set<Dimension> dimensions) {
        return summaryService.summarize(properties.getDefaultTable(), dimensions);
    }

    public MetricsSummary getProjectSummary(String projectId, Set<Dimension> dimensions) {
        String table = projectService.resolveMetricsTable(projectId);
        return summaryService.summarize(table, dimensions);
    }

    /**
     * Single-day aggregate for a project.
     *
     * @throws MetricsNotFoundException when no row falls on the date
     */
    public DailyMetrics getDailyMetrics(String projectId, LocalDate date) {
        String table = projectService.resolveMetricsTable(projectId);
        List<MetricRow> rows = rowRepository.findByDay(table, date);

        log.debug("Aggregating {} rows of {} for {}", rows.size(), table, date);

        return aggregator.aggregateSingleDay(date, rows)
                .map(daily -> daily.toBuilder().projectId(projectId).build())
                .orElseThrow(() -> new MetricsNotFoundException(projectId, date));
    }

    public DailyMetrics getTodayMetrics(String projectId) {
        return getDailyMetrics(projectId, LocalDate.now(clock.withZone(properties.getZone())));
    }
}
