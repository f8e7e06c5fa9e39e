package com.company.reporting.service;

import com.company.reporting.aggregation.MetricsAggregator;
import com.company.reporting.domain.MetricRow;
import com.company.reporting.domain.MetricsSummary;
import com.company.reporting.domain.enums.Dimension;
import com.company.reporting.repository.MetricRowRepository;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Reads a whole metrics table and folds it over the requested dimensions. Cached per
 * (table, dimensions) only when the Redis cache is switched on; otherwise every call
 * recomputes.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsSummaryService {

    public static final String SUMMARY_CACHE = "metricsSummary";

    private final MetricRowRepository rowRepository;
    private final MetricsAggregator aggregator;
    private final Tracer tracer;

    @Cacheable(value = SUMMARY_CACHE, key = "#table + ':' + #dimensions")
    public MetricsSummary summarize(String table, Set<Dimension> dimensions) {
        Span span = tracer.spanBuilder("metrics.summarize")
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("metrics.table", table);
            span.setAttribute("metrics.dimensions", dimensions.toString());

            List<MetricRow> rows = rowRepository.findAll(table);
            span.setAttribute("metrics.rows", rows.size());

            MetricsSummary summary = aggregator.summarize(rows, dimensions);

            log.debug("Summarized {} rows of {}: {} updates", rows.size(), table, summary.getTotalUpdates());
            return summary;

        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Aggregation failed");
            throw e;
        } finally {
            span.end();
        }
    }
}
