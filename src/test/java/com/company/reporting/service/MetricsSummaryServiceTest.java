package com.company.reporting.service;

import com.company.reporting.aggregation.MetricsAggregator;
import com.company.reporting.domain.MetricRow;
import com.company.reporting.domain.MetricsSummary;
import com.company.reporting.domain.enums.Dimension;
import com.company.reporting.exception.MissingTimestampException;
import com.company.reporting.repository.MetricRowRepository;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.company.reporting.testutil.MetricRows.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MetricsSummaryServiceTest {

    @Mock
    private MetricRowRepository rowRepository;

    private MetricsSummaryService service;

    @BeforeEach
    void setUp() {
        service = new MetricsSummaryService(rowRepository, new MetricsAggregator(),
                OpenTelemetry.noop().getTracer("test"));
    }

    @Test
    void summarize_foldsTableRows() {
        when(rowRepository.findAll("update_metrics")).thenReturn(List.of(
                row("2024-01-01", 5, "orders", "u1", 3, 100),
                row("2024-01-02", 2, "orders", "u1", 1, 102)));

        MetricsSummary summary = service.summarize("update_metrics", Dimension.all());

        assertThat(summary.getRowCount()).isEqualTo(2);
        assertThat(summary.getTotalUpdates()).isEqualTo(7);
        assertThat(summary.getTotalUsers()).isEqualTo(102);
    }

    @Test
    void summarize_fillsRequestedDimensionsOnly() {
        when(rowRepository.findAll("update_metrics")).thenReturn(List.of(
                row("2024-01-01", 5, "orders", "u1", 3, 100)));

        MetricsSummary summary = service.summarize("update_metrics", Dimension.none());

        assertThat(summary.getTotalUpdates()).isEqualTo(5);
        assertThat(summary.getUpdatesPerDay()).isEmpty();
        assertThat(summary.getTopUser()).isNull();
    }

    @Test
    void summarize_recomputesOnEveryCallWithoutCache() {
        when(rowRepository.findAll("update_metrics")).thenReturn(List.of(row("2024-01-01", 1, "orders")));

        service.summarize("update_metrics", Dimension.all());
        service.summarize("update_metrics", Dimension.all());

        verify(rowRepository, times(2)).findAll("update_metrics");
    }

    @Test
    void summarize_propagatesAggregationErrors() {
        when(rowRepository.findAll("update_metrics"))
                .thenReturn(List.of(MetricRow.builder().updateCount(1).tableName("orders").build()));

        assertThatThrownBy(() -> service.summarize("update_metrics", Dimension.all()))
                .isInstanceOf(MissingTimestampException.class);
    }
}
