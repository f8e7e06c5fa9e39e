package com.company.reporting.dto.response;

import com.company.reporting.domain.MetricsSummary;
import com.company.reporting.domain.TableMetrics;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableMetricsResponse {
    @JsonProperty("table_wise_metrics")
    private Map<String, TableMetrics> tableWiseMetrics;

    public static TableMetricsResponse from(MetricsSummary summary) {
        return new TableMetricsResponse(summary.getTableWiseMetrics());
    }
}
