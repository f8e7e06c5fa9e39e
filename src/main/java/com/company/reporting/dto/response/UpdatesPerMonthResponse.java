package com.company.reporting.dto.response;

import com.company.reporting.domain.MetricsSummary;
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
public class UpdatesPerMonthResponse {
    @JsonProperty("updates_per_month")
    private Map<String, Long> updatesPerMonth;

    public static UpdatesPerMonthResponse from(MetricsSummary summary) {
        return new UpdatesPerMonthResponse(summary.getUpdatesPerMonth());
    }
}
