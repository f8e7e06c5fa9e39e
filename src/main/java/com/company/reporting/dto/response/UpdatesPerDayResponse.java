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
public class UpdatesPerDayResponse {
    @JsonProperty("updates_per_day")
    private Map<String, Long> updatesPerDay;

    public static UpdatesPerDayResponse from(MetricsSummary summary) {
        return new UpdatesPerDayResponse(summary.getUpdatesPerDay());
    }
}
