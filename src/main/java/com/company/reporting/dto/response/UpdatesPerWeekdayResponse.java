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
public class UpdatesPerWeekdayResponse {
    @JsonProperty("updates_per_weekday")
    private Map<String, Long> updatesPerWeekday;

    public static UpdatesPerWeekdayResponse from(MetricsSummary summary) {
        return new UpdatesPerWeekdayResponse(summary.getUpdatesPerWeekday());
    }
}
