package com.company.reporting.dto.response;

import com.company.reporting.domain.MetricsSummary;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TotalUpdatesResponse {
    @JsonProperty("total_updates")
    private long totalUpdates;

    public static TotalUpdatesResponse from(MetricsSummary summary) {
        return new TotalUpdatesResponse(summary.getTotalUpdates());
    }
}
