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
public class TotalUsersResponse {
    @JsonProperty("total_users")
    private long totalUsers;

    public static TotalUsersResponse from(MetricsSummary summary) {
        return new TotalUsersResponse(summary.getTotalUsers());
    }
}
