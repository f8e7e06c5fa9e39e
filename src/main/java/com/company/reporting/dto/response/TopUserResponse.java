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
public class TopUserResponse {
    @JsonProperty("top_user")
    private String topUser;

    @JsonProperty("entry_count")
    private long entryCount;

    public static TopUserResponse from(MetricsSummary summary) {
        return TopUserResponse.builder()
                .topUser(summary.getTopUser())
                .entryCount(summary.getTopUserCount())
                .build();
    }
}
