package com.company.reporting.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.util.Map;

/**
 * Result of folding a row set. Maps keep first-seen key order.
 */
@Value
@Builder
@Jacksonized
public class MetricsSummary implements Serializable {
    private static final long serialVersionUID = 1L;

    @JsonProperty("row_count")
    long rowCount;

    @JsonProperty("total_updates")
    long totalUpdates;

    @JsonProperty("updates_per_day")
    Map<String, Long> updatesPerDay;

    @JsonProperty("updates_per_month")
    Map<String, Long> updatesPerMonth;

    @JsonProperty("updates_per_weekday")
    Map<String, Long> updatesPerWeekday;

    @JsonProperty("top_user")
    String topUser;

    @JsonProperty("top_user_count")
    long topUserCount;

    @JsonProperty("total_users")
    long totalUsers;

    @JsonProperty("table_wise_metrics")
    Map<String, TableMetrics> tableWiseMetrics;
}
