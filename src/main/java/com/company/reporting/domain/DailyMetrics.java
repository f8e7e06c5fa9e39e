package com.company.reporting.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Single calendar day folded into one bucket: sums for counts, max for snapshots.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class DailyMetrics {

    @JsonProperty("project_id")
    String projectId;

    @JsonProperty("date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    LocalDate date;

    @JsonProperty("row_count")
    long rowCount;

    @JsonProperty("total_updates")
    long totalUpdates;

    @JsonProperty("total_users")
    long totalUsers;

    @JsonProperty("top_user")
    String topUser;

    @JsonProperty("top_user_count")
    long topUserCount;

    @JsonProperty("last_updated")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss")
    LocalDateTime lastUpdated;

    @JsonProperty("table_wise_metrics")
    Map<String, TableMetrics> tableWiseMetrics;
}
