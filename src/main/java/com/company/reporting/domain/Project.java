package com.company.reporting.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Project {
    @JsonProperty("project_id")
    private String projectId;
    private String name;
    private String description;
    @JsonProperty("metrics_table")
    private String metricsTable;
    private Boolean active;
    @JsonProperty("created_at")
    private Instant createdAt;
}
