package com.company.reporting.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectTablesResponse {
    @JsonProperty("project_id")
    private String projectId;

    @JsonProperty("metrics_table")
    private String metricsTable;

    private List<String> tables;
}
