package com.company.reporting.service;

import com.company.reporting.domain.Project;
import com.company.reporting.dto.response.ProjectTablesResponse;
import com.company.reporting.exception.ProjectNotFoundException;
import com.company.reporting.exception.TableNotFoundException;
import com.company.reporting.repository.MetricRowRepository;
import com.company.reporting.repository.ProjectRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Project to metrics-table resolution.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ProjectService {

    private final ProjectRepository projectRepository;
    private final MetricRowRepository rowRepository;

    public List<Project> getActiveProjects() {
        return projectRepository.findAllActive();
    }

    public Project getProject(String projectId) {
        return projectRepository.findById(projectId)
                .filter(project -> Boolean.TRUE.equals(project.getActive()))
                .orElseThrow(() -> new ProjectNotFoundException(projectId));
    }

    /**
     * @throws ProjectNotFoundException when the project is unknown or inactive
     * @throws TableNotFoundException when its metrics table is unset or absent from the store
     */
    public String resolveMetricsTable(String projectId) {
        Project project = getProject(projectId);
        String table = project.getMetricsTable();

        if (table == null || table.isBlank() || !rowRepository.tableExists(table)) {
            log.warn("Project {} points at missing metrics table {}", projectId, table);
            throw new TableNotFoundException(String.valueOf(table));
        }
        return table;
    }

    public ProjectTablesResponse getProjectTables(String projectId) {
        String metricsTable = resolveMetricsTable(projectId);
        List<String> tables = rowRepository.findTableNames(metricsTable);

        log.debug("Project {} reports {} tables in {}", projectId, tables.size(), metricsTable);

        return ProjectTablesResponse.builder()
                .projectId(projectId)
                .metricsTable(metricsTable)
                .tables(tables)
                .build();
    }
}
