package com.company.reporting.controller;

import com.company.reporting.aggregation.MetricsAggregator;
import com.company.reporting.domain.Project;
import com.company.reporting.domain.enums.Dimension;
import com.company.reporting.dto.response.ProjectTablesResponse;
import com.company.reporting.exception.GlobalExceptionHandler;
import com.company.reporting.exception.ProjectNotFoundException;
import com.company.reporting.exception.TableNotFoundException;
import com.company.reporting.service.MetricsQueryService;
import com.company.reporting.service.ProjectService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.EnumSet;
import java.util.List;

import static com.company.reporting.testutil.MetricRows.row;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ProjectControllerTest {

    @Mock
    private ProjectService projectService;

    @Mock
    private MetricsQueryService queryService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ProjectController controller = new ProjectController(projectService, queryService, new SimpleMeterRegistry());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void getProjects() throws Exception {
        when(projectService.getActiveProjects()).thenReturn(List.of(
                Project.builder().projectId("alpha").name("Alpha").metricsTable("alpha_metrics").active(true).build()));

        mockMvc.perform(get("/projects"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].project_id").value("alpha"))
                .andExpect(jsonPath("$[0].metrics_table").value("alpha_metrics"));
    }

    @Test
    void getProject_unknownIs404() throws Exception {
        when(projectService.getProject("ghost")).thenThrow(new ProjectNotFoundException("ghost"));

        mockMvc.perform(get("/projects/ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Project not found: ghost"));
    }

    @Test
    void getTables() throws Exception {
        when(projectService.getProjectTables("alpha")).thenReturn(ProjectTablesResponse.builder()
                .projectId("alpha").metricsTable("alpha_metrics").tables(List.of("orders", "users")).build());

        mockMvc.perform(get("/projects/alpha/tables"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metrics_table").value("alpha_metrics"))
                .andExpect(jsonPath("$.tables[1]").value("users"));
    }

    @Test
    void getTables_missingTableIs404() throws Exception {
        when(projectService.getProjectTables("alpha")).thenThrow(new TableNotFoundException("alpha_metrics"));

        mockMvc.perform(get("/projects/alpha/tables"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Metrics table not found: alpha_metrics"));
    }

    @Test
    void projectScopedProjections() throws Exception {
        when(queryService.getProjectSummary(eq("alpha"), any())).thenReturn(new MetricsAggregator().summarize(List.of(
                row("2024-01-01", 5, "orders", "u1", 3, 10),
                row("2024-02-01", 1, "users", "u2", 4, 11))));

        mockMvc.perform(get("/projects/alpha/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_updates").value(6));
        mockMvc.perform(get("/projects/alpha/metrics/top-user"))
                .andExpect(jsonPath("$.top_user").value("u2"))
                .andExpect(jsonPath("$.entry_count").value(4));
        mockMvc.perform(get("/projects/alpha/metrics/total-users"))
                .andExpect(jsonPath("$.total_users").value(11));
        mockMvc.perform(get("/projects/alpha/metrics/monthly"))
                .andExpect(jsonPath("$.updates_per_month['2024-02']").value(1));
        mockMvc.perform(get("/projects/alpha/metrics/per-day"))
                .andExpect(jsonPath("$.updates_per_day['2024-01-01']").value(5));
        mockMvc.perform(get("/projects/alpha/metrics/weekday"))
                .andExpect(jsonPath("$.updates_per_weekday.Monday").value(5));
        mockMvc.perform(get("/projects/alpha/metrics/tables"))
                .andExpect(jsonPath("$.table_wise_metrics.users.count").value(1));

        verify(queryService).getProjectSummary("alpha", EnumSet.of(Dimension.TABLE));
        verify(queryService).getProjectSummary("alpha", EnumSet.of(Dimension.MONTH));
    }

    @Test
    void projectScopedMetrics_unknownProjectIs404() throws Exception {
        when(queryService.getProjectSummary(eq("ghost"), any())).thenThrow(new ProjectNotFoundException("ghost"));

        mockMvc.perform(get("/projects/ghost/metrics/total-updates"))
                .andExpect(status().isNotFound());
    }
}
