package com.company.reporting.repository;

import com.company.reporting.domain.Project;
import com.company.reporting.exception.DataSourceUnavailableException;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
@Slf4j
public class ProjectRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_BASE = """
        SELECT project_id, name, description, metrics_table, active, created_at
        FROM metric_projects
        """;

    @Retry(name = "metricsSource", fallbackMethod = "unavailableById")
    public Optional<Project> findById(String projectId) {
        String sql = SELECT_BASE + " WHERE project_id = ?";

        List<Project> results = jdbcTemplate.query(sql, new ProjectRowMapper(), projectId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Retry(name = "metricsSource", fallbackMethod = "unavailableAll")
    public List<Project> findAllActive() {
        String sql = SELECT_BASE + " WHERE active = true ORDER BY name";
        return jdbcTemplate.query(sql, new ProjectRowMapper());
    }

    public int countActive() {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM metric_projects WHERE active = true", Integer.class);
        return count != null ? count : 0;
    }

    private Optional<Project> unavailableById(String projectId, DataAccessResourceFailureException e) {
        log.error("Metrics store unreachable while looking up project {}", projectId, e);
        throw new DataSourceUnavailableException("Metrics store is unavailable", e);
    }

    private List<Project> unavailableAll(DataAccessResourceFailureException e) {
        log.error("Metrics store unreachable while listing projects", e);
        throw new DataSourceUnavailableException("Metrics store is unavailable", e);
    }

    private static class ProjectRowMapper implements RowMapper<Project> {
        @Override
        public Project mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp createdAt = rs.getTimestamp("created_at");
            return Project.builder()
                    .projectId(rs.getString("project_id"))
                    .name(rs.getString("name"))
                    .description(rs.getString("description"))
                    .metricsTable(rs.getString("metrics_table"))
                    .active(rs.getBoolean("active"))
                    .createdAt(createdAt != null ? createdAt.toInstant() : null)
                    .build();
        }
    }
}
