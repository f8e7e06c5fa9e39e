package com.company.reporting.repository;

import com.company.reporting.domain.MetricRow;
import com.company.reporting.exception.DataSourceUnavailableException;
import com.company.reporting.exception.TableNotFoundException;
import com.company.reporting.util.MetricTimestamps;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Row source over metrics tables. All tables share the update_metrics shape, but the
 * optional columns (detected_timestamp, last_updated, top_user...) may be missing.
 * Rows come back in store order: no ORDER BY is applied.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class MetricRowRepository {

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z0-9_]{1,64}");

    private static final String TIMESTAMP = "timestamp";
    private static final String DETECTED_TIMESTAMP = "detected_timestamp";

    private final JdbcTemplate jdbcTemplate;

    @Retry(name = "metricsSource", fallbackMethod = "unavailable")
    public List<MetricRow> findAll(String table) {
        String sql = "SELECT * FROM " + checkedName(table);
        List<MetricRow> rows = jdbcTemplate.query(sql, new MetricRowMapper());

        log.debug("Fetched {} rows from {}", rows.size(), table);
        return rows;
    }

    /**
     * Rows whose effective timestamp falls on {@code day}. The primary timestamp wins;
     * detected_timestamp is only consulted where the primary one is null.
     */
    @Retry(name = "metricsSource", fallbackMethod = "unavailable")
    public List<MetricRow> findByDay(String table, LocalDate day) {
        String name = checkedName(table);
        Set<String> columns = findColumns(name);

        List<String> predicates = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        if (columns.contains(TIMESTAMP)) {
            predicates.add("(timestamp >= ? AND timestamp < ?)");
            params.add(day.atStartOfDay());
            params.add(day.plusDays(1).atStartOfDay());
        }
        if (columns.contains(DETECTED_TIMESTAMP)) {
            String nullPrimary = columns.contains(TIMESTAMP) ? "timestamp IS NULL AND " : "";
            predicates.add("(" + nullPrimary + "detected_timestamp >= ? AND detected_timestamp < ?)");
            params.add(day.atStartOfDay());
            params.add(day.plusDays(1).atStartOfDay());
        }
        if (predicates.isEmpty()) {
            log.warn("Table {} has no timestamp column, nothing can match {}", table, day);
            return Collections.emptyList();
        }

        String sql = "SELECT * FROM " + name + " WHERE " + String.join(" OR ", predicates);
        List<MetricRow> rows = jdbcTemplate.query(sql, new MetricRowMapper(), params.toArray());

        log.debug("Fetched {} rows from {} for {}", rows.size(), table, day);
        return rows;
    }

    @Retry(name = "metricsSource", fallbackMethod = "unavailableNames")
    public List<String> findTableNames(String table) {
        String sql = "SELECT DISTINCT table_name FROM " + checkedName(table) + " ORDER BY table_name";
        return jdbcTemplate.queryForList(sql, String.class);
    }

    @Retry(name = "metricsSource", fallbackMethod = "unavailableCheck")
    public boolean tableExists(String table) {
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            return false;
        }
        try {
            findColumns(table);
            return true;
        } catch (BadSqlGrammarException e) {
            log.debug("Metrics table {} is not queryable: {}", table, e.getMessage());
            return false;
        }
    }

    private Set<String> findColumns(String table) {
        Set<String> columns = jdbcTemplate.query("SELECT * FROM " + table + " WHERE 1 = 0", rs -> {
            return columnNames(rs.getMetaData());
        });
        return columns != null ? columns : Collections.emptySet();
    }

    private String checkedName(String table) {
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new TableNotFoundException(String.valueOf(table));
        }
        return table;
    }

    private List<MetricRow> unavailable(String table, DataAccessResourceFailureException e) {
        throw sourceUnavailable(table, e);
    }

    private List<MetricRow> unavailable(String table, LocalDate day, DataAccessResourceFailureException e) {
        throw sourceUnavailable(table, e);
    }

    private List<String> unavailableNames(String table, DataAccessResourceFailureException e) {
        throw sourceUnavailable(table, e);
    }

    private boolean unavailableCheck(String table, DataAccessResourceFailureException e) {
        throw sourceUnavailable(table, e);
    }

    private DataSourceUnavailableException sourceUnavailable(String table, DataAccessResourceFailureException e) {
        log.error("Metrics store unreachable while reading {}", table, e);
        return new DataSourceUnavailableException("Metrics store is unavailable", e);
    }

    private static Set<String> columnNames(ResultSetMetaData metaData) throws SQLException {
        Set<String> names = new HashSet<>();
        for (int i = 1; i <= metaData.getColumnCount(); i++) {
            names.add(metaData.getColumnLabel(i).toLowerCase(Locale.ROOT));
        }
        return names;
    }

    /**
     * Maps one row, tolerating absent optional columns. Column presence is read once
     * per result set.
     */
    private static class MetricRowMapper implements RowMapper<MetricRow> {

        private Set<String> columns;

        @Override
        public MetricRow mapRow(ResultSet rs, int rowNum) throws SQLException {
            if (columns == null) {
                columns = columnNames(rs.getMetaData());
            }

            return MetricRow.builder()
                    .timestamp(MetricTimestamps.toLocalDateTime(optional(rs, TIMESTAMP)))
                    .detectedTimestamp(MetricTimestamps.toLocalDateTime(optional(rs, DETECTED_TIMESTAMP)))
                    .updateCount(rs.getLong("update_count"))
                    .tableName(rs.getString("table_name"))
                    .topUser(asString(optional(rs, "top_user")))
                    .topUserCount(asLong(optional(rs, "top_user_count")))
                    .totalUsers(asLong(optional(rs, "total_users")))
                    .lastUpdated(MetricTimestamps.toLocalDateTime(optional(rs, "last_updated")))
                    .build();
        }

        private Object optional(ResultSet rs, String column) throws SQLException {
            return columns.contains(column) ? rs.getObject(column) : null;
        }

        private static String asString(Object value) {
            return value != null ? value.toString() : null;
        }

        private static Long asLong(Object value) {
            if (value == null) return null;
            if (value instanceof Number number) {
                return number.longValue();
            }
            return Long.valueOf(value.toString().trim());
        }
    }
}
