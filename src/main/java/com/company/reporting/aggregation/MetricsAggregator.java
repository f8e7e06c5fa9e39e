package com.company.reporting.aggregation;

import com.company.reporting.domain.DailyMetrics;
import com.company.reporting.domain.MetricRow;
import com.company.reporting.domain.MetricsSummary;
import com.company.reporting.domain.enums.Dimension;
import com.company.reporting.exception.MissingTimestampException;
import com.company.reporting.util.MetricTimestamps;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Folds metric rows into summaries in a single pass.
 *
 * <p>Stateless and side-effect free: every call builds its own accumulators, so one
 * instance is shared by all requests. Either the whole row set folds or an exception
 * is thrown; no partial summary is returned.
 *
 * <p>Two ordering rules are positional rather than value based:
 * <ul>
 *   <li>{@code total_users} is taken from the last row of the input list.</li>
 *   <li>Top-user ties go to the user that was credited first.</li>
 * </ul>
 */
@Component
public class MetricsAggregator {

    public MetricsSummary summarize(List<MetricRow> rows) {
        return summarize(rows, Dimension.all());
    }

    /**
     * Summarize, filling only the requested breakdown maps. Totals, row count and
     * total users are always computed; unrequested maps are empty.
     */
    public MetricsSummary summarize(List<MetricRow> rows, Set<Dimension> dimensions) {
        boolean byDay = dimensions.contains(Dimension.DAY);
        boolean byMonth = dimensions.contains(Dimension.MONTH);
        boolean byWeekday = dimensions.contains(Dimension.WEEKDAY);
        boolean byTable = dimensions.contains(Dimension.TABLE);
        boolean byUser = dimensions.contains(Dimension.USER);

        long totalUpdates = 0;
        KeyedCounter perDay = new KeyedCounter();
        KeyedCounter perMonth = new KeyedCounter();
        KeyedCounter perWeekday = new KeyedCounter();
        KeyedCounter perUser = new KeyedCounter();
        TableAccumulator perTable = new TableAccumulator();

        for (int i = 0; i < rows.size(); i++) {
            MetricRow row = rows.get(i);
            LocalDateTime ts = resolveTimestamp(row, i);
            long count = row.getUpdateCount();

            totalUpdates += count;
            if (byDay) perDay.add(MetricTimestamps.dayKey(ts), count);
            if (byMonth) perMonth.add(MetricTimestamps.monthKey(ts), count);
            if (byWeekday) perWeekday.add(MetricTimestamps.weekdayKey(ts), count);

            if (byUser && row.hasTopUser()) {
                perUser.add(row.getTopUser(), valueOrZero(row.getTopUserCount()));
            }
            if (byTable) {
                perTable.add(row.getTableName(), count, row.getLastUpdated());
            }
        }

        Optional<Map.Entry<String, Long>> topUser = perUser.max();
        long totalUsers = rows.isEmpty() ? 0 : valueOrZero(rows.get(rows.size() - 1).getTotalUsers());

        return MetricsSummary.builder()
                .rowCount(rows.size())
                .totalUpdates(totalUpdates)
                .updatesPerDay(perDay.snapshot())
                .updatesPerMonth(perMonth.snapshot())
                .updatesPerWeekday(perWeekday.snapshot())
                .topUser(topUser.map(Map.Entry::getKey).orElse(null))
                .topUserCount(topUser.map(Map.Entry::getValue).orElse(0L))
                .totalUsers(totalUsers)
                .tableWiseMetrics(perTable.snapshot())
                .build();
    }

    /**
     * Fold the rows that fall on {@code date} into one bucket: update counts are summed,
     * total users and last_updated take their maximum.
     *
     * @return empty when no row falls on the date
     */
    public Optional<DailyMetrics> aggregateSingleDay(LocalDate date, List<MetricRow> rows) {
        long rowCount = 0;
        long totalUpdates = 0;
        long maxTotalUsers = 0;
        LocalDateTime maxLastUpdated = null;
        KeyedCounter perUser = new KeyedCounter();
        TableAccumulator perTable = new TableAccumulator();

        for (int i = 0; i < rows.size(); i++) {
            MetricRow row = rows.get(i);
            if (!resolveTimestamp(row, i).toLocalDate().equals(date)) {
                continue;
            }

            rowCount++;
            totalUpdates += row.getUpdateCount();
            maxTotalUsers = Math.max(maxTotalUsers, valueOrZero(row.getTotalUsers()));

            LocalDateTime lastUpdated = row.getLastUpdated();
            if (lastUpdated != null && (maxLastUpdated == null || lastUpdated.isAfter(maxLastUpdated))) {
                maxLastUpdated = lastUpdated;
            }
            if (row.hasTopUser()) {
                perUser.add(row.getTopUser(), valueOrZero(row.getTopUserCount()));
            }
            perTable.add(row.getTableName(), row.getUpdateCount(), lastUpdated);
        }

        if (rowCount == 0) {
            return Optional.empty();
        }

        Optional<Map.Entry<String, Long>> topUser = perUser.max();
        return Optional.of(DailyMetrics.builder()
                .date(date)
                .rowCount(rowCount)
                .totalUpdates(totalUpdates)
                .totalUsers(maxTotalUsers)
                .topUser(topUser.map(Map.Entry::getKey).orElse(null))
                .topUserCount(topUser.map(Map.Entry::getValue).orElse(0L))
                .lastUpdated(maxLastUpdated)
                .tableWiseMetrics(perTable.snapshot())
                .build());
    }

    private static LocalDateTime resolveTimestamp(MetricRow row, int index) {
        return row.effectiveTimestamp()
                .orElseThrow(() -> new MissingTimestampException(row.getTableName(), index));
    }

    private static long valueOrZero(Long value) {
        return value != null ? value : 0L;
    }
}
