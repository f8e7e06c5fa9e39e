package com.company.reporting.aggregation;

import com.company.reporting.domain.TableMetrics;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-table update count and freshest last_updated. Rows without a table name are
 * grouped under {@value #UNNAMED_TABLE}, since JSON object keys cannot be null.
 */
class TableAccumulator {

    static final String UNNAMED_TABLE = "null";

    private final Map<String, Entry> tables = new LinkedHashMap<>();

    void add(String tableName, long updateCount, LocalDateTime lastUpdated) {
        String key = tableName != null ? tableName : UNNAMED_TABLE;
        Entry entry = tables.computeIfAbsent(key, k -> new Entry());
        entry.count += updateCount;

        // null never overwrites a known value
        if (lastUpdated != null && (entry.lastUpdated == null || lastUpdated.isAfter(entry.lastUpdated))) {
            entry.lastUpdated = lastUpdated;
        }
    }

    Map<String, TableMetrics> snapshot() {
        Map<String, TableMetrics> result = new LinkedHashMap<>();
        tables.forEach((name, entry) -> result.put(name, TableMetrics.builder()
                .count(entry.count)
                .lastUpdated(entry.lastUpdated)
                .build()));
        return Collections.unmodifiableMap(result);
    }

    private static final class Entry {
        private long count;
        private LocalDateTime lastUpdated;
    }
}
