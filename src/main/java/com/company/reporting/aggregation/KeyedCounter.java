package com.company.reporting.aggregation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Insertion-ordered sum per key. Absent keys read as zero.
 */
public class KeyedCounter {

    private final Map<String, Long> counts = new LinkedHashMap<>();

    public void add(String key, long amount) {
        counts.merge(key, amount, Long::sum);
    }

    public long get(String key) {
        return counts.getOrDefault(key, 0L);
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    /**
     * Key with the largest sum. On ties the key inserted first wins.
     */
    public Optional<Map.Entry<String, Long>> max() {
        Map.Entry<String, Long> best = null;
        for (Map.Entry<String, Long> entry : counts.entrySet()) {
            if (best == null || entry.getValue() > best.getValue()) {
                best = entry;
            }
        }
        return Optional.ofNullable(best).map(e -> Map.entry(e.getKey(), e.getValue()));
    }

    public Map<String, Long> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(counts));
    }
}
