package com.company.reporting.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * One observed update batch, as stored in a metrics table.
 * Timestamps carry no zone; they are whatever the store recorded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricRow {
    private LocalDateTime timestamp;
    private LocalDateTime detectedTimestamp;
    private long updateCount;
    private String tableName;
    private String topUser;
    private Long topUserCount;
    private Long totalUsers;
    private LocalDateTime lastUpdated;

    /**
     * Primary timestamp when present, otherwise the detected timestamp.
     */
    public Optional<LocalDateTime> effectiveTimestamp() {
        return timestamp != null ? Optional.of(timestamp) : Optional.ofNullable(detectedTimestamp);
    }

    public boolean hasTopUser() {
        return topUser != null && !topUser.isBlank();
    }
}
