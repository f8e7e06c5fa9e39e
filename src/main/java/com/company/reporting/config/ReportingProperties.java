package com.company.reporting.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Service settings, bound once at startup from the "reporting" prefix.
 */
@Data
@ConfigurationProperties(prefix = "reporting")
public class ReportingProperties {

    /**
     * Metrics table behind the unscoped /metrics endpoints.
     */
    private String defaultTable = "update_metrics";

    /**
     * Zone that decides what "today" means for /metrics/{projectId}/today.
     */
    private ZoneId zone = ZoneId.systemDefault();

    private Cache cache = new Cache();

    @Data
    public static class Cache {
        private boolean enabled = false;
        private Duration summaryTtl = Duration.ofSeconds(30);
    }
}
