package com.company.reporting.config;

import com.company.reporting.repository.ProjectRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-specific metrics
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final ProjectRepository projectRepository;

    @Bean
    public MeterBinder reportingMetrics() {
        return (registry) -> {
            Gauge.builder("reporting.projects.active", projectRepository, repo -> {
                        try {
                            return repo.countActive();
                        } catch (Exception e) {
                            log.warn("Failed to count active projects", e);
                            return 0;
                        }
                    })
                    .description("Number of active projects with a metrics table")
                    .register(registry);

            log.info("Reporting metrics registered");
        };
    }
}
