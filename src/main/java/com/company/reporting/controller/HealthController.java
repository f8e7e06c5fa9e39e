package com.company.reporting.controller;

import com.company.reporting.repository.ProjectRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reporting readiness: UP only while the metrics store answers. Single attempt, no
 * retry, so a dead store is reported immediately rather than after the retry budget.
 */
@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Metrics store reachability")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final ProjectRepository projectRepository;
    private final Clock clock;

    @GetMapping
    @Operation(summary = "Metrics store reachability and active project count")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("timestamp", Instant.now(clock));

        try {
            int activeProjects = projectRepository.countActive();
            response.put("status", "UP");
            response.put("active_projects", activeProjects);
            return ResponseEntity.ok(response);

        } catch (DataAccessException e) {
            log.warn("Metrics store health check failed: {}", e.getMessage());
            response.put("status", "DOWN");
            response.put("error", e.getMostSpecificCause().getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
        }
    }
}
