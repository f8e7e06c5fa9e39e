package com.company.reporting.exception;

import java.time.LocalDate;

public class MetricsNotFoundException extends RuntimeException {
    public MetricsNotFoundException(String projectId, LocalDate date) {
        super("No metrics recorded for project " + projectId + " on " + date);
    }
}
