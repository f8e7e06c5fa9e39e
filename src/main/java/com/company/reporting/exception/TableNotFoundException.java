package com.company.reporting.exception;

public class TableNotFoundException extends RuntimeException {
    public TableNotFoundException(String tableName) {
        super("Metrics table not found: " + tableName);
    }
}
