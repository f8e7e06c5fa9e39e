package com.company.reporting.exception;

public class MissingTimestampException extends RuntimeException {
    public MissingTimestampException(String tableName, int rowIndex) {
        super("Metric row " + rowIndex + " for table " + tableName
                + " has neither timestamp nor detected_timestamp");
    }
}
