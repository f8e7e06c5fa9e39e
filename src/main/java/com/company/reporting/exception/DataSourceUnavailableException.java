package com.company.reporting.exception;

public class DataSourceUnavailableException extends RuntimeException {
    public DataSourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
