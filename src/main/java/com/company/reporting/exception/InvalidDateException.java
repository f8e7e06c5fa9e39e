package com.company.reporting.exception;

public class InvalidDateException extends RuntimeException {
    public InvalidDateException(String value, String expectedPattern) {
        super("Invalid date '" + value + "', expected " + expectedPattern);
    }
}
