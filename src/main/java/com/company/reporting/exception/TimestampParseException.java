package com.company.reporting.exception;

public class TimestampParseException extends RuntimeException {
    public TimestampParseException(String value, Throwable cause) {
        super("Unparseable timestamp: " + value, cause);
    }

    public TimestampParseException(Object value) {
        super("Unsupported timestamp value: " + value
                + (value != null ? " (" + value.getClass().getSimpleName() + ")" : ""));
    }
}
