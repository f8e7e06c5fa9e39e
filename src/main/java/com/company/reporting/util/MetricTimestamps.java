package com.company.reporting.util;

import com.company.reporting.exception.InvalidDateException;
import com.company.reporting.exception.TimestampParseException;

import java.sql.Timestamp;
import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Reading and bucketing of metric timestamps.
 * No zone conversion is ever applied: values keep the wall-clock time they were stored with.
 */
public final class MetricTimestamps {

    public static final String REQUEST_DATE_PATTERN = "dd/MM/yyyy";

    private static final DateTimeFormatter REQUEST_DATE_FORMAT =
            DateTimeFormatter.ofPattern("dd/MM/uuuu").withResolverStyle(ResolverStyle.STRICT);

    private MetricTimestamps() {
    }

    /**
     * Convert a raw column value to a local date-time.
     *
     * @param value JDBC value: temporal types or ISO-8601 text
     * @return the local date-time, or null when the value is null
     * @throws TimestampParseException when text is malformed or the type is not temporal
     */
    public static LocalDateTime toLocalDateTime(Object value) {
        if (value == null) return null;

        if (value instanceof LocalDateTime localDateTime) {
            return localDateTime;
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toLocalDateTime();
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate().atStartOfDay();
        }
        if (value instanceof LocalDate localDate) {
            return localDate.atStartOfDay();
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toLocalDateTime();
        }
        if (value instanceof ZonedDateTime zonedDateTime) {
            return zonedDateTime.toLocalDateTime();
        }
        if (value instanceof String text) {
            return parse(text);
        }
        throw new TimestampParseException(value);
    }

    /**
     * Parse ISO-8601 text: a bare date, a date-time with 'T' or space separator,
     * optionally followed by an offset (dropped, the carried local time is kept).
     */
    public static LocalDateTime parse(String text) {
        if (text == null) return null;

        String value = text.trim();
        if (value.isEmpty()) return null;

        try {
            if (value.length() == 10) {
                return LocalDate.parse(value).atStartOfDay();
            }

            if (value.length() > 10 && value.charAt(10) == ' ') {
                value = value.substring(0, 10) + 'T' + value.substring(11);
            }

            try {
                return LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
            } catch (DateTimeParseException e) {
                return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toLocalDateTime();
            }
        } catch (DateTimeParseException e) {
            throw new TimestampParseException(text, e);
        }
    }

    public static String dayKey(LocalDateTime timestamp) {
        return timestamp.toLocalDate().toString();
    }

    public static String monthKey(LocalDateTime timestamp) {
        return YearMonth.from(timestamp).toString();
    }

    public static String weekdayKey(LocalDateTime timestamp) {
        return timestamp.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    /**
     * Parse a request date in {@value #REQUEST_DATE_PATTERN} form.
     */
    public static LocalDate parseRequestDate(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidDateException(String.valueOf(value), REQUEST_DATE_PATTERN);
        }
        try {
            return LocalDate.parse(value.trim(), REQUEST_DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw new InvalidDateException(value, REQUEST_DATE_PATTERN);
        }
    }
}
