package com.di.retailetl.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

public class DateFormatUtils {
    private static final Logger logger = LoggerFactory.getLogger(DateFormatUtils.class);

    /** Rendering used for every DATE column after cleaning. */
    public static final String CANONICAL_PATTERN = "yyyy-MM-dd'T'HH:mm:ss";
    public static final DateTimeFormatter CANONICAL = DateTimeFormatter.ofPattern(CANONICAL_PATTERN);

    private static final List<String> DATE_TIME_PATTERNS = Arrays.asList(
            "yyyy-MM-dd'T'HH:mm:ss",   // canonical
            "yyyy-MM-dd HH:mm:ss",     // SQL / Excel export
            "yyyy-MM-dd'T'HH:mm",
            "yyyy-MM-dd HH:mm",
            "M/d/yyyy H:mm:ss",        // UCI online retail export
            "M/d/yyyy H:mm",
            "dd.MM.yyyy HH:mm:ss",     // Central Europe
            "dd.MM.yyyy HH:mm"
    );

    private static final List<String> DATE_PATTERNS = Arrays.asList(
            "yyyy-MM-dd",   // ISO standard
            "M/d/yyyy",     // US
            "dd.MM.yyyy",   // Central Europe
            "yyyyMMdd"
    );

    private static final List<DateTimeFormatter> DATE_TIME_FORMATTERS = formatters(DATE_TIME_PATTERNS);
    private static final List<DateTimeFormatter> DATE_FORMATTERS = formatters(DATE_PATTERNS);

    private DateFormatUtils() {
    }

    private static List<DateTimeFormatter> formatters(List<String> patterns) {
        List<DateTimeFormatter> list = new ArrayList<>(patterns.size());
        for (String pattern : patterns) {
            list.add(DateTimeFormatter.ofPattern(pattern));
        }
        return Collections.unmodifiableList(list);
    }

    /**
     * Tries every known pattern, date-time patterns first. Date-only values resolve to midnight.
     *
     * @param input the raw string (e.g. "12/1/2010 8:26" or "2010-12-01")
     * @return the parsed timestamp, or empty when no pattern matches
     */
    public static Optional<LocalDateTime> tryParse(String input) {
        if (input == null || input.isBlank()) {
            return Optional.empty();
        }
        String value = input.trim();
        try {
            return Optional.of(LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        } catch (DateTimeParseException ignored) {
            logger.trace("ISO parse failed for '{}'", value);
        }
        for (DateTimeFormatter formatter : DATE_TIME_FORMATTERS) {
            try {
                return Optional.of(LocalDateTime.parse(value, formatter));
            } catch (DateTimeParseException ignored) {
                logger.trace("Pattern failed: {} for '{}'", formatter, value);
            }
        }
        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            try {
                return Optional.of(LocalDate.parse(value, formatter).atStartOfDay());
            } catch (DateTimeParseException ignored) {
                logger.trace("Pattern failed: {} for '{}'", formatter, value);
            }
        }
        return Optional.empty();
    }

    public static LocalDateTime parse(String input) {
        return tryParse(input).orElseThrow(() -> new IllegalArgumentException(
                "Unrecognized date format: " + input + ". Supported patterns are: "
                        + String.join(", ", DATE_TIME_PATTERNS) + ", " + String.join(", ", DATE_PATTERNS)));
    }

    /** Parses a date-only value such as a configured window bound. */
    public static LocalDate parseDate(String input) {
        return parse(input).toLocalDate();
    }

    public static boolean isTemporal(Object value) {
        return value instanceof LocalDateTime
                || value instanceof LocalDate
                || value instanceof java.util.Date
                || value instanceof Instant
                || value instanceof OffsetDateTime
                || value instanceof ZonedDateTime;
    }

    /**
     * Converts a temporal or string value to a {@link LocalDateTime}. Zoned values are taken in UTC.
     *
     * @throws IllegalArgumentException when the value is neither temporal nor a recognised date string
     */
    public static LocalDateTime toLocalDateTime(Object value) {
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        if (value instanceof java.sql.Timestamp) {
            return ((java.sql.Timestamp) value).toLocalDateTime();
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().atStartOfDay();
        }
        if (value instanceof java.util.Date) {
            return LocalDateTime.ofInstant(((java.util.Date) value).toInstant(), ZoneOffset.UTC);
        }
        if (value instanceof Instant) {
            return LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC);
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        if (value instanceof String) {
            return parse((String) value);
        }
        throw new IllegalArgumentException("Not a date value: " + value
                + (value == null ? "" : " (" + value.getClass().getSimpleName() + ")"));
    }

    public static String toCanonical(LocalDateTime value) {
        return value == null ? null : value.format(CANONICAL);
    }
}
