package io.taskdesk.storage;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;

/**
 * UTC timestamp text as stored in the {@code created_at} and {@code updated_at} columns.
 *
 * <p>Values are written as {@code yyyy-MM-dd HH:mm:ss.SSS}; rows written by SQLite's
 * {@code CURRENT_TIMESTAMP} carry no fraction and are accepted on read.
 */
final class Timestamps {
    private static final DateTimeFormatter WRITE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");
    private static final DateTimeFormatter READ = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd[ ]['T']HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .toFormatter();

    private Timestamps() {
    }

    static LocalDateTime nowUtc() {
        return now(Clock.systemUTC());
    }

    static LocalDateTime now(Clock clock) {
        return LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS);
    }

    static String format(LocalDateTime value) {
        return value.format(WRITE);
    }

    static LocalDateTime parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return LocalDateTime.parse(raw.trim(), READ);
    }
}
