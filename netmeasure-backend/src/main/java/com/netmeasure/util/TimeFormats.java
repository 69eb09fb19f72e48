package com.netmeasure.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;

/**
 * Conversions between {@link Instant}, persisted timestamp strings and epoch seconds.
 */
public final class TimeFormats {

    /** {@code 2024-05-01T12:00:00.000000Z}. */
    public static final DateTimeFormatter UTC_MICROS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    private static final DateTimeFormatter FILENAME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HHmmss.SSSSSS").withZone(ZoneOffset.UTC);

    private static final DateTimeFormatter LENIENT = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd'T'HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .optionalStart()
            .appendLiteral('Z')
            .optionalEnd()
            .toFormatter();

    private TimeFormats() {
    }

    public static String format(Instant instant) {
        return UTC_MICROS.format(instant);
    }

    public static String formatForFilename(Instant instant) {
        return FILENAME.format(instant);
    }

    /**
     * Parses a persisted timestamp. Timestamps without a trailing {@code Z} are read as UTC.
     *
     * @param value timestamp string
     * @return parsed instant
     * @throws DateTimeParseException if the string is not a timestamp
     */
    public static Instant parse(String value) {
        return LocalDateTime.parse(value.trim(), LENIENT).toInstant(ZoneOffset.UTC);
    }

    public static double toEpochSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
    }

    public static Instant fromEpochSeconds(double seconds) {
        long whole = (long) Math.floor(seconds);
        long micros = Math.round((seconds - whole) * 1_000_000.0);
        return Instant.ofEpochSecond(whole).plusNanos(micros * 1000L);
    }
}
