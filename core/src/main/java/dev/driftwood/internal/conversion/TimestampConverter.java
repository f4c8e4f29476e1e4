/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.conversion;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;

import dev.driftwood.reader.TypeConflictException;
import dev.driftwood.schema.TimeUnit;

/**
 * Converts ISO-8601 date and date-time strings into epoch-based values.
 * <p>
 * Accepted forms are {@code yyyy-MM-dd} and {@code yyyy-MM-dd[T| ]HH:mm[:ss[.fraction]]},
 * the latter optionally followed by {@code Z} or a {@code ±HH:mm} offset. A date without a time
 * denotes midnight UTC; a date-time without an offset is taken as UTC.
 * </p>
 */
public final class TimestampConverter {

    private static final long SECONDS_PER_DAY = 86_400L;

    // yyyy-MM-dd['T'HH:mm[:ss[.SSSSSSSSS]][Z|+HH:MM]]
    private static final DateTimeFormatter FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .appendValue(ChronoField.HOUR_OF_DAY, 2)
            .appendLiteral(':')
            .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
            .optionalStart()
            .appendLiteral(':')
            .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .optionalEnd()
            .optionalStart()
            .appendOffset("+HH:MM", "Z")
            .optionalEnd()
            .optionalEnd()
            .toFormatter(Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);

    private TimestampConverter() {
    }

    /**
     * Components of a successfully parsed string.
     *
     * @param epochSecond seconds since the epoch, UTC
     * @param nanos nanoseconds within the second
     * @param fractionDigits number of fractional-second digits written in the input
     * @param dateOnly whether the input was a bare date
     */
    record ParsedTimestamp(long epochSecond, int nanos, int fractionDigits, boolean dateOnly) {
    }

    /**
     * Whether inference should type this string as a second-resolution timestamp rather than
     * as a string: it must be a date or a date-time without fractional seconds.
     */
    public static boolean isInferableTimestamp(String text) {
        ParsedTimestamp parsed = parse(text);
        return parsed != null && parsed.fractionDigits() == 0;
    }

    /**
     * Converts the string into a count of {@code unit} since the epoch.
     *
     * @throws TypeConflictException if the string is not an accepted ISO-8601 form, or if its
     *         fractional seconds are finer than {@code unit} can represent
     */
    public static long toEpochUnits(String text, TimeUnit unit) throws TypeConflictException {
        ParsedTimestamp parsed = parse(text);
        if (parsed == null) {
            throw new TypeConflictException("\"" + text + "\" is not an ISO-8601 date or timestamp");
        }
        long nanosPerUnit = unit.nanosPerUnit();
        if (parsed.nanos() % nanosPerUnit != 0) {
            throw new TypeConflictException("\"" + text + "\" cannot be represented in unit "
                    + unit.symbol() + " without losing precision");
        }
        try {
            return Math.addExact(Math.multiplyExact(parsed.epochSecond(), unit.perSecond()),
                    parsed.nanos() / nanosPerUnit);
        }
        catch (ArithmeticException e) {
            throw new TypeConflictException("\"" + text + "\" is out of range for unit " + unit.symbol(), e);
        }
    }

    /**
     * Converts a {@code yyyy-MM-dd} string into days since the epoch.
     */
    public static int toEpochDays(String text) throws TypeConflictException {
        ParsedTimestamp parsed = parse(text);
        if (parsed == null || !parsed.dateOnly()) {
            throw new TypeConflictException("\"" + text + "\" is not an ISO-8601 date");
        }
        try {
            return Math.toIntExact(Math.floorDiv(parsed.epochSecond(), SECONDS_PER_DAY));
        }
        catch (ArithmeticException e) {
            throw new TypeConflictException("\"" + text + "\" is out of range for date32", e);
        }
    }

    static ParsedTimestamp parse(String text) {
        String normalized = text;
        int space = text.indexOf(' ');
        if (space > 0 && text.indexOf('T') < 0) {
            normalized = text.substring(0, space) + 'T' + text.substring(space + 1);
        }
        TemporalAccessor parsed;
        try {
            parsed = FORMAT.parseBest(normalized, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
        }
        catch (DateTimeParseException e) {
            return null;
        }
        if (parsed instanceof OffsetDateTime dateTime) {
            return new ParsedTimestamp(dateTime.toEpochSecond(), dateTime.getNano(), fractionDigits(normalized), false);
        }
        if (parsed instanceof LocalDateTime dateTime) {
            return new ParsedTimestamp(dateTime.toEpochSecond(ZoneOffset.UTC), dateTime.getNano(),
                    fractionDigits(normalized), false);
        }
        return new ParsedTimestamp(((LocalDate) parsed).toEpochDay() * SECONDS_PER_DAY, 0, 0, true);
    }

    private static int fractionDigits(String text) {
        int dot = text.indexOf('.');
        if (dot < 0) {
            return 0;
        }
        int end = dot + 1;
        while (end < text.length() && text.charAt(end) >= '0' && text.charAt(end) <= '9') {
            end++;
        }
        return end - dot - 1;
    }
}
