/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.conversion;

import dev.driftwood.internal.parser.JsonValue;
import dev.driftwood.reader.TypeConflictException;
import dev.driftwood.schema.FieldType;
import dev.driftwood.schema.TimeUnit;

/**
 * Converts parsed JSON scalars into the physical values of a column type.
 * <p>
 * Conversions are strict: the only implicit ones are integers into floating point and doubles
 * into floats within the float range.
 * Anything else that does not match the column type is reported as a {@link TypeConflictException}
 * naming the field path and the offending value.
 * </p>
 */
public final class ValueConverter {

    private ValueConverter() {
    }

    public static boolean toBoolean(JsonValue value, String path) throws TypeConflictException {
        if (value instanceof JsonValue.BoolValue b) {
            return b.value();
        }
        throw mismatch(value, FieldType.BOOLEAN, path);
    }

    public static long toInt64(JsonValue value, String path) throws TypeConflictException {
        if (value instanceof JsonValue.IntValue i) {
            return i.value();
        }
        throw mismatch(value, FieldType.INT64, path);
    }

    /**
     * Narrows a number to a float, rounding to the nearest float. Magnitudes beyond the float
     * range are a conflict rather than an infinity.
     */
    public static float toFloat32(JsonValue value, String path) throws TypeConflictException {
        double number;
        if (value instanceof JsonValue.FloatValue f) {
            number = f.value();
        }
        else if (value instanceof JsonValue.IntValue i) {
            number = i.value();
        }
        else {
            throw mismatch(value, FieldType.FLOAT32, path);
        }
        float narrowed = (float) number;
        if (Float.isInfinite(narrowed) && !Double.isInfinite(number)) {
            throw new TypeConflictException("Field '" + path + "': value " + abbreviate(value)
                    + " is out of range for " + FieldType.FLOAT32);
        }
        return narrowed;
    }

    public static double toFloat64(JsonValue value, String path) throws TypeConflictException {
        if (value instanceof JsonValue.FloatValue f) {
            return f.value();
        }
        if (value instanceof JsonValue.IntValue i) {
            return i.value();
        }
        throw mismatch(value, FieldType.FLOAT64, path);
    }

    public static String toUtf8(JsonValue value, String path) throws TypeConflictException {
        if (value instanceof JsonValue.StringValue s) {
            return s.value();
        }
        throw mismatch(value, FieldType.UTF8, path);
    }

    public static long toTimestamp(JsonValue value, TimeUnit unit, String path) throws TypeConflictException {
        if (value instanceof JsonValue.StringValue s) {
            try {
                return TimestampConverter.toEpochUnits(s.value(), unit);
            }
            catch (TypeConflictException e) {
                throw new TypeConflictException("Field '" + path + "': " + e.getMessage(), e);
            }
        }
        throw mismatch(value, FieldType.timestamp(unit), path);
    }

    public static int toDate32(JsonValue value, String path) throws TypeConflictException {
        if (value instanceof JsonValue.StringValue s) {
            try {
                return TimestampConverter.toEpochDays(s.value());
            }
            catch (TypeConflictException e) {
                throw new TypeConflictException("Field '" + path + "': " + e.getMessage(), e);
            }
        }
        throw mismatch(value, FieldType.DATE32, path);
    }

    public static TypeConflictException mismatch(JsonValue value, FieldType type, String path) {
        return new TypeConflictException("Field '" + path + "': cannot convert " + value.kind()
                + " value " + abbreviate(value) + " to " + type);
    }

    private static String abbreviate(JsonValue value) {
        String text = value.toString();
        return text.length() <= 64 ? text : text.substring(0, 61) + "...";
    }
}
