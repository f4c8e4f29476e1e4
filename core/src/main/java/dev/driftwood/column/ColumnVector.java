/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.column;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import dev.driftwood.schema.FieldType;

/**
 * One contiguous segment of a column.
 * <p>
 * Values are held in typed primitive arrays. A {@link BitSet} marks null entries (a set bit means
 * null); a null bit set means the segment has no nulls. Nested vectors hold their children as
 * vectors of their own, built bottom-up.
 * </p>
 * <p>
 * Segments are immutable once built. The arrays and {@code BitSet}s returned by the record
 * accessors are the segment's own storage, shared with every table holding it, and must be
 * treated as read-only views.
 * </p>
 */
public sealed interface ColumnVector
        permits ColumnVector.NullVector, ColumnVector.BooleanVector, ColumnVector.Int64Vector,
        ColumnVector.Float32Vector, ColumnVector.Float64Vector, ColumnVector.Utf8Vector, ColumnVector.TimestampVector,
        ColumnVector.Date32Vector, ColumnVector.ListVector, ColumnVector.FixedSizeListVector,
        ColumnVector.StructVector {

    FieldType type();

    /** Number of entries, including nulls. */
    int length();

    /** Pre-computed null flags, or null if the segment has no nulls. Read-only. */
    BitSet nulls();

    /** Get the value at index as a Java object, or null for a null entry. */
    Object getObject(int index);

    default boolean isNull(int index) {
        BitSet n = nulls();
        return n != null && n.get(index);
    }

    default int nullCount() {
        BitSet n = nulls();
        return n == null ? 0 : n.cardinality();
    }

    /**
     * All values of this segment as Java objects, see {@link #getObject(int)}.
     */
    default List<Object> toList() {
        List<Object> result = new ArrayList<>(length());
        for (int i = 0; i < length(); i++) {
            result.add(getObject(i));
        }
        return result;
    }

    record NullVector(int length) implements ColumnVector {
        @Override
        public FieldType type() {
            return FieldType.NULL;
        }

        @Override
        public BitSet nulls() {
            BitSet all = new BitSet(length);
            all.set(0, length);
            return all;
        }

        @Override
        public boolean isNull(int index) {
            return true;
        }

        @Override
        public int nullCount() {
            return length;
        }

        @Override
        public Object getObject(int index) {
            return null;
        }
    }

    record BooleanVector(boolean[] values, BitSet nulls, int length) implements ColumnVector {
        public boolean get(int index) {
            return values[index];
        }

        @Override
        public FieldType type() {
            return FieldType.BOOLEAN;
        }

        @Override
        public Object getObject(int index) {
            return isNull(index) ? null : values[index];
        }
    }

    record Int64Vector(long[] values, BitSet nulls, int length) implements ColumnVector {
        public long get(int index) {
            return values[index];
        }

        @Override
        public FieldType type() {
            return FieldType.INT64;
        }

        @Override
        public Object getObject(int index) {
            return isNull(index) ? null : values[index];
        }
    }

    record Float32Vector(float[] values, BitSet nulls, int length) implements ColumnVector {
        public float get(int index) {
            return values[index];
        }

        @Override
        public FieldType type() {
            return FieldType.FLOAT32;
        }

        @Override
        public Object getObject(int index) {
            return isNull(index) ? null : values[index];
        }
    }

    record Float64Vector(double[] values, BitSet nulls, int length) implements ColumnVector {
        public double get(int index) {
            return values[index];
        }

        @Override
        public FieldType type() {
            return FieldType.FLOAT64;
        }

        @Override
        public Object getObject(int index) {
            return isNull(index) ? null : values[index];
        }
    }

    record Utf8Vector(String[] values, BitSet nulls, int length) implements ColumnVector {
        public String get(int index) {
            return values[index];
        }

        @Override
        public FieldType type() {
            return FieldType.UTF8;
        }

        @Override
        public Object getObject(int index) {
            return isNull(index) ? null : values[index];
        }
    }

    /**
     * Timestamps stored as counts of {@link FieldType.TimestampType#unit()} since the epoch, UTC.
     */
    record TimestampVector(FieldType.TimestampType type, long[] values, BitSet nulls, int length) implements ColumnVector {
        public long get(int index) {
            return values[index];
        }

        @Override
        public Object getObject(int index) {
            if (isNull(index)) {
                return null;
            }
            long perSecond = type.unit().perSecond();
            long value = values[index];
            return Instant.ofEpochSecond(Math.floorDiv(value, perSecond),
                    Math.floorMod(value, perSecond) * type.unit().nanosPerUnit());
        }
    }

    /**
     * Dates stored as days since the epoch.
     */
    record Date32Vector(int[] values, BitSet nulls, int length) implements ColumnVector {
        public int get(int index) {
            return values[index];
        }

        @Override
        public FieldType type() {
            return FieldType.DATE32;
        }

        @Override
        public Object getObject(int index) {
            return isNull(index) ? null : LocalDate.ofEpochDay(values[index]);
        }
    }

    /**
     * Variable-length lists. Entry {@code i} spans {@code values[offsets[i] .. offsets[i + 1])};
     * null entries and empty lists both span zero values and are told apart by {@link #nulls()}.
     */
    record ListVector(FieldType.ListType type, int[] offsets, ColumnVector values, BitSet nulls, int length)
            implements ColumnVector {

        public int valueOffset(int index) {
            return offsets[index];
        }

        public int valueLength(int index) {
            return offsets[index + 1] - offsets[index];
        }

        @Override
        public Object getObject(int index) {
            if (isNull(index)) {
                return null;
            }
            List<Object> list = new ArrayList<>(valueLength(index));
            for (int i = offsets[index]; i < offsets[index + 1]; i++) {
                list.add(values.getObject(i));
            }
            return Collections.unmodifiableList(list);
        }
    }

    /**
     * Lists of exactly {@link FieldType.FixedSizeListType#listSize()} values. Entry {@code i} spans
     * {@code values[i * listSize .. (i + 1) * listSize)}; null entries still occupy their span.
     */
    record FixedSizeListVector(FieldType.FixedSizeListType type, ColumnVector values, BitSet nulls, int length)
            implements ColumnVector {

        @Override
        public Object getObject(int index) {
            if (isNull(index)) {
                return null;
            }
            int listSize = type.listSize();
            List<Object> list = new ArrayList<>(listSize);
            for (int i = index * listSize; i < (index + 1) * listSize; i++) {
                list.add(values.getObject(i));
            }
            return Collections.unmodifiableList(list);
        }
    }

    /**
     * Structs with one child vector per field, each of the struct's length.
     */
    record StructVector(FieldType.StructType type, List<ColumnVector> children, BitSet nulls, int length)
            implements ColumnVector {

        public ColumnVector child(int index) {
            return children.get(index);
        }

        public ColumnVector child(String name) {
            int index = type.indexOf(name);
            if (index < 0) {
                throw new IllegalArgumentException("Struct has no field " + name + ": " + type);
            }
            return children.get(index);
        }

        @Override
        public Object getObject(int index) {
            if (isNull(index)) {
                return null;
            }
            Map<String, Object> struct = new LinkedHashMap<>();
            for (int i = 0; i < children.size(); i++) {
                struct.put(type.fields().get(i).name(), children.get(i).getObject(index));
            }
            return Collections.unmodifiableMap(struct);
        }
    }
}
