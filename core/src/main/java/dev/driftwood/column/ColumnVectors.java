/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.column;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import dev.driftwood.schema.FieldType;

/**
 * Concatenation of column segments of one type into a single segment.
 */
public final class ColumnVectors {

    private ColumnVectors() {
    }

    /**
     * Returns a zero-length segment of the given type.
     */
    public static ColumnVector empty(FieldType type) {
        return concat(type, List.of());
    }

    /**
     * Concatenates segments, all of the given type, in order. The inputs are left untouched.
     */
    public static ColumnVector concat(FieldType type, List<ColumnVector> parts) {
        for (ColumnVector part : parts) {
            if (!part.type().equals(type)) {
                throw new IllegalArgumentException("Cannot concatenate " + part.type() + " segment into " + type);
            }
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }

        int length = 0;
        for (ColumnVector part : parts) {
            length += part.length();
        }
        BitSet nulls = concatNulls(parts);

        if (type instanceof FieldType.NullType) {
            return new ColumnVector.NullVector(length);
        }
        if (type instanceof FieldType.BooleanType) {
            boolean[] values = new boolean[length];
            int pos = 0;
            for (ColumnVector part : parts) {
                System.arraycopy(((ColumnVector.BooleanVector) part).values(), 0, values, pos, part.length());
                pos += part.length();
            }
            return new ColumnVector.BooleanVector(values, nulls, length);
        }
        if (type instanceof FieldType.Int64Type) {
            long[] values = new long[length];
            int pos = 0;
            for (ColumnVector part : parts) {
                System.arraycopy(((ColumnVector.Int64Vector) part).values(), 0, values, pos, part.length());
                pos += part.length();
            }
            return new ColumnVector.Int64Vector(values, nulls, length);
        }
        if (type instanceof FieldType.Float32Type) {
            float[] values = new float[length];
            int pos = 0;
            for (ColumnVector part : parts) {
                System.arraycopy(((ColumnVector.Float32Vector) part).values(), 0, values, pos, part.length());
                pos += part.length();
            }
            return new ColumnVector.Float32Vector(values, nulls, length);
        }
        if (type instanceof FieldType.Float64Type) {
            double[] values = new double[length];
            int pos = 0;
            for (ColumnVector part : parts) {
                System.arraycopy(((ColumnVector.Float64Vector) part).values(), 0, values, pos, part.length());
                pos += part.length();
            }
            return new ColumnVector.Float64Vector(values, nulls, length);
        }
        if (type instanceof FieldType.Utf8Type) {
            String[] values = new String[length];
            int pos = 0;
            for (ColumnVector part : parts) {
                System.arraycopy(((ColumnVector.Utf8Vector) part).values(), 0, values, pos, part.length());
                pos += part.length();
            }
            return new ColumnVector.Utf8Vector(values, nulls, length);
        }
        if (type instanceof FieldType.TimestampType timestampType) {
            long[] values = new long[length];
            int pos = 0;
            for (ColumnVector part : parts) {
                System.arraycopy(((ColumnVector.TimestampVector) part).values(), 0, values, pos, part.length());
                pos += part.length();
            }
            return new ColumnVector.TimestampVector(timestampType, values, nulls, length);
        }
        if (type instanceof FieldType.Date32Type) {
            int[] values = new int[length];
            int pos = 0;
            for (ColumnVector part : parts) {
                System.arraycopy(((ColumnVector.Date32Vector) part).values(), 0, values, pos, part.length());
                pos += part.length();
            }
            return new ColumnVector.Date32Vector(values, nulls, length);
        }
        if (type instanceof FieldType.ListType listType) {
            int[] offsets = new int[length + 1];
            List<ColumnVector> children = new ArrayList<>(parts.size());
            int pos = 0;
            int base = 0;
            for (ColumnVector part : parts) {
                ColumnVector.ListVector list = (ColumnVector.ListVector) part;
                for (int i = 0; i < list.length(); i++) {
                    offsets[pos + i + 1] = base + list.offsets()[i + 1];
                }
                pos += list.length();
                base += list.offsets()[list.length()];
                children.add(list.values());
            }
            return new ColumnVector.ListVector(listType, offsets, concat(listType.elementType(), children), nulls, length);
        }
        if (type instanceof FieldType.FixedSizeListType fixedType) {
            List<ColumnVector> children = new ArrayList<>(parts.size());
            for (ColumnVector part : parts) {
                children.add(((ColumnVector.FixedSizeListVector) part).values());
            }
            return new ColumnVector.FixedSizeListVector(fixedType, concat(fixedType.elementType(), children), nulls, length);
        }
        FieldType.StructType structType = (FieldType.StructType) type;
        List<ColumnVector> children = new ArrayList<>(structType.fields().size());
        for (int c = 0; c < structType.fields().size(); c++) {
            List<ColumnVector> childParts = new ArrayList<>(parts.size());
            for (ColumnVector part : parts) {
                childParts.add(((ColumnVector.StructVector) part).child(c));
            }
            children.add(concat(structType.fields().get(c).type(), childParts));
        }
        return new ColumnVector.StructVector(structType, List.copyOf(children), nulls, length);
    }

    private static BitSet concatNulls(List<ColumnVector> parts) {
        BitSet result = null;
        int pos = 0;
        for (ColumnVector part : parts) {
            BitSet partNulls = part.nulls();
            if (partNulls != null && !partNulls.isEmpty()) {
                if (result == null) {
                    result = new BitSet();
                }
                for (int i = partNulls.nextSetBit(0); i >= 0 && i < part.length(); i = partNulls.nextSetBit(i + 1)) {
                    result.set(pos + i);
                }
            }
            pos += part.length();
        }
        return result;
    }
}
