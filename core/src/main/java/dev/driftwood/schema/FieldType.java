/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.schema;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Logical type of a column.
 * <p>
 * {@link NullType} is the bottom of the type lattice: a field only ever observed as JSON
 * {@code null} has this type, and it unifies with every other type. {@link Float32Type} and
 * {@link Date32Type} are only produced by explicit schemas, never by inference.
 * </p>
 */
public sealed interface FieldType
        permits FieldType.NullType, FieldType.BooleanType, FieldType.Int64Type, FieldType.Float32Type, FieldType.Float64Type,
        FieldType.Utf8Type, FieldType.TimestampType, FieldType.Date32Type, FieldType.ListType,
        FieldType.StructType, FieldType.FixedSizeListType {

    NullType NULL = new NullType();
    BooleanType BOOLEAN = new BooleanType();
    Int64Type INT64 = new Int64Type();
    Float32Type FLOAT32 = new Float32Type();
    Float64Type FLOAT64 = new Float64Type();
    Utf8Type UTF8 = new Utf8Type();
    Date32Type DATE32 = new Date32Type();

    static TimestampType timestamp(TimeUnit unit) {
        return new TimestampType(unit);
    }

    static ListType list(FieldType elementType) {
        return new ListType(elementType);
    }

    static FixedSizeListType fixedSizeList(FieldType elementType, int listSize) {
        return new FixedSizeListType(elementType, listSize);
    }

    static StructType struct(Field... fields) {
        return new StructType(Arrays.asList(fields));
    }

    static StructType struct(List<Field> fields) {
        return new StructType(fields);
    }

    /**
     * Returns true for list, fixed-size list and struct types.
     */
    default boolean isNested() {
        return false;
    }

    record NullType() implements FieldType {
        @Override
        public String toString() {
            return "null";
        }
    }

    record BooleanType() implements FieldType {
        @Override
        public String toString() {
            return "bool";
        }
    }

    record Int64Type() implements FieldType {
        @Override
        public String toString() {
            return "int64";
        }
    }

    record Float32Type() implements FieldType {
        @Override
        public String toString() {
            return "float";
        }
    }

    record Float64Type() implements FieldType {
        @Override
        public String toString() {
            return "double";
        }
    }

    record Utf8Type() implements FieldType {
        @Override
        public String toString() {
            return "string";
        }
    }

    record Date32Type() implements FieldType {
        @Override
        public String toString() {
            return "date32";
        }
    }

    record TimestampType(TimeUnit unit) implements FieldType {
        public TimestampType {
            Objects.requireNonNull(unit, "unit");
        }

        @Override
        public String toString() {
            return "timestamp[" + unit.symbol() + "]";
        }
    }

    record ListType(FieldType elementType) implements FieldType {
        public ListType {
            Objects.requireNonNull(elementType, "elementType");
        }

        @Override
        public boolean isNested() {
            return true;
        }

        @Override
        public String toString() {
            return "list<" + elementType + ">";
        }
    }

    record FixedSizeListType(FieldType elementType, int listSize) implements FieldType {
        public FixedSizeListType {
            Objects.requireNonNull(elementType, "elementType");
            if (listSize < 0) {
                throw new IllegalArgumentException("List size cannot be negative: " + listSize);
            }
        }

        @Override
        public boolean isNested() {
            return true;
        }

        @Override
        public String toString() {
            return "fixed_size_list<" + elementType + ", " + listSize + ">";
        }
    }

    record StructType(List<Field> fields) implements FieldType {
        public StructType {
            fields = List.copyOf(fields);
            FieldNameIndex.of(fields, "struct");
        }

        /**
         * Position of the named child, or -1 if the struct has no such child.
         */
        public int indexOf(String name) {
            for (int i = 0; i < fields.size(); i++) {
                if (fields.get(i).name().equals(name)) {
                    return i;
                }
            }
            return -1;
        }

        /**
         * The named child, or null if the struct has no such child.
         */
        public Field field(String name) {
            int index = indexOf(name);
            return index < 0 ? null : fields.get(index);
        }

        @Override
        public boolean isNested() {
            return true;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("struct<");
            for (int i = 0; i < fields.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(fields.get(i));
            }
            return sb.append('>').toString();
        }
    }
}
