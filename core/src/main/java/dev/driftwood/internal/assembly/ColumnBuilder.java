/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.assembly;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

import dev.driftwood.column.ColumnVector;
import dev.driftwood.internal.conversion.ValueConverter;
import dev.driftwood.internal.parser.JsonValue;
import dev.driftwood.memory.MemoryAccount;
import dev.driftwood.reader.AllocationException;
import dev.driftwood.reader.SchemaException;
import dev.driftwood.reader.TypeConflictException;
import dev.driftwood.schema.Field;
import dev.driftwood.schema.FieldType;

/**
 * Accumulates the values of one column (or nested child) of a block and produces a {@link ColumnVector}.
 * <p>
 * Storage grows geometrically; every increase is reserved on the block's {@link MemoryAccount}
 * before the arrays are resized, so exceeding the pool's limit surfaces as an {@link AllocationException}.
 * </p>
 */
public abstract class ColumnBuilder {

    private static final int INITIAL_CAPACITY = 16;

    protected final String path;
    private final MemoryAccount account;
    private BitSet nulls;
    protected int length;
    private int capacity;

    protected ColumnBuilder(String path, MemoryAccount account) {
        this.path = path;
        this.account = account;
    }

    /**
     * Creates a builder for the given type, recursively creating builders for nested children.
     */
    public static ColumnBuilder create(FieldType type, String path, MemoryAccount account) {
        if (type instanceof FieldType.NullType) {
            return new NullBuilder(path, account);
        }
        if (type instanceof FieldType.BooleanType) {
            return new BooleanBuilder(path, account);
        }
        if (type instanceof FieldType.Int64Type) {
            return new Int64Builder(path, account);
        }
        if (type instanceof FieldType.Float32Type) {
            return new Float32Builder(path, account);
        }
        if (type instanceof FieldType.Float64Type) {
            return new Float64Builder(path, account);
        }
        if (type instanceof FieldType.Utf8Type) {
            return new Utf8Builder(path, account);
        }
        if (type instanceof FieldType.TimestampType timestamp) {
            return new TimestampBuilder(timestamp, path, account);
        }
        if (type instanceof FieldType.Date32Type) {
            return new Date32Builder(path, account);
        }
        if (type instanceof FieldType.ListType list) {
            return new ListBuilder(list, create(list.elementType(), path + "[]", account), path, account);
        }
        if (type instanceof FieldType.FixedSizeListType list) {
            return new FixedSizeListBuilder(list, create(list.elementType(), path + "[]", account), path, account);
        }
        FieldType.StructType struct = (FieldType.StructType) type;
        List<ColumnBuilder> children = new ArrayList<>(struct.fields().size());
        for (Field field : struct.fields()) {
            children.add(create(field.type(), path.isEmpty() ? field.name() : path + "." + field.name(), account));
        }
        return new StructBuilder(struct, children, path, account);
    }

    public abstract FieldType type();

    public int length() {
        return length;
    }

    /**
     * Appends a value; {@code null} (an absent field) and JSON null both append a null slot.
     */
    public final void append(JsonValue value)
            throws TypeConflictException, SchemaException, AllocationException {
        if (value == null || value.isNull()) {
            appendNull();
            return;
        }
        reserve(length + 1);
        appendValue(value);
        length++;
    }

    public final void appendNull() throws AllocationException {
        reserve(length + 1);
        if (nulls == null) {
            nulls = new BitSet();
        }
        nulls.set(length);
        appendNullValue();
        length++;
    }

    public abstract ColumnVector build();

    /**
     * Writes a non-null value into slot {@link #length}; capacity has already been reserved.
     */
    protected abstract void appendValue(JsonValue value)
            throws TypeConflictException, SchemaException, AllocationException;

    /**
     * Fills slot {@link #length} for a null. Nested builders keep their children aligned here.
     */
    protected void appendNullValue() throws AllocationException {
    }

    protected abstract int bytesPerEntry();

    protected abstract void resize(int newCapacity);

    protected BitSet nulls() {
        return nulls;
    }

    private void reserve(int needed) throws AllocationException {
        if (needed <= capacity) {
            return;
        }
        int newCapacity = Math.max(needed, Math.max(INITIAL_CAPACITY, capacity + (capacity >> 1)));
        account.allocate((long) (newCapacity - capacity) * bytesPerEntry());
        resize(newCapacity);
        capacity = newCapacity;
    }

    protected void reserveBytes(long bytes) throws AllocationException {
        account.allocate(bytes);
    }

    static final class NullBuilder extends ColumnBuilder {

        NullBuilder(String path, MemoryAccount account) {
            super(path, account);
        }

        @Override
        public FieldType type() {
            return FieldType.NULL;
        }

        @Override
        protected void appendValue(JsonValue value) throws TypeConflictException {
            throw ValueConverter.mismatch(value, FieldType.NULL, path);
        }

        @Override
        protected int bytesPerEntry() {
            return 0;
        }

        @Override
        protected void resize(int newCapacity) {
        }

        @Override
        public ColumnVector build() {
            return new ColumnVector.NullVector(length);
        }
    }

    static final class BooleanBuilder extends ColumnBuilder {

        private boolean[] values = new boolean[0];

        BooleanBuilder(String path, MemoryAccount account) {
            super(path, account);
        }

        @Override
        public FieldType type() {
            return FieldType.BOOLEAN;
        }

        @Override
        protected void appendValue(JsonValue value) throws TypeConflictException {
            values[length] = ValueConverter.toBoolean(value, path);
        }

        @Override
        protected int bytesPerEntry() {
            return 1;
        }

        @Override
        protected void resize(int newCapacity) {
            values = Arrays.copyOf(values, newCapacity);
        }

        @Override
        public ColumnVector build() {
            return new ColumnVector.BooleanVector(Arrays.copyOf(values, length), nulls(), length);
        }
    }

    static final class Int64Builder extends ColumnBuilder {

        private long[] values = new long[0];

        Int64Builder(String path, MemoryAccount account) {
            super(path, account);
        }

        @Override
        public FieldType type() {
            return FieldType.INT64;
        }

        @Override
        protected void appendValue(JsonValue value) throws TypeConflictException {
            values[length] = ValueConverter.toInt64(value, path);
        }

        @Override
        protected int bytesPerEntry() {
            return Long.BYTES;
        }

        @Override
        protected void resize(int newCapacity) {
            values = Arrays.copyOf(values, newCapacity);
        }

        @Override
        public ColumnVector build() {
            return new ColumnVector.Int64Vector(Arrays.copyOf(values, length), nulls(), length);
        }
    }

    static final class Float64Builder extends ColumnBuilder {

        private double[] values = new double[0];

        Float64Builder(String path, MemoryAccount account) {
            super(path, account);
        }

        @Override
        public FieldType type() {
            return FieldType.FLOAT64;
        }

        @Override
        protected void appendValue(JsonValue value) throws TypeConflictException {
            values[length] = ValueConverter.toFloat64(value, path);
        }

        @Override
        protected int bytesPerEntry() {
            return Double.BYTES;
        }

        @Override
        protected void resize(int newCapacity) {
            values = Arrays.copyOf(values, newCapacity);
        }

        @Override
        public ColumnVector build() {
            return new ColumnVector.Float64Vector(Arrays.copyOf(values, length), nulls(), length);
        }
    }

    static final class Float32Builder extends ColumnBuilder {

        private float[] values = new float[0];

        Float32Builder(String path, MemoryAccount account) {
            super(path, account);
        }

        @Override
        public FieldType type() {
            return FieldType.FLOAT32;
        }

        @Override
        protected void appendValue(JsonValue value) throws TypeConflictException {
            values[length] = ValueConverter.toFloat32(value, path);
        }

        @Override
        protected int bytesPerEntry() {
            return Float.BYTES;
        }

        @Override
        protected void resize(int newCapacity) {
            values = Arrays.copyOf(values, newCapacity);
        }

        @Override
        public ColumnVector build() {
            return new ColumnVector.Float32Vector(Arrays.copyOf(values, length), nulls(), length);
        }
    }

    static final class Utf8Builder extends ColumnBuilder {

        private String[] values = new String[0];

        Utf8Builder(String path, MemoryAccount account) {
            super(path, account);
        }

        @Override
        public FieldType type() {
            return FieldType.UTF8;
        }

        @Override
        protected void appendValue(JsonValue value) throws TypeConflictException, AllocationException {
            String text = ValueConverter.toUtf8(value, path);
            reserveBytes(2L * text.length());
            values[length] = text;
        }

        @Override
        protected int bytesPerEntry() {
            return 8;
        }

        @Override
        protected void resize(int newCapacity) {
            values = Arrays.copyOf(values, newCapacity);
        }

        @Override
        public ColumnVector build() {
            return new ColumnVector.Utf8Vector(Arrays.copyOf(values, length), nulls(), length);
        }
    }

    static final class TimestampBuilder extends ColumnBuilder {

        private final FieldType.TimestampType type;
        private long[] values = new long[0];

        TimestampBuilder(FieldType.TimestampType type, String path, MemoryAccount account) {
            super(path, account);
            this.type = type;
        }

        @Override
        public FieldType type() {
            return type;
        }

        @Override
        protected void appendValue(JsonValue value) throws TypeConflictException {
            values[length] = ValueConverter.toTimestamp(value, type.unit(), path);
        }

        @Override
        protected int bytesPerEntry() {
            return Long.BYTES;
        }

        @Override
        protected void resize(int newCapacity) {
            values = Arrays.copyOf(values, newCapacity);
        }

        @Override
        public ColumnVector build() {
            return new ColumnVector.TimestampVector(type, Arrays.copyOf(values, length), nulls(), length);
        }
    }

    static final class Date32Builder extends ColumnBuilder {

        private int[] values = new int[0];

        Date32Builder(String path, MemoryAccount account) {
            super(path, account);
        }

        @Override
        public FieldType type() {
            return FieldType.DATE32;
        }

        @Override
        protected void appendValue(JsonValue value) throws TypeConflictException {
            values[length] = ValueConverter.toDate32(value, path);
        }

        @Override
        protected int bytesPerEntry() {
            return Integer.BYTES;
        }

        @Override
        protected void resize(int newCapacity) {
            values = Arrays.copyOf(values, newCapacity);
        }

        @Override
        public ColumnVector build() {
            return new ColumnVector.Date32Vector(Arrays.copyOf(values, length), nulls(), length);
        }
    }

    static final class ListBuilder extends ColumnBuilder {

        private final FieldType.ListType type;
        private final ColumnBuilder elements;
        private int[] offsets = new int[1];

        ListBuilder(FieldType.ListType type, ColumnBuilder elements, String path, MemoryAccount account) {
            super(path, account);
            this.type = type;
            this.elements = elements;
        }

        @Override
        public FieldType type() {
            return type;
        }

        @Override
        protected void appendValue(JsonValue value)
                throws TypeConflictException, SchemaException, AllocationException {
            if (!(value instanceof JsonValue.ArrayValue array)) {
                throw ValueConverter.mismatch(value, type, path);
            }
            for (JsonValue element : array.elements()) {
                elements.append(element);
            }
            offsets[length + 1] = elements.length();
        }

        @Override
        protected void appendNullValue() {
            offsets[length + 1] = offsets[length];
        }

        @Override
        protected int bytesPerEntry() {
            return Integer.BYTES;
        }

        @Override
        protected void resize(int newCapacity) {
            offsets = Arrays.copyOf(offsets, newCapacity + 1);
        }

        @Override
        public ColumnVector build() {
            return new ColumnVector.ListVector(type, Arrays.copyOf(offsets, length + 1), elements.build(), nulls(), length);
        }
    }

    static final class FixedSizeListBuilder extends ColumnBuilder {

        private final FieldType.FixedSizeListType type;
        private final ColumnBuilder elements;

        FixedSizeListBuilder(FieldType.FixedSizeListType type, ColumnBuilder elements, String path, MemoryAccount account) {
            super(path, account);
            this.type = type;
            this.elements = elements;
        }

        @Override
        public FieldType type() {
            return type;
        }

        @Override
        protected void appendValue(JsonValue value)
                throws TypeConflictException, SchemaException, AllocationException {
            if (!(value instanceof JsonValue.ArrayValue array)) {
                throw ValueConverter.mismatch(value, type, path);
            }
            if (array.size() != type.listSize()) {
                throw new SchemaException("Field '" + path + "' expects lists of exactly " + type.listSize()
                        + " elements but found " + array.size());
            }
            for (JsonValue element : array.elements()) {
                elements.append(element);
            }
        }

        @Override
        protected void appendNullValue() throws AllocationException {
            for (int i = 0; i < type.listSize(); i++) {
                elements.appendNull();
            }
        }

        @Override
        protected int bytesPerEntry() {
            return 0;
        }

        @Override
        protected void resize(int newCapacity) {
        }

        @Override
        public ColumnVector build() {
            return new ColumnVector.FixedSizeListVector(type, elements.build(), nulls(), length);
        }
    }

    static final class StructBuilder extends ColumnBuilder {

        private final FieldType.StructType type;
        private final List<ColumnBuilder> children;

        StructBuilder(FieldType.StructType type, List<ColumnBuilder> children, String path, MemoryAccount account) {
            super(path, account);
            this.type = type;
            this.children = children;
        }

        @Override
        public FieldType type() {
            return type;
        }

        @Override
        protected void appendValue(JsonValue value)
                throws TypeConflictException, SchemaException, AllocationException {
            if (!(value instanceof JsonValue.ObjectValue object)) {
                throw ValueConverter.mismatch(value, type, path);
            }
            for (String name : object.members().keySet()) {
                if (type.indexOf(name) < 0) {
                    throw new SchemaException("Unexpected field '" + (path.isEmpty() ? name : path + "." + name) + "'");
                }
            }
            List<Field> fields = type.fields();
            for (int i = 0; i < fields.size(); i++) {
                children.get(i).append(object.get(fields.get(i).name()));
            }
        }

        @Override
        protected void appendNullValue() throws AllocationException {
            for (ColumnBuilder child : children) {
                child.appendNull();
            }
        }

        @Override
        protected int bytesPerEntry() {
            return 0;
        }

        @Override
        protected void resize(int newCapacity) {
        }

        @Override
        public ColumnVector build() {
            List<ColumnVector> built = new ArrayList<>(children.size());
            for (ColumnBuilder child : children) {
                built.add(child.build());
            }
            return new ColumnVector.StructVector(type, built, nulls(), length);
        }
    }
}
