/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.column;

import java.util.ArrayList;
import java.util.List;

import dev.driftwood.memory.MemoryAccount;
import dev.driftwood.schema.Schema;

/**
 * The result of reading a JSON Lines stream: a schema plus one chunked column per field.
 * <p>
 * The column storage is reserved from the {@link dev.driftwood.memory.MemoryPool} the reader
 * was given; closing the table returns it.
 * </p>
 */
public final class Table implements AutoCloseable {

    private final Schema schema;
    private final List<ChunkedColumn> columns;
    private final long rowCount;
    private final MemoryAccount account;

    public Table(Schema schema, List<ChunkedColumn> columns, long rowCount, MemoryAccount account) {
        if (schema.getFieldCount() != columns.size()) {
            throw new IllegalArgumentException("Schema has " + schema.getFieldCount() + " fields but "
                    + columns.size() + " columns were given");
        }
        for (int i = 0; i < columns.size(); i++) {
            ChunkedColumn column = columns.get(i);
            if (!column.field().equals(schema.getField(i))) {
                throw new IllegalArgumentException("Column " + i + " is " + column.field()
                        + " but the schema declares " + schema.getField(i));
            }
            if (column.length() != rowCount) {
                throw new IllegalArgumentException("Column " + column.name() + " has " + column.length()
                        + " values but the table has " + rowCount + " rows");
            }
        }
        this.schema = schema;
        this.columns = List.copyOf(columns);
        this.rowCount = rowCount;
        this.account = account;
    }

    public Schema schema() {
        return schema;
    }

    public long rowCount() {
        return rowCount;
    }

    public int columnCount() {
        return columns.size();
    }

    public List<ChunkedColumn> columns() {
        return columns;
    }

    public ChunkedColumn column(int index) {
        return columns.get(index);
    }

    public ChunkedColumn column(String name) {
        int index = schema.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Column not found: " + name);
        }
        return columns.get(index);
    }

    /**
     * Returns an equivalent table whose columns each consist of a single chunk.
     * The combined storage is not accounted against the memory pool.
     */
    public Table combineChunks() {
        List<ChunkedColumn> combined = new ArrayList<>(columns.size());
        for (ChunkedColumn column : columns) {
            combined.add(column.combine());
        }
        return new Table(schema, combined, rowCount, null);
    }

    /**
     * Compares schema, row count and values, ignoring how columns are split into chunks.
     */
    public boolean contentEquals(Table other) {
        if (!schema.equals(other.schema) || rowCount != other.rowCount) {
            return false;
        }
        for (int i = 0; i < columns.size(); i++) {
            if (!columns.get(i).toList().equals(other.columns.get(i).toList())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void close() {
        if (account != null) {
            account.releaseAll();
        }
    }

    @Override
    public String toString() {
        return "Table[" + rowCount + " rows]\n" + schema;
    }
}
