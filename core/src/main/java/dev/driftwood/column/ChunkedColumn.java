/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.column;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import dev.driftwood.schema.Field;

/**
 * A column stored as an ordered sequence of segments, one per input block.
 * Chunk boundaries carry no meaning beyond concatenation order.
 */
public final class ChunkedColumn {

    private final Field field;
    private final List<ColumnVector> chunks;
    // Position of each chunk's first entry within the column
    private final long[] chunkStarts;
    private final long length;

    public ChunkedColumn(Field field, List<ColumnVector> chunks) {
        this.field = field;
        this.chunks = List.copyOf(chunks);
        this.chunkStarts = new long[this.chunks.size()];
        long total = 0;
        for (int i = 0; i < this.chunks.size(); i++) {
            ColumnVector chunk = this.chunks.get(i);
            if (!chunk.type().equals(field.type())) {
                throw new IllegalArgumentException("Chunk of type " + chunk.type() + " in column " + field);
            }
            chunkStarts[i] = total;
            total += chunk.length();
        }
        this.length = total;
    }

    public Field field() {
        return field;
    }

    public String name() {
        return field.name();
    }

    public List<ColumnVector> chunks() {
        return chunks;
    }

    public ColumnVector chunk(int index) {
        return chunks.get(index);
    }

    public int chunkCount() {
        return chunks.size();
    }

    /** Total number of entries across all chunks. */
    public long length() {
        return length;
    }

    public boolean isNull(long index) {
        int chunk = chunkOf(index);
        return chunks.get(chunk).isNull((int) (index - chunkStarts[chunk]));
    }

    /**
     * Value at the given position of the whole column, see {@link ColumnVector#getObject(int)}.
     */
    public Object get(long index) {
        int chunk = chunkOf(index);
        return chunks.get(chunk).getObject((int) (index - chunkStarts[chunk]));
    }

    private int chunkOf(long index) {
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length " + length);
        }
        int chunk = Arrays.binarySearch(chunkStarts, index);
        if (chunk < 0) {
            return -chunk - 2;
        }
        // skip empty chunks sharing the same start
        while (chunks.get(chunk).length() == 0) {
            chunk++;
        }
        return chunk;
    }

    /**
     * All values of the column, in order, as Java objects.
     */
    public List<Object> toList() {
        List<Object> values = new ArrayList<>((int) Math.min(length, Integer.MAX_VALUE));
        for (ColumnVector chunk : chunks) {
            values.addAll(chunk.toList());
        }
        return values;
    }

    /**
     * Returns this column as a single chunk.
     */
    public ChunkedColumn combine() {
        if (chunks.size() == 1) {
            return this;
        }
        return new ChunkedColumn(field, List.of(ColumnVectors.concat(field.type(), chunks)));
    }

    @Override
    public String toString() {
        return field + " (" + length + " values in " + chunks.size() + " chunks)";
    }
}
