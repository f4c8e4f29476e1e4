/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.memory;

import dev.driftwood.reader.AllocationException;

/**
 * Source of memory for column storage.
 * <p>
 * Column builders reserve bytes from the pool before growing their arrays; reservations are
 * returned when a read fails or when the resulting {@link dev.driftwood.column.Table} is closed.
 * Implementations must be safe for concurrent use, as blocks are assembled in parallel.
 * </p>
 */
public interface MemoryPool {

    /**
     * Reserves the given number of bytes.
     *
     * @throws AllocationException if the reservation would exceed the pool's limit
     */
    void allocate(long bytes) throws AllocationException;

    /**
     * Returns previously reserved bytes to the pool.
     */
    void release(long bytes);

    /**
     * Bytes currently reserved.
     */
    long bytesAllocated();

    /**
     * Highest number of bytes reserved at any one time.
     */
    long peakBytesAllocated();

    /**
     * Maximum number of bytes that may be reserved at once.
     */
    long limit();

    /**
     * A pool without a limit, only tracking usage.
     */
    static MemoryPool unbounded() {
        return new DefaultMemoryPool(Long.MAX_VALUE);
    }

    /**
     * A pool refusing reservations beyond the given number of bytes.
     */
    static MemoryPool bounded(long limitBytes) {
        if (limitBytes <= 0) {
            throw new IllegalArgumentException("Memory limit must be positive: " + limitBytes);
        }
        return new DefaultMemoryPool(limitBytes);
    }
}
