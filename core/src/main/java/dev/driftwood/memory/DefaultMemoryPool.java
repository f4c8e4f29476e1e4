/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.memory;

import java.util.concurrent.atomic.AtomicLong;

import dev.driftwood.reader.AllocationException;

/**
 * Lock-free {@link MemoryPool} tracking reservations against a fixed limit.
 */
final class DefaultMemoryPool implements MemoryPool {

    private final long limit;
    private final AtomicLong allocated = new AtomicLong();
    private final AtomicLong peak = new AtomicLong();

    DefaultMemoryPool(long limit) {
        this.limit = limit;
    }

    @Override
    public void allocate(long bytes) throws AllocationException {
        if (bytes < 0) {
            throw new IllegalArgumentException("Cannot allocate a negative number of bytes: " + bytes);
        }
        while (true) {
            long current = allocated.get();
            long requested = current + bytes;
            if (requested < current || requested > limit) {
                throw new AllocationException("Cannot allocate " + bytes + " bytes: " + current
                        + " of " + limit + " bytes already in use");
            }
            if (allocated.compareAndSet(current, requested)) {
                peak.accumulateAndGet(requested, Math::max);
                return;
            }
        }
    }

    @Override
    public void release(long bytes) {
        if (bytes < 0) {
            throw new IllegalArgumentException("Cannot release a negative number of bytes: " + bytes);
        }
        long remaining = allocated.addAndGet(-bytes);
        if (remaining < 0) {
            throw new IllegalStateException("Released more bytes than were allocated (balance " + remaining + ")");
        }
    }

    @Override
    public long bytesAllocated() {
        return allocated.get();
    }

    @Override
    public long peakBytesAllocated() {
        return peak.get();
    }

    @Override
    public long limit() {
        return limit;
    }

    @Override
    public String toString() {
        return "MemoryPool[allocated=" + allocated.get() + ", limit=" + limit + "]";
    }
}
