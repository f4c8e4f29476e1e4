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
 * Tracks the bytes one consumer has reserved from a {@link MemoryPool}, so they can be
 * handed back in one step.
 * <p>
 * Each block task owns an account while it assembles columns. Completed accounts are folded
 * into the account of the resulting table via {@link #transferTo(MemoryAccount)}.
 * </p>
 */
public final class MemoryAccount {

    private final MemoryPool pool;
    private final AtomicLong bytes = new AtomicLong();

    public MemoryAccount(MemoryPool pool) {
        this.pool = pool;
    }

    public void allocate(long count) throws AllocationException {
        pool.allocate(count);
        bytes.addAndGet(count);
    }

    public void release(long count) {
        bytes.addAndGet(-count);
        pool.release(count);
    }

    /**
     * Moves this account's reservations to another account of the same pool.
     */
    public void transferTo(MemoryAccount target) {
        if (target.pool != pool) {
            throw new IllegalArgumentException("Accounts belong to different pools");
        }
        target.bytes.addAndGet(bytes.getAndSet(0));
    }

    /**
     * Returns all bytes reserved through this account to the pool.
     */
    public void releaseAll() {
        long held = bytes.getAndSet(0);
        if (held > 0) {
            pool.release(held);
        }
    }

    public long bytes() {
        return bytes.get();
    }

    public MemoryPool pool() {
        return pool;
    }
}
