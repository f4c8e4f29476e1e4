/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.reader;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Context object that manages the thread pool used for processing blocks in parallel.
 * <p>
 * A context may be shared by any number of {@link JsonTableReader}s; it is then owned and closed
 * by the caller. A reader created with {@link ReadOptions#useThreads()} and without a context
 * creates and closes its own.
 * </p>
 */
public final class DriftwoodContext implements AutoCloseable {

    static final String THREADS_PROPERTY = "driftwood.threads";

    private static final System.Logger LOG = System.getLogger(DriftwoodContext.class.getName());

    private final ExecutorService executor;
    private final int parallelism;

    private DriftwoodContext(ExecutorService executor, int parallelism) {
        this.executor = executor;
        this.parallelism = parallelism;
    }

    /**
     * Create a new context with a thread pool sized by the {@code driftwood.threads} system property,
     * or the number of available processors if it is not set.
     */
    public static DriftwoodContext create() {
        return create(Integer.getInteger(THREADS_PROPERTY, Runtime.getRuntime().availableProcessors()));
    }

    /**
     * Create a new context with a thread pool of the specified size.
     */
    public static DriftwoodContext create(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be positive: " + threads);
        }
        AtomicInteger threadCounter = new AtomicInteger(0);
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "driftwood-" + threadCounter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        ExecutorService executor = Executors.newFixedThreadPool(threads, threadFactory);
        LOG.log(System.Logger.Level.INFO, "Processing blocks with {0} threads", threads);
        return new DriftwoodContext(executor, threads);
    }

    /**
     * Get the executor service for parallel operations.
     */
    public ExecutorService executor() {
        return executor;
    }

    /**
     * Number of threads, which is also the number of blocks processed at once.
     */
    public int parallelism() {
        return parallelism;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
