/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.exec;

import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

import dev.driftwood.internal.assembly.BlockResult;
import dev.driftwood.internal.segment.Block;
import dev.driftwood.internal.segment.BlockSegmenter;
import dev.driftwood.reader.DriftwoodException;
import dev.driftwood.reader.StreamException;

/**
 * Processes blocks concurrently on an executor while the calling thread keeps reading input.
 * <p>
 * At most {@code maxInFlight} blocks are processed at a time; the reading thread waits for a free
 * slot before submitting the next one. Results are kept in per-block slots so they come back in
 * block order regardless of completion order. Once any block has failed, no further blocks are
 * submitted; after all submitted blocks have settled, the error of the lowest-indexed failing block
 * is thrown. A read error while segmenting counts as a failure of the block that was being read.
 * </p>
 */
public final class ParallelBlockScheduler extends AbstractBlockScheduler {

    private static final System.Logger LOG = System.getLogger(ParallelBlockScheduler.class.getName());

    private final Executor executor;
    private final int maxInFlight;

    public ParallelBlockScheduler(BlockProcessor processor, Executor executor, int maxInFlight) {
        super(processor);
        if (maxInFlight < 1) {
            throw new IllegalArgumentException("maxInFlight must be positive: " + maxInFlight);
        }
        this.executor = executor;
        this.maxInFlight = maxInFlight;
    }

    @Override
    protected List<BlockResult> doRun(BlockSegmenter segmenter) throws DriftwoodException {
        List<CompletableFuture<BlockResult>> slots = new ArrayList<>();
        Semaphore permits = new Semaphore(maxInFlight);
        AtomicBoolean failed = new AtomicBoolean();
        StreamException readFailure = null;

        while (!failed.get()) {
            Block block;
            try {
                block = segmenter.next();
                if (block == null) {
                    break;
                }
                acquire(permits, block.index());
            }
            catch (StreamException e) {
                readFailure = e;
                break;
            }
            try {
                slots.add(submit(block, permits, failed));
            }
            catch (RejectedExecutionException e) {
                // settle the blocks already submitted, then report the rejection as this block's failure
                permits.release();
                slots.add(CompletableFuture.failedFuture(e));
                break;
            }
        }

        awaitAll(slots);

        List<BlockResult> results = new ArrayList<>(slots.size());
        Throwable firstFailure = null;
        for (CompletableFuture<BlockResult> slot : slots) {
            try {
                BlockResult result = slot.join();
                if (firstFailure == null) {
                    results.add(result);
                }
                else {
                    result.account().releaseAll();
                }
            }
            catch (CompletionException e) {
                if (firstFailure == null) {
                    firstFailure = e.getCause() != null ? e.getCause() : e;
                }
            }
        }

        if (firstFailure == null && readFailure == null) {
            return results;
        }
        releaseAll(results);
        if (firstFailure == null) {
            throw readFailure;
        }
        LOG.log(System.Logger.Level.DEBUG, "Block processing failed after submitting {0} blocks", slots.size());
        throw rethrow(firstFailure);
    }

    private CompletableFuture<BlockResult> submit(Block block, Semaphore permits, AtomicBoolean failed) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return processor.process(block);
            }
            catch (DriftwoodException e) {
                failed.set(true);
                throw new CompletionException(e);
            }
            catch (RuntimeException | Error e) {
                failed.set(true);
                throw e;
            }
            finally {
                permits.release();
            }
        }, executor);
    }

    private static void acquire(Semaphore permits, long blockIndex) throws StreamException {
        if (permits.tryAcquire()) {
            return;
        }
        BlockWaitEvent event = new BlockWaitEvent();
        event.begin();
        long start = System.nanoTime();
        try {
            permits.acquire();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StreamException("Interrupted while waiting to submit block " + blockIndex,
                    new InterruptedIOException(e.getMessage()));
        }
        event.blockIndex = blockIndex;
        event.waitDurationMs = (System.nanoTime() - start) / 1_000_000;
        event.commit();
    }

    private static void awaitAll(List<CompletableFuture<BlockResult>> slots) {
        CompletableFuture<?>[] all = slots.toArray(new CompletableFuture<?>[0]);
        try {
            CompletableFuture.allOf(all).join();
        }
        catch (CompletionException e) {
            // allOf completes only once every slot has settled; failures are collected per slot
            LOG.log(System.Logger.Level.TRACE, "Not all blocks completed successfully", e);
        }
    }

    private static DriftwoodException rethrow(Throwable failure) {
        if (failure instanceof DriftwoodException driftwood) {
            return driftwood;
        }
        if (failure instanceof RuntimeException runtime) {
            throw runtime;
        }
        if (failure instanceof Error error) {
            throw error;
        }
        throw new IllegalStateException("Unexpected failure while processing blocks", failure);
    }
}
