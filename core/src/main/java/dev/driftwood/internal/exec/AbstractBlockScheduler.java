/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.exec;

import java.util.List;

import dev.driftwood.internal.assembly.BlockResult;
import dev.driftwood.internal.segment.BlockSegmenter;
import dev.driftwood.reader.DriftwoodException;

/**
 * Base class tracking the {@link BlockScheduler.State} life cycle.
 */
abstract class AbstractBlockScheduler implements BlockScheduler {

    protected final BlockProcessor processor;
    private volatile State state = State.IDLE;

    protected AbstractBlockScheduler(BlockProcessor processor) {
        this.processor = processor;
    }

    @Override
    public final List<BlockResult> run(BlockSegmenter segmenter) throws DriftwoodException {
        synchronized (this) {
            if (state != State.IDLE) {
                throw new IllegalStateException("Scheduler has already been run, state is " + state);
            }
            state = State.RUNNING;
        }
        try {
            List<BlockResult> results = doRun(segmenter);
            state = State.DONE;
            return results;
        }
        catch (DriftwoodException | RuntimeException | Error e) {
            state = State.FAILED;
            throw e;
        }
    }

    @Override
    public State state() {
        return state;
    }

    protected abstract List<BlockResult> doRun(BlockSegmenter segmenter) throws DriftwoodException;

    static void releaseAll(List<BlockResult> results) {
        for (BlockResult result : results) {
            result.account().releaseAll();
        }
    }
}
