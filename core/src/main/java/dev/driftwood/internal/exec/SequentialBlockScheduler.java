/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.exec;

import java.util.ArrayList;
import java.util.List;

import dev.driftwood.internal.assembly.BlockResult;
import dev.driftwood.internal.segment.Block;
import dev.driftwood.internal.segment.BlockSegmenter;
import dev.driftwood.reader.DriftwoodException;

/**
 * Processes blocks one after another on the calling thread, stopping at the first failure.
 */
public final class SequentialBlockScheduler extends AbstractBlockScheduler {

    public SequentialBlockScheduler(BlockProcessor processor) {
        super(processor);
    }

    @Override
    protected List<BlockResult> doRun(BlockSegmenter segmenter) throws DriftwoodException {
        List<BlockResult> results = new ArrayList<>();
        try {
            Block block;
            while ((block = segmenter.next()) != null) {
                results.add(processor.process(block));
            }
        }
        catch (DriftwoodException | RuntimeException e) {
            releaseAll(results);
            throw e;
        }
        return results;
    }
}
