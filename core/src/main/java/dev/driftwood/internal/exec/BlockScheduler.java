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
 * Drives the blocks of a segmenter through a {@link BlockProcessor}.
 * <p>
 * A scheduler runs once. It either returns one result per block, in block order, or fails with the
 * error of the lowest-indexed failing block; in that case no result memory stays reserved.
 * </p>
 */
public interface BlockScheduler {

    enum State {
        IDLE,
        RUNNING,
        DONE,
        FAILED
    }

    List<BlockResult> run(BlockSegmenter segmenter) throws DriftwoodException;

    State state();
}
