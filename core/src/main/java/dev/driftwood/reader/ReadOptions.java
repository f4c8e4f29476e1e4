/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.reader;

/**
 * Options controlling how the input is read and scheduled.
 *
 * @param useThreads process blocks on a worker pool instead of the calling thread
 * @param blockSize number of bytes read per block before extending to the next record boundary;
 *                  validated to be positive by {@link JsonTableReader}
 * @param compression compression of the input stream, or null to derive it from the file name
 *                    when opening a path (treated as {@link InputCompression#NONE} otherwise)
 */
public record ReadOptions(boolean useThreads, int blockSize, InputCompression compression) {

    static final String BLOCK_SIZE_PROPERTY = "driftwood.blocksize";

    static final int DEFAULT_BLOCK_SIZE = 1 << 20;

    /**
     * Sequential reading with 1 MiB blocks, or the block size given by the
     * {@code driftwood.blocksize} system property.
     */
    public static ReadOptions defaults() {
        return new ReadOptions(false, Integer.getInteger(BLOCK_SIZE_PROPERTY, DEFAULT_BLOCK_SIZE), null);
    }

    public ReadOptions withUseThreads(boolean useThreads) {
        return new ReadOptions(useThreads, blockSize, compression);
    }

    public ReadOptions withBlockSize(int blockSize) {
        return new ReadOptions(useThreads, blockSize, compression);
    }

    public ReadOptions withCompression(InputCompression compression) {
        return new ReadOptions(useThreads, blockSize, compression);
    }
}
