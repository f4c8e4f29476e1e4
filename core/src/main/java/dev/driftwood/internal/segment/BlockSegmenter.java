/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.segment;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;

import dev.driftwood.reader.StreamException;

/**
 * Splits a byte stream into record-aligned {@link Block}s.
 * <p>
 * Each block holds at least {@code blockSize} bytes (unless the stream ends first) and is then
 * extended up to and including the next {@code '\n'}, so no record is ever split between two
 * blocks. Bytes read past that newline are carried over into the next block. A stream that ends
 * without a trailing newline yields its unterminated tail as part of the last block.
 * </p>
 * <p>
 * Not thread-safe: segmentation always runs on a single thread.
 * </p>
 */
public final class BlockSegmenter {

    private static final System.Logger LOG = System.getLogger(BlockSegmenter.class.getName());

    private static final int MIN_READ_SIZE = 8 * 1024;

    private static final int INITIAL_BUFFER_SIZE = 64 * 1024;

    // Largest array size the JVM reliably allocates
    static final int MAX_BUFFER_SIZE = Integer.MAX_VALUE - 8;

    private final InputStream input;
    private final int blockSize;
    private final int maxBufferSize;

    private byte[] buffer;
    // Valid bytes in buffer are [0, length)
    private int length;
    private boolean endOfStream;
    private long nextIndex;
    private long streamOffset;

    public BlockSegmenter(InputStream input, int blockSize) {
        this(input, blockSize, MAX_BUFFER_SIZE);
    }

    BlockSegmenter(InputStream input, int blockSize, int maxBufferSize) {
        if (blockSize <= 0) {
            throw new IllegalArgumentException("Block size must be positive: " + blockSize);
        }
        this.input = input;
        this.blockSize = blockSize;
        this.maxBufferSize = maxBufferSize;
        this.buffer = new byte[Math.max(16, Math.min(blockSize, INITIAL_BUFFER_SIZE))];
    }

    /**
     * Returns the next block, or null once the stream is exhausted.
     *
     * @throws StreamException if reading the underlying stream fails, or a record does not fit
     *                         into the largest possible block
     */
    public Block next() throws StreamException {
        fill(Math.min(blockSize, maxBufferSize));
        if (length == 0) {
            return null;
        }

        int end = blockEnd();
        byte[] data = Arrays.copyOf(buffer, end);
        System.arraycopy(buffer, end, buffer, 0, length - end);
        length -= end;

        Block block = new Block(nextIndex++, data, streamOffset);
        streamOffset += end;
        LOG.log(System.Logger.Level.DEBUG, "Cut block {0} at offset {1} with {2} bytes",
                block.index(), block.offset(), data.length);
        return block;
    }

    /**
     * Number of blocks handed out so far.
     */
    public long blockCount() {
        return nextIndex;
    }

    /**
     * Finds the exclusive end of the next block: the first newline at or after position
     * {@code blockSize - 1}, reading more input as needed.
     */
    private int blockEnd() throws StreamException {
        int searchFrom = Math.min(blockSize, length) - 1;
        while (true) {
            for (int i = searchFrom; i < length; i++) {
                if (buffer[i] == '\n') {
                    return i + 1;
                }
            }
            if (endOfStream) {
                return length;
            }
            if (length >= maxBufferSize) {
                throw new StreamException("Record at offset " + streamOffset + " does not end within "
                        + maxBufferSize + " bytes", null);
            }
            searchFrom = length;
            fill((int) Math.min((long) length + Math.max(MIN_READ_SIZE, blockSize / 4), maxBufferSize));
        }
    }

    /**
     * Reads until at least {@code target} bytes are buffered or the stream ends. The buffer
     * grows only once it is full, so its size follows the bytes actually read.
     */
    private void fill(int target) throws StreamException {
        try {
            while (length < target && !endOfStream) {
                if (length == buffer.length) {
                    grow(target);
                }
                int read = input.read(buffer, length, Math.min(buffer.length, target) - length);
                if (read < 0) {
                    endOfStream = true;
                }
                else {
                    length += read;
                }
            }
        }
        catch (IOException e) {
            throw new StreamException("Failed to read input at offset " + (streamOffset + length), e);
        }
    }

    private void grow(int target) {
        long grown = Math.max((long) buffer.length + (buffer.length >> 1), (long) buffer.length + MIN_READ_SIZE);
        buffer = Arrays.copyOf(buffer, (int) Math.min(grown, target));
    }
}
