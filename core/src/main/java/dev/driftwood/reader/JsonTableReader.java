/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.reader;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import dev.driftwood.column.Table;
import dev.driftwood.internal.assembly.BlockResult;
import dev.driftwood.internal.assembly.TableAssembler;
import dev.driftwood.internal.compression.DecompressorFactory;
import dev.driftwood.internal.exec.BlockProcessor;
import dev.driftwood.internal.exec.BlockScheduler;
import dev.driftwood.internal.exec.ParallelBlockScheduler;
import dev.driftwood.internal.exec.SequentialBlockScheduler;
import dev.driftwood.internal.segment.BlockSegmenter;
import dev.driftwood.memory.MemoryAccount;
import dev.driftwood.memory.MemoryPool;

/**
 * Reads newline-delimited JSON into a columnar {@link Table}.
 * <p>
 * The input is split into blocks at line boundaries. Each block is parsed, typed and converted into
 * column segments independently, sequentially or on the threads of a {@link DriftwoodContext};
 * the block schemas are then unified in input order and the segments promoted to the unified
 * types, giving one chunk per block in every column.
 * </p>
 * <pre>{@code
 * try (JsonTableReader reader = JsonTableReader.open(path);
 *      Table table = reader.read()) {
 *     ChunkedColumn ids = table.column("id");
 *     ...
 * }
 * }</pre>
 * <p>
 * A reader reads its input once; a second call to {@link #read()} fails.
 * </p>
 */
public final class JsonTableReader implements AutoCloseable {

    private static final System.Logger LOG = System.getLogger(JsonTableReader.class.getName());

    private final MemoryPool pool;
    private final InputStream input;
    private final boolean ownsInput;
    private final ReadOptions readOptions;
    private final ParseOptions parseOptions;
    private final DriftwoodContext context;
    private final boolean ownsContext;
    private boolean consumed;

    private JsonTableReader(MemoryPool pool, InputStream input, boolean ownsInput, ReadOptions readOptions,
                            ParseOptions parseOptions, DriftwoodContext context, boolean ownsContext) {
        this.pool = pool;
        this.input = input;
        this.ownsInput = ownsInput;
        this.readOptions = readOptions;
        this.parseOptions = parseOptions;
        this.context = context;
        this.ownsContext = ownsContext;
    }

    /**
     * Create a reader for a stream, which remains owned by the caller. If {@code readOptions}
     * enables threads, the reader creates a dedicated context, closed with the reader.
     *
     * @throws IllegalArgumentException if an argument is missing or the block size is not positive
     */
    public static JsonTableReader create(MemoryPool pool, InputStream input, ReadOptions readOptions,
                                         ParseOptions parseOptions) {
        validate(pool, input, readOptions, parseOptions);
        DriftwoodContext context = readOptions.useThreads() ? DriftwoodContext.create() : null;
        return new JsonTableReader(pool, input, false, readOptions, parseOptions, context, context != null);
    }

    /**
     * Create a reader for a stream that processes blocks on a shared context.
     * The context is not closed when the reader is closed.
     */
    public static JsonTableReader create(DriftwoodContext context, MemoryPool pool, InputStream input,
                                         ReadOptions readOptions, ParseOptions parseOptions) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        validate(pool, input, readOptions, parseOptions);
        return new JsonTableReader(pool, input, false, readOptions, parseOptions, context, false);
    }

    /**
     * Open a file with default options and an unbounded memory pool.
     */
    public static JsonTableReader open(Path path) throws IOException {
        return open(path, ReadOptions.defaults(), ParseOptions.defaults());
    }

    /**
     * Open a file. Unless {@code readOptions} names a compression, it is derived from the file
     * extension. The reader owns the file stream and closes it.
     */
    public static JsonTableReader open(Path path, ReadOptions readOptions, ParseOptions parseOptions) throws IOException {
        Objects.requireNonNull(path, "path");
        if (readOptions != null && readOptions.compression() == null) {
            readOptions = readOptions.withCompression(InputCompression.fromFileName(path.getFileName().toString()));
        }
        MemoryPool pool = MemoryPool.unbounded();
        InputStream input = Files.newInputStream(path);
        try {
            validate(pool, input, readOptions, parseOptions);
        }
        catch (IllegalArgumentException e) {
            input.close();
            throw e;
        }
        DriftwoodContext context = readOptions.useThreads() ? DriftwoodContext.create() : null;
        LOG.log(System.Logger.Level.DEBUG, "Opened ''{0}'' with compression {1}", path, readOptions.compression());
        return new JsonTableReader(pool, input, true, readOptions, parseOptions, context, context != null);
    }

    private static void validate(MemoryPool pool, InputStream input, ReadOptions readOptions, ParseOptions parseOptions) {
        if (pool == null) {
            throw new IllegalArgumentException("memory pool must not be null");
        }
        if (input == null) {
            throw new IllegalArgumentException("input stream must not be null");
        }
        if (readOptions == null) {
            throw new IllegalArgumentException("read options must not be null");
        }
        if (parseOptions == null) {
            throw new IllegalArgumentException("parse options must not be null");
        }
        if (readOptions.blockSize() <= 0) {
            throw new IllegalArgumentException("Block size must be positive: " + readOptions.blockSize());
        }
        if (parseOptions.unexpectedFieldBehavior() == null) {
            throw new IllegalArgumentException("unexpected field behavior must not be null");
        }
    }

    /**
     * Reads the whole input into a table. The table's storage stays reserved on the memory pool
     * until the table is closed.
     *
     * @throws IllegalStateException if this reader has already been read
     * @throws DriftwoodException if the input cannot be read, parsed, typed or converted,
     *         or if the memory pool's limit is exceeded
     */
    public synchronized Table read() throws DriftwoodException {
        if (consumed) {
            throw new IllegalStateException("This reader has already been read");
        }
        consumed = true;

        InputCompression compression = readOptions.compression() != null ? readOptions.compression() : InputCompression.NONE;
        InputStream decoded;
        try {
            decoded = DecompressorFactory.getDecompressor(compression).wrap(new BufferedInputStream(input));
        }
        catch (IOException e) {
            throw new StreamException("Failed to read " + compression + " stream header", e);
        }

        BlockProcessor processor = new BlockProcessor(parseOptions, pool);
        BlockScheduler scheduler = readOptions.useThreads() && context != null
                ? new ParallelBlockScheduler(processor, context.executor(), context.parallelism())
                : new SequentialBlockScheduler(processor);
        LOG.log(System.Logger.Level.DEBUG, "Reading with {0}, block size {1}",
                scheduler.getClass().getSimpleName(), readOptions.blockSize());

        List<BlockResult> results = scheduler.run(new BlockSegmenter(decoded, readOptions.blockSize()));

        MemoryAccount account = new MemoryAccount(pool);
        try {
            return TableAssembler.assemble(processor.initialDraft(), results, account);
        }
        catch (DriftwoodException | RuntimeException e) {
            for (BlockResult result : results) {
                result.account().releaseAll();
            }
            account.releaseAll();
            throw e;
        }
    }

    @Override
    public void close() {
        if (ownsContext) {
            context.close();
        }
        if (ownsInput) {
            try {
                input.close();
            }
            catch (IOException e) {
                LOG.log(System.Logger.Level.WARNING, "Failed to close input stream", e);
            }
        }
    }
}
