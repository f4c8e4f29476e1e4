/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.compression;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;

import dev.driftwood.reader.InputCompression;

/**
 * Factory for creating stream decompressors based on the input's compression.
 * <p>
 * Codec libraries other than GZIP are optional dependencies; selecting a codec whose library is
 * missing fails with a message naming the dependency to add.
 * </p>
 */
public final class DecompressorFactory {

    private static final Logger LOG = System.getLogger(DecompressorFactory.class.getName());

    private DecompressorFactory() {
    }

    /**
     * Get a decompressor for the given compression.
     *
     * @throws UnsupportedOperationException if the required library is missing
     */
    public static StreamDecompressor getDecompressor(InputCompression compression) {
        StreamDecompressor decompressor = switch (compression) {
            case NONE -> new UncompressedStreamDecompressor();
            case GZIP -> new GzipStreamDecompressor();
            case ZSTD -> {
                checkClassAvailable("com.github.luben.zstd.ZstdInputStream",
                        "ZSTD",
                        "com.github.luben:zstd-jni");
                yield new ZstdStreamDecompressor();
            }
            case SNAPPY -> {
                checkClassAvailable("org.xerial.snappy.SnappyFramedInputStream",
                        "SNAPPY",
                        "org.xerial.snappy:snappy-java");
                yield new SnappyStreamDecompressor();
            }
            case LZ4 -> {
                checkClassAvailable("net.jpountz.lz4.LZ4FrameInputStream",
                        "LZ4",
                        "org.lz4:lz4-java");
                yield new Lz4StreamDecompressor();
            }
            case BROTLI -> {
                checkClassAvailable("com.aayushatharva.brotli4j.Brotli4jLoader",
                        "BROTLI",
                        "com.aayushatharva.brotli4j:brotli4j");
                yield new BrotliStreamDecompressor();
            }
        };
        LOG.log(Level.DEBUG, "Using {0} decompressor", decompressor.getName());
        return decompressor;
    }

    private static void checkClassAvailable(String className, String codecName, String dependency) {
        try {
            Class.forName(className, false, DecompressorFactory.class.getClassLoader());
        }
        catch (ClassNotFoundException e) {
            throw new UnsupportedOperationException(
                    "Cannot read " + codecName + "-compressed input: required library not found. " +
                            "Add the following dependency to your project: " + dependency);
        }
    }
}
