/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.reader;

import java.util.Locale;

/**
 * Compression applied to the whole input stream, decoded before the stream is split into blocks.
 */
public enum InputCompression {

    NONE(""),
    GZIP(".gz"),
    ZSTD(".zst"),
    SNAPPY(".sz"),
    LZ4(".lz4"),
    BROTLI(".br");

    private final String extension;

    InputCompression(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /**
     * Derives the compression from a file name such as {@code events.jsonl.zst}.
     * Names without a known extension map to {@link #NONE}.
     */
    public static InputCompression fromFileName(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (InputCompression compression : values()) {
            if (compression != NONE && lower.endsWith(compression.extension)) {
                return compression;
            }
        }
        if (lower.endsWith(".gzip")) {
            return GZIP;
        }
        if (lower.endsWith(".zstd")) {
            return ZSTD;
        }
        return NONE;
    }
}
