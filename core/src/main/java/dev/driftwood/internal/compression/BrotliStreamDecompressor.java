/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.compression;

import java.io.IOException;
import java.io.InputStream;

import com.aayushatharva.brotli4j.Brotli4jLoader;
import com.aayushatharva.brotli4j.decoder.BrotliInputStream;

/**
 * Decompressor for Brotli streams using brotli4j.
 */
public class BrotliStreamDecompressor implements StreamDecompressor {

    private static volatile boolean initialized = false;

    private static synchronized void ensureInitialized() throws IOException {
        if (!initialized) {
            try {
                Brotli4jLoader.ensureAvailability();
                initialized = true;
            }
            catch (UnsatisfiedLinkError e) {
                throw new IOException("Failed to load Brotli native library: " + e.getMessage(), e);
            }
        }
    }

    /**
     * Whether the native Brotli library can be loaded on this platform.
     */
    public static boolean isAvailable() {
        try {
            ensureInitialized();
            return true;
        }
        catch (IOException | LinkageError e) {
            return false;
        }
    }

    @Override
    public InputStream wrap(InputStream compressed) throws IOException {
        ensureInitialized();
        return new BrotliInputStream(compressed);
    }

    @Override
    public String getName() {
        return "BROTLI";
    }
}
