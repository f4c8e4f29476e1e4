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

import com.github.luben.zstd.ZstdInputStream;

/**
 * Decompressor for ZSTD frames using zstd-jni.
 */
public class ZstdStreamDecompressor implements StreamDecompressor {

    @Override
    public InputStream wrap(InputStream compressed) throws IOException {
        return new ZstdInputStream(compressed);
    }

    @Override
    public String getName() {
        return "ZSTD";
    }
}
