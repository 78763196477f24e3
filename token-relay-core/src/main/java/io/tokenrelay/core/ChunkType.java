package io.tokenrelay.core;

import java.util.Locale;

/**
 * Kind of data carried by a chunk.
 *
 * <p>Chunks that went through the transform pipeline are opaque blobs and are always
 * stored as {@link #CONTENT}.
 */
public enum ChunkType {
    CONTENT,
    METADATA,
    CONTROL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
