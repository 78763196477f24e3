package io.tokenrelay.server.core.transform;

import java.util.Locale;

/**
 * Lookup of compression strategies by configured or recorded name.
 */
public final class Compressions {
    private Compressions() {
    }

    /**
     * Strategy for a configuration value.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static CompressionStrategy forName(String name, CompressionHistory history) {
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case GzipCompression.NAME:
                return GzipCompression.INSTANCE;
            case DeflateCompression.NAME:
                return DeflateCompression.INSTANCE;
            case BrotliCompression.NAME:
                return BrotliCompression.INSTANCE;
            case AdaptiveCompression.NAME:
                return new AdaptiveCompression(history);
            case IdentityCompression.NAME:
                return IdentityCompression.INSTANCE;
            default:
                throw new IllegalArgumentException("Unknown compression algorithm: " + name);
        }
    }

    /**
     * Strategy that decodes a stored batch. Names this version does not know fall back to
     * detection by magic bytes.
     */
    public static CompressionStrategy forRecordedName(String name, byte[] payload) {
        if (name == null) return detect(payload);
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case GzipCompression.NAME:
                return GzipCompression.INSTANCE;
            case DeflateCompression.NAME:
                return DeflateCompression.INSTANCE;
            case BrotliCompression.NAME:
                return BrotliCompression.INSTANCE;
            case IdentityCompression.NAME:
                return IdentityCompression.INSTANCE;
            default:
                return detect(payload);
        }
    }

    /** Detects gzip ({@code 1f 8b}) or zlib headers; anything else is treated as uncompressed. */
    public static CompressionStrategy detect(byte[] payload) {
        if (GzipCompression.looksLike(payload)) return GzipCompression.INSTANCE;
        if (DeflateCompression.looksLike(payload)) return DeflateCompression.INSTANCE;
        return IdentityCompression.INSTANCE;
    }
}
