package io.tokenrelay.server.core.transform;

import io.tokenrelay.core.RelayException;

/**
 * Lossless byte compression.
 *
 * <p>Implementations are stateless and thread-safe. Failures are reported as
 * {@link RelayException.CompressionFailure}.
 */
public interface CompressionStrategy {

    /**
     * Algorithm name recorded with each stored batch ({@code gzip}, {@code deflate}, ...).
     */
    String name();

    byte[] compress(byte[] input);

    byte[] decompress(byte[] input);

    /**
     * The concrete strategy to use for a payload that looks like {@code sample}. Fixed
     * strategies return themselves; {@link AdaptiveCompression} picks one by size and ratio.
     */
    default CompressionStrategy resolve(byte[] sample) {
        return this;
    }
}
