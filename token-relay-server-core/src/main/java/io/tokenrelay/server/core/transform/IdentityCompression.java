package io.tokenrelay.server.core.transform;

/**
 * Pass-through used for uncompressed batches.
 */
public final class IdentityCompression implements CompressionStrategy {
    public static final String NAME = "identity";
    public static final IdentityCompression INSTANCE = new IdentityCompression();

    private IdentityCompression() {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public byte[] compress(byte[] input) {
        return input;
    }

    @Override
    public byte[] decompress(byte[] input) {
        return input;
    }
}
