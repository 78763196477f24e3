package io.tokenrelay.server.core.transform;

import com.aayushatharva.brotli4j.Brotli4jLoader;
import com.aayushatharva.brotli4j.decoder.BrotliInputStream;
import com.aayushatharva.brotli4j.encoder.BrotliOutputStream;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * RFC 7932 brotli through the brotli4j native bindings.
 *
 * <p>Brotli streams carry no magic bytes, so stored batches are only decoded as brotli when
 * the batch records the name.
 */
public final class BrotliCompression extends StreamCompression {
    public static final String NAME = "brotli";
    public static final BrotliCompression INSTANCE = new BrotliCompression();

    private BrotliCompression() {
    }

    /** Whether the native library loaded on this platform. */
    public static boolean isAvailable() {
        return Brotli4jLoader.isAvailable();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected OutputStream wrapOutputStream(OutputStream out) throws IOException {
        requireNative();
        return new BrotliOutputStream(out);
    }

    @Override
    protected InputStream wrapInputStream(InputStream in) throws IOException {
        requireNative();
        return new BrotliInputStream(in);
    }

    private static void requireNative() throws IOException {
        if (!isAvailable()) {
            throw new IOException("brotli native library is not available", Brotli4jLoader.getUnavailabilityCause());
        }
    }
}
