package io.tokenrelay.server.core.transform;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * RFC 1952 gzip.
 */
public final class GzipCompression extends StreamCompression {
    public static final String NAME = "gzip";
    public static final GzipCompression INSTANCE = new GzipCompression();

    private GzipCompression() {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected OutputStream wrapOutputStream(OutputStream out) throws IOException {
        return new GZIPOutputStream(out);
    }

    @Override
    protected InputStream wrapInputStream(InputStream in) throws IOException {
        return new GZIPInputStream(in);
    }

    static boolean looksLike(byte[] data) {
        return data.length >= 2 && (data[0] & 0xff) == 0x1f && (data[1] & 0xff) == 0x8b;
    }
}
