package io.tokenrelay.server.core.transform;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.zip.Deflater;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.InflaterInputStream;

/**
 * Deflate in the zlib container (RFC 1950).
 */
public final class DeflateCompression extends StreamCompression {
    public static final String NAME = "deflate";
    public static final DeflateCompression INSTANCE = new DeflateCompression();

    private DeflateCompression() {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected OutputStream wrapOutputStream(OutputStream out) {
        // closing the stream ends the deflater it owns
        return new DeflaterOutputStream(out, new Deflater(Deflater.DEFAULT_COMPRESSION), true) {
            @Override
            public void close() throws IOException {
                try {
                    super.close();
                } finally {
                    def.end();
                }
            }
        };
    }

    @Override
    protected InputStream wrapInputStream(InputStream in) {
        return new InflaterInputStream(in);
    }

    /** zlib header: CM = 8 and (CMF * 256 + FLG) divisible by 31. */
    static boolean looksLike(byte[] data) {
        if (data.length < 2) return false;
        int cmf = data[0] & 0xff;
        int flg = data[1] & 0xff;
        return (cmf & 0x0f) == 8 && ((cmf << 8) | flg) % 31 == 0;
    }
}
