package io.tokenrelay.server.core.transform;

import io.tokenrelay.core.RelayException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Base for compressions built on output and input stream wrappers.
 */
abstract class StreamCompression implements CompressionStrategy {

    protected abstract OutputStream wrapOutputStream(OutputStream out) throws IOException;

    protected abstract InputStream wrapInputStream(InputStream in) throws IOException;

    @Override
    public final byte[] compress(byte[] input) {
        Objects.requireNonNull(input, "input");
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(32, input.length / 2));
        try (OutputStream out = wrapOutputStream(buffer)) {
            out.write(input);
        } catch (IOException e) {
            throw new RelayException.CompressionFailure(name() + " compression failed", e);
        }
        return buffer.toByteArray();
    }

    @Override
    public final byte[] decompress(byte[] input) {
        Objects.requireNonNull(input, "input");
        try (InputStream in = wrapInputStream(new ByteArrayInputStream(input))) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new RelayException.CompressionFailure(name() + " decompression failed", e);
        }
    }

    @Override
    public String toString() {
        return name();
    }
}
