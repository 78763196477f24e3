package io.tokenrelay.server.spi;

import io.tokenrelay.core.ChunkType;

import java.time.Instant;
import java.util.Objects;

/**
 * One ordered unit of streamed data belonging to a connection.
 *
 * <p>Chunks are immutable. The transform pipeline produces new instances through
 * {@link #withPayload(byte[])}; the original checksum is kept so readers can verify the
 * decoded payload.
 *
 * @param id random chunk id
 * @param connectionId owning connection
 * @param sequence gap-free, strictly increasing per connection, starting at 0
 * @param type content kind
 * @param payload opaque bytes
 * @param timestamp creation time
 * @param size length of the original, untransformed payload in bytes
 * @param checksum optional hex SHA-256 of the untransformed payload
 */
public record Chunk(
        String id,
        String connectionId,
        long sequence,
        ChunkType type,
        byte[] payload,
        Instant timestamp,
        int size,
        String checksum
) {
    public Chunk {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(connectionId, "connectionId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(timestamp, "timestamp");
        if (sequence < 0) throw new IllegalArgumentException("sequence must not be negative");
    }

    /**
     * Copy with a transformed payload. Transformed chunks are opaque and always typed as content;
     * size and checksum still describe the original payload.
     */
    public Chunk withPayload(byte[] transformed) {
        return new Chunk(id, connectionId, sequence, ChunkType.CONTENT, transformed, timestamp, size, checksum);
    }
}
