package io.tokenrelay.server.spi;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted view of a connection's buffer: capacity settings plus current occupancy.
 */
public record BufferRecord(
        String connectionId,
        int residentChunks,
        long residentBytes,
        int maxSize,
        int flushThreshold,
        Instant lastFlush,
        boolean compressionEnabled
) {
    public BufferRecord {
        Objects.requireNonNull(connectionId, "connectionId");
        Objects.requireNonNull(lastFlush, "lastFlush");
    }
}
