package io.tokenrelay.server.core.buffer;

import io.tokenrelay.server.spi.BufferRecord;
import io.tokenrelay.server.spi.Chunk;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Un-flushed chunks of one connection. Guarded by its own lock, which also serializes
 * flushes of the connection.
 */
final class ConnectionBuffer {
    final String connectionId;
    final int maxSize;
    final int flushThreshold;
    final boolean compression;
    final boolean encryption;
    final ReentrantLock lock = new ReentrantLock();

    private final List<Chunk> chunks = new ArrayList<>();
    private long residentBytes;
    private Instant lastFlush;
    private boolean released;

    ConnectionBuffer(String connectionId, int maxSize, int flushThreshold, boolean compression, boolean encryption, Instant now) {
        this.connectionId = connectionId;
        this.maxSize = maxSize;
        this.flushThreshold = flushThreshold;
        this.compression = compression;
        this.encryption = encryption;
        this.lastFlush = now;
    }

    void add(Chunk chunk) {
        chunks.add(chunk);
        residentBytes += chunk.size();
    }

    boolean isEmpty() {
        return chunks.isEmpty();
    }

    int count() {
        return chunks.size();
    }

    long bytes() {
        return residentBytes;
    }

    boolean wouldOverflow(Chunk next) {
        return !chunks.isEmpty() && residentBytes + next.size() > maxSize;
    }

    boolean thresholdReached() {
        return chunks.size() >= flushThreshold || residentBytes >= flushThreshold;
    }

    List<Chunk> chunks() {
        return List.copyOf(chunks);
    }

    void cleared(Instant at) {
        chunks.clear();
        residentBytes = 0;
        lastFlush = at;
    }

    /** Set under {@link #lock} once the connection is closed; later appends are rejected. */
    void markReleased() {
        released = true;
    }

    boolean isReleased() {
        return released;
    }

    Instant lastFlush() {
        return lastFlush;
    }

    BufferRecord toRecord() {
        return new BufferRecord(connectionId, chunks.size(), residentBytes, maxSize, flushThreshold, lastFlush, compression);
    }
}
