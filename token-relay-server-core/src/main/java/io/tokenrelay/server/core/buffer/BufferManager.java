package io.tokenrelay.server.core.buffer;

import io.tokenrelay.core.RelayException;
import io.tokenrelay.server.core.Ids;
import io.tokenrelay.server.core.transform.TransformPipeline;
import io.tokenrelay.server.spi.BufferRecord;
import io.tokenrelay.server.spi.Chunk;
import io.tokenrelay.server.spi.ChunkBatch;
import io.tokenrelay.server.spi.ConnectionOptions;
import io.tokenrelay.server.spi.RelayStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns one buffer per open connection and moves chunks to the {@link RelayStore}.
 *
 * <p>A buffer is flushed before an append that would exceed its capacity, after an append
 * that reaches the flush threshold (by count or bytes), when it has been idle for the flush
 * interval, and when the connection closes. A failed flush is logged and leaves the chunks
 * in place for the next attempt.
 */
public final class BufferManager {
    private static final Logger log = LoggerFactory.getLogger(BufferManager.class);

    private final Map<String, ConnectionBuffer> buffers = new ConcurrentHashMap<>();
    private final RelayStore store;
    private final TransformPipeline pipeline;
    private final Clock clock;

    public BufferManager(RelayStore store, TransformPipeline pipeline, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates the buffer for a new connection and persists its initial state.
     */
    public BufferRecord open(String connectionId, ConnectionOptions options, int flushThreshold) throws Exception {
        ConnectionBuffer buffer = new ConnectionBuffer(connectionId, options.bufferSize(), flushThreshold,
                options.compression(), options.encryption(), clock.instant());
        if (buffers.putIfAbsent(connectionId, buffer) != null) {
            throw new IllegalStateException("Buffer already exists for connection " + connectionId);
        }
        BufferRecord record = buffer.toRecord();
        try {
            store.saveBuffer(record);
        } catch (Exception e) {
            buffers.remove(connectionId, buffer);
            throw e;
        }
        return record;
    }

    /**
     * Appends a chunk, flushing first if it would not fit and afterwards if the threshold is reached.
     *
     * @throws RelayException.ConnectionNotFound if the connection has no buffer
     */
    public void append(String connectionId, Chunk chunk) {
        Objects.requireNonNull(chunk, "chunk");
        ConnectionBuffer buffer = require(connectionId);
        buffer.lock.lock();
        try {
            if (buffer.isReleased()) throw new RelayException.ConnectionNotFound(connectionId);
            if (buffer.wouldOverflow(chunk) && !flushLocked(buffer)) {
                log.warn("Buffer for {} is over capacity ({} + {} > {} bytes) while the store rejects writes",
                        connectionId, buffer.bytes(), chunk.size(), buffer.maxSize);
            }
            buffer.add(chunk);
            if (buffer.thresholdReached()) {
                flushLocked(buffer);
            }
        } finally {
            buffer.lock.unlock();
        }
    }

    /**
     * Flushes resident chunks. No-op when empty.
     *
     * @return false if the flush failed and the chunks are still resident
     */
    public boolean flush(String connectionId) {
        ConnectionBuffer buffer = buffers.get(connectionId);
        if (buffer == null) return true;
        buffer.lock.lock();
        try {
            return flushLocked(buffer);
        } finally {
            buffer.lock.unlock();
        }
    }

    /**
     * Flushes a non-empty buffer whose last flush is at least {@code interval} ago.
     */
    public boolean flushIfIdle(String connectionId, Duration interval) {
        ConnectionBuffer buffer = buffers.get(connectionId);
        if (buffer == null) return true;
        buffer.lock.lock();
        try {
            if (buffer.isEmpty()) return true;
            if (Duration.between(buffer.lastFlush(), clock.instant()).compareTo(interval) < 0) return true;
            return flushLocked(buffer);
        } finally {
            buffer.lock.unlock();
        }
    }

    /**
     * Final flush and removal of a connection's buffer.
     */
    public void release(String connectionId) {
        ConnectionBuffer buffer = buffers.get(connectionId);
        if (buffer == null) return;
        buffer.lock.lock();
        try {
            if (buffer.isReleased()) return;
            if (!flushLocked(buffer)) {
                log.warn("Discarding {} unflushed chunks of closed connection {}", buffer.count(), connectionId);
            }
            buffer.markReleased();
            buffers.remove(connectionId, buffer);
        } finally {
            buffer.lock.unlock();
        }
    }

    /** Chunks not yet flushed, in sequence order. */
    public List<Chunk> resident(String connectionId) {
        ConnectionBuffer buffer = buffers.get(connectionId);
        if (buffer == null) return List.of();
        buffer.lock.lock();
        try {
            return buffer.chunks();
        } finally {
            buffer.lock.unlock();
        }
    }

    public Optional<BufferRecord> snapshot(String connectionId) {
        ConnectionBuffer buffer = buffers.get(connectionId);
        if (buffer == null) return Optional.empty();
        buffer.lock.lock();
        try {
            return Optional.of(buffer.toRecord());
        } finally {
            buffer.lock.unlock();
        }
    }

    public int size() {
        return buffers.size();
    }

    private ConnectionBuffer require(String connectionId) {
        ConnectionBuffer buffer = buffers.get(connectionId);
        if (buffer == null) throw new RelayException.ConnectionNotFound(connectionId);
        return buffer;
    }

    private boolean flushLocked(ConnectionBuffer buffer) {
        if (buffer.isEmpty() || buffer.isReleased()) return true;
        List<Chunk> chunks = buffer.chunks();
        Instant now = clock.instant();
        TransformPipeline.Encoded encoded;
        try {
            encoded = pipeline.encode(chunks, buffer.compression, buffer.encryption);
            store.saveChunkBatch(new ChunkBatch(Ids.batchId(), buffer.connectionId, encoded.chunks(),
                    encoded.compression(), encoded.encryption(), encoded.keyEpoch(), now));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Flush interrupted for connection {}; {} chunks kept", buffer.connectionId, chunks.size());
            return false;
        } catch (Exception e) {
            RelayException failure = new RelayException.FlushFailure(buffer.connectionId, e);
            log.warn("{}; {} chunks kept for retry", failure.getMessage(), chunks.size(), e);
            return false;
        }
        buffer.cleared(now);
        try {
            store.updateBuffer(buffer.toRecord());
        } catch (Exception e) {
            log.warn("Failed to persist buffer state for connection {}", buffer.connectionId, e);
        }
        log.debug("Flushed {} chunks ({}) for connection {}", chunks.size(), encoded.compression(), buffer.connectionId);
        return true;
    }
}
