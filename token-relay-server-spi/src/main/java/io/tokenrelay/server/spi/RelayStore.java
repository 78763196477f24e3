package io.tokenrelay.server.spi;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for connections, flushed chunk batches and buffer state.
 *
 * <p>This SPI is intentionally minimal and blocking. The relay calls it from its own worker
 * threads; implementations must be safe for concurrent use by different connections.
 */
public interface RelayStore {

    /** Insert a newly created connection. */
    void saveConnection(ConnectionRecord connection) throws Exception;

    /** Replace the stored state of an existing connection. */
    void updateConnection(ConnectionRecord connection) throws Exception;

    Optional<ConnectionRecord> findConnection(String connectionId) throws Exception;

    /**
     * Persist one flushed batch. A failure leaves the batch un-persisted; the caller keeps the
     * chunks resident and retries on the next flush.
     */
    void saveChunkBatch(ChunkBatch batch) throws Exception;

    /**
     * All batches for a connection in flush order.
     */
    List<ChunkBatch> findChunkBatches(String connectionId) throws Exception;

    void saveBuffer(BufferRecord buffer) throws Exception;

    void updateBuffer(BufferRecord buffer) throws Exception;
}
