package io.tokenrelay.server.core;

import io.tokenrelay.server.spi.BufferRecord;
import io.tokenrelay.server.spi.ChunkBatch;
import io.tokenrelay.server.spi.ConnectionRecord;
import io.tokenrelay.server.spi.RelayStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Reference in-memory {@link RelayStore}.
 *
 * <p>Good for unit tests and single-process use. Not intended for production.
 */
public final class InMemoryRelayStore implements RelayStore {

    private final Map<String, ConnectionRecord> connections = new ConcurrentHashMap<>();
    private final Map<String, List<ChunkBatch>> batches = new ConcurrentHashMap<>();
    private final Map<String, BufferRecord> buffers = new ConcurrentHashMap<>();

    @Override
    public void saveConnection(ConnectionRecord connection) {
        Objects.requireNonNull(connection, "connection");
        if (connections.putIfAbsent(connection.id(), connection) != null) {
            throw new IllegalStateException("Connection " + connection.id() + " already stored");
        }
    }

    @Override
    public void updateConnection(ConnectionRecord connection) {
        Objects.requireNonNull(connection, "connection");
        connections.put(connection.id(), connection);
    }

    @Override
    public Optional<ConnectionRecord> findConnection(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    @Override
    public void saveChunkBatch(ChunkBatch batch) {
        Objects.requireNonNull(batch, "batch");
        batches.computeIfAbsent(batch.connectionId(), k -> new CopyOnWriteArrayList<>()).add(batch);
    }

    @Override
    public List<ChunkBatch> findChunkBatches(String connectionId) {
        List<ChunkBatch> stored = batches.get(connectionId);
        return stored == null ? List.of() : new ArrayList<>(stored);
    }

    @Override
    public void saveBuffer(BufferRecord buffer) {
        Objects.requireNonNull(buffer, "buffer");
        buffers.put(buffer.connectionId(), buffer);
    }

    @Override
    public void updateBuffer(BufferRecord buffer) {
        Objects.requireNonNull(buffer, "buffer");
        buffers.put(buffer.connectionId(), buffer);
    }

    public Optional<BufferRecord> findBuffer(String connectionId) {
        return Optional.ofNullable(buffers.get(connectionId));
    }
}
