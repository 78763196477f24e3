package io.tokenrelay.server.core.registry;

import io.tokenrelay.core.RelayException;
import io.tokenrelay.server.core.Ids;
import io.tokenrelay.server.core.RelayConfig;
import io.tokenrelay.server.core.RelayListeners;
import io.tokenrelay.server.core.buffer.BufferManager;
import io.tokenrelay.server.core.metrics.RelayStats;
import io.tokenrelay.server.spi.ConnectionOptions;
import io.tokenrelay.server.spi.ConnectionRecord;
import io.tokenrelay.server.spi.RelayStore;
import io.tokenrelay.server.spi.StreamRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Table of open connections with admission control.
 *
 * <p>The table and the open-connection count change together under one lock, so the count
 * never exceeds {@link RelayConfig#maxConnections()}. A slot is reserved before the connection
 * is persisted and released again if persisting fails.
 */
public final class ConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final RelayStore store;
    private final BufferManager buffers;
    private final RelayConfig config;
    private final Clock clock;
    private final RelayStats stats;
    private final RelayListeners listeners;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Connection> table = new HashMap<>();
    private int active;

    public ConnectionRegistry(RelayStore store, BufferManager buffers, RelayConfig config, Clock clock,
                              RelayStats stats, RelayListeners listeners) {
        this.store = Objects.requireNonNull(store, "store");
        this.buffers = Objects.requireNonNull(buffers, "buffers");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.listeners = Objects.requireNonNull(listeners, "listeners");
    }

    /**
     * Admits a new connection in status CONNECTING and persists it together with its buffer.
     *
     * @throws RelayException.CapacityExceeded when the ceiling is reached
     * @throws RelayException.StoreFailure when the store rejects the new connection
     */
    public Connection create(StreamRequest request) {
        Objects.requireNonNull(request, "request");
        lock.lock();
        try {
            if (active >= config.maxConnections()) {
                log.warn("Rejecting connection for client {}: {} connections open", request.clientId(), active);
                throw new RelayException.CapacityExceeded(config.maxConnections());
            }
            active++;
        } finally {
            lock.unlock();
        }

        Instant now = clock.instant();
        ConnectionOptions options = new ConnectionOptions(
                Math.min(request.bufferSize().orElse(config.bufferSize()), config.bufferSize()),
                request.flushInterval().orElse(config.flushInterval()),
                config.compressionEnabled(),
                config.encryptionEnabled(),
                config.heartbeatInterval());
        Connection connection = new Connection(Ids.connectionId(), request.clientId(),
                request.userId().orElse(null), request.sessionId().orElse(null), request.id(),
                request.provider(), request.model(), options, now);

        try {
            store.saveConnection(connection.toRecord());
            buffers.open(connection.id(), options, config.flushThreshold(options.bufferSize()));
        } catch (Exception e) {
            releaseSlot();
            throw new RelayException.StoreFailure("Failed to persist connection " + connection.id(), e);
        }

        lock.lock();
        try {
            table.put(connection.id(), connection);
        } finally {
            lock.unlock();
        }
        stats.connectionCreated(request.id());
        ConnectionRecord record = connection.toRecord();
        listeners.fire(l -> l.connectionCreated(record));
        log.info("Created connection {} for client {} ({}/{})", connection.id(), request.clientId(),
                request.provider(), request.model());
        return connection;
    }

    public Optional<Connection> find(String connectionId) {
        lock.lock();
        try {
            return Optional.ofNullable(table.get(connectionId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws RelayException.ConnectionNotFound if the connection is not open
     */
    public Connection require(String connectionId) {
        return find(connectionId).orElseThrow(() -> new RelayException.ConnectionNotFound(connectionId));
    }

    /**
     * Open connection snapshot, or the stored record of a closed one.
     */
    public Optional<ConnectionRecord> lookup(String connectionId) {
        Optional<Connection> open = find(connectionId);
        if (open.isPresent()) {
            return Optional.of(open.get().toRecord());
        }
        try {
            return store.findConnection(connectionId);
        } catch (Exception e) {
            throw new RelayException.StoreFailure("Failed to load connection " + connectionId, e);
        }
    }

    /**
     * Closes a connection: final buffer flush, status DISCONNECTED, slot released.
     * Idempotent.
     *
     * @return false if the connection was not open
     */
    public boolean close(String connectionId) {
        Connection connection;
        lock.lock();
        try {
            connection = table.remove(connectionId);
            if (connection == null) return false;
            active--;
        } finally {
            lock.unlock();
        }

        buffers.release(connectionId);
        connection.disconnect(clock.instant());
        persist(connection);
        connection.channel().close();
        stats.connectionClosed();
        listeners.fire(l -> l.connectionClosed(connectionId));
        log.info("Closed connection {}", connectionId);
        return true;
    }

    /**
     * Writes the connection's current state. Failures are logged; the live state stays authoritative.
     */
    public void persist(Connection connection) {
        try {
            store.updateConnection(connection.toRecord());
        } catch (Exception e) {
            log.warn("Failed to persist state of connection {}", connection.id(), e);
        }
    }

    /** Open connections at this instant. */
    public List<Connection> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(table.values());
        } finally {
            lock.unlock();
        }
    }

    public int openCount() {
        lock.lock();
        try {
            return active;
        } finally {
            lock.unlock();
        }
    }

    private void releaseSlot() {
        lock.lock();
        try {
            active--;
        } finally {
            lock.unlock();
        }
    }
}
