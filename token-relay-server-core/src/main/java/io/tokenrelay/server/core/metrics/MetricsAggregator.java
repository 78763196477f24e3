package io.tokenrelay.server.core.metrics;

import io.tokenrelay.core.ConnectionStatus;
import io.tokenrelay.core.RelayException;
import io.tokenrelay.server.core.buffer.BufferManager;
import io.tokenrelay.server.core.registry.Connection;
import io.tokenrelay.server.core.registry.ConnectionRegistry;
import io.tokenrelay.server.spi.ActivitySnapshot;
import io.tokenrelay.server.spi.Chunk;
import io.tokenrelay.server.spi.ChunkBatch;
import io.tokenrelay.server.spi.ConnectionRecord;
import io.tokenrelay.server.spi.RelayStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Computes {@link ConnectionMetrics} from stored and resident chunks and {@link RelayMetrics}
 * from the open connections.
 */
public final class MetricsAggregator {

    private final ConnectionRegistry registry;
    private final BufferManager buffers;
    private final RelayStore store;
    private final RelayStats stats;
    private final Clock clock;

    public MetricsAggregator(ConnectionRegistry registry, BufferManager buffers, RelayStore store,
                             RelayStats stats, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.buffers = Objects.requireNonNull(buffers, "buffers");
        this.store = Objects.requireNonNull(store, "store");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @throws RelayException.ConnectionNotFound if the connection is neither open nor stored
     */
    public ConnectionMetrics connectionMetrics(String connectionId, Instant from, Instant to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (to.isBefore(from)) throw new IllegalArgumentException("to must not be before from");

        ConnectionRecord record = registry.lookup(connectionId)
                .orElseThrow(() -> new RelayException.ConnectionNotFound(connectionId));

        List<Chunk> chunks = new ArrayList<>();
        try {
            for (ChunkBatch batch : store.findChunkBatches(connectionId)) {
                chunks.addAll(batch.chunks());
            }
        } catch (Exception e) {
            throw new RelayException.StoreFailure("Failed to load chunks of connection " + connectionId, e);
        }
        chunks.addAll(buffers.resident(connectionId));
        chunks.removeIf(c -> c.timestamp().isBefore(from) || c.timestamp().isAfter(to));
        chunks.sort(Comparator.comparingLong(Chunk::sequence));

        long totalBytes = 0;
        List<Double> gaps = new ArrayList<>();
        Instant previous = null;
        for (Chunk chunk : chunks) {
            totalBytes += chunk.size();
            if (previous != null) {
                gaps.add(Duration.between(previous, chunk.timestamp()).toNanos() / 1_000_000.0);
            }
            previous = chunk.timestamp();
        }
        long count = chunks.size();
        double seconds = Duration.between(from, to).toMillis() / 1000.0;
        return new ConnectionMetrics(connectionId, from, to, record.status(), count, totalBytes,
                count == 0 ? 0.0 : (double) totalBytes / count,
                seconds <= 0 ? 0.0 : count / seconds,
                seconds <= 0 ? 0.0 : totalBytes / seconds,
                LatencyStats.of(gaps),
                record.activity().averageLatencyMillis());
    }

    public RelayMetrics aggregate() {
        List<Connection> open = registry.snapshot();
        int streaming = 0;
        double latencySum = 0;
        long bytes = 0;
        for (Connection connection : open) {
            if (connection.status() == ConnectionStatus.STREAMING) streaming++;
            ActivitySnapshot activity = connection.activity();
            latencySum += activity.averageLatencyMillis();
            bytes += activity.bytesReceived();
        }
        return new RelayMetrics(open.size(), streaming,
                open.isEmpty() ? 0.0 : latencySum / open.size(),
                stats.errorRate(), stats.completionRate(), stats.reconnectionRate(),
                bytes, clock.instant());
    }

    public RelayStats stats() {
        return stats;
    }
}
