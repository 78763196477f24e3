package io.tokenrelay.server.core;

import io.tokenrelay.core.RelayException;
import io.tokenrelay.json.spi.JsonCodec;
import io.tokenrelay.server.core.buffer.BufferManager;
import io.tokenrelay.server.core.metrics.ConnectionMetrics;
import io.tokenrelay.server.core.metrics.MetricsAggregator;
import io.tokenrelay.server.core.metrics.RelayMetrics;
import io.tokenrelay.server.core.metrics.RelayStats;
import io.tokenrelay.server.core.registry.Connection;
import io.tokenrelay.server.core.registry.ConnectionRegistry;
import io.tokenrelay.server.core.transform.CompressionHistory;
import io.tokenrelay.server.core.transform.CompressionStrategy;
import io.tokenrelay.server.core.transform.Compressions;
import io.tokenrelay.server.core.transform.EncryptionStrategy;
import io.tokenrelay.server.core.transform.Encryptions;
import io.tokenrelay.server.core.transform.TransformPipeline;
import io.tokenrelay.server.spi.Chunk;
import io.tokenrelay.server.spi.ChunkBatch;
import io.tokenrelay.server.spi.ConnectionRecord;
import io.tokenrelay.server.spi.FragmentProducer;
import io.tokenrelay.server.spi.MetricsCache;
import io.tokenrelay.server.spi.RelayStore;
import io.tokenrelay.server.spi.StreamRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Entry point of the relay.
 *
 * <p>Use {@link #builder(RelayStore, FragmentProducer)} to create instances:
 * <pre>{@code
 * TokenRelay relay = TokenRelay.builder(store, producer)
 *     .config(RelayConfig.builder().maxConnections(200).build())
 *     .build();
 *
 * ConnectionRecord connection = relay.createConnection(request);
 * StreamHandle handle = relay.startStreamAsync(connection.id(), request);
 * EventChannel events = relay.events(connection.id());
 * }</pre>
 */
public final class TokenRelay implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TokenRelay.class);

    private final RelayStore store;
    private final RelayConfig config;
    private final RelayListeners listeners;
    private final CompressionHistory compressionHistory;
    private final TransformPipeline pipeline;
    private final BufferManager buffers;
    private final ConnectionRegistry registry;
    private final MetricsAggregator metrics;
    private final LifecycleTimers timers;
    private final StreamOrchestrator orchestrator;
    private final ExecutorService transformWorkers;
    private final ExecutorService streams;

    public static Builder builder(RelayStore store, FragmentProducer producer) {
        return new Builder(store, producer);
    }

    private TokenRelay(Builder builder) {
        this.store = builder.store;
        this.config = builder.config != null ? builder.config : RelayConfig.defaults();
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        JsonCodec json = builder.json != null ? builder.json : ServiceLoaderJsonCodecs.defaultCodec();
        MetricsCache cache = builder.metricsCache != null ? builder.metricsCache : new InMemoryMetricsCache(clock);

        this.listeners = new RelayListeners();
        this.compressionHistory = new CompressionHistory();
        CompressionStrategy compression = builder.compression != null
                ? builder.compression
                : Compressions.forName(config.compressionAlgorithm(), compressionHistory);
        EncryptionStrategy encryption = builder.encryption;
        if (encryption == null && config.encryptionEnabled()) {
            encryption = Encryptions.forName(config.encryptionAlgorithm(), config.keyRotationInterval(),
                    config.keyRetention(), clock);
        }

        this.transformWorkers = VirtualThreads.newBoundedExecutor("token-relay-transform", config.transformWorkers());
        this.streams = builder.streamExecutor != null ? builder.streamExecutor : VirtualThreads.newExecutor("token-relay-stream");
        this.pipeline = new TransformPipeline(compression, encryption, transformWorkers);
        this.buffers = new BufferManager(store, pipeline, clock);

        RelayStats stats = new RelayStats();
        this.registry = new ConnectionRegistry(store, buffers, config, clock, stats, listeners);
        this.metrics = new MetricsAggregator(registry, buffers, store, stats, clock);

        EventEmitter emitter = new EventEmitter(clock, listeners);
        ScheduledExecutorService scheduler =
                Executors.newSingleThreadScheduledExecutor(VirtualThreads.namedFactory("token-relay-timer"));
        this.timers = new LifecycleTimers(registry, buffers, emitter, metrics, cache, json, config, clock, scheduler,
                VirtualThreads.newBoundedExecutor("token-relay-flush", 1));
        this.orchestrator = new StreamOrchestrator(registry, buffers, builder.producer, emitter, timers, json,
                config, stats, listeners, clock, streams);

        if (builder.scheduleTimers) {
            timers.start();
        }
        log.info("Token relay started (max {} connections, buffer {} bytes, compression {}, encryption {})",
                config.maxConnections(), config.bufferSize(),
                config.compressionEnabled() ? compression.name() : "off",
                encryption != null ? encryption.algorithm() : "off");
    }

    /**
     * Admits a new connection in status {@code connecting}.
     *
     * @throws RelayException.CapacityExceeded when the connection ceiling is reached
     */
    public ConnectionRecord createConnection(StreamRequest request) {
        return registry.create(request).toRecord();
    }

    /**
     * Runs the stream on the calling thread. Upstream failures end in an {@code error} event,
     * never in an exception.
     */
    public void startStream(String connectionId, StreamRequest request) {
        orchestrator.startStream(connectionId, request);
    }

    public StreamHandle startStreamAsync(String connectionId, StreamRequest request) {
        return orchestrator.startStreamAsync(connectionId, request);
    }

    /**
     * Closes a connection after a final flush. Idempotent.
     *
     * @return false if it was not open
     */
    public boolean closeConnection(String connectionId) {
        return registry.close(connectionId);
    }

    public Optional<ConnectionRecord> getConnection(String connectionId) {
        return registry.lookup(connectionId);
    }

    /**
     * Event channel of an open connection. The channel closes when the connection does.
     *
     * @throws RelayException.ConnectionNotFound if the connection is not open
     */
    public EventChannel events(String connectionId) {
        return registry.require(connectionId).channel();
    }

    public ConnectionMetrics getMetrics(String connectionId, Instant from, Instant to) {
        return metrics.connectionMetrics(connectionId, from, to);
    }

    public RelayMetrics aggregateMetrics() {
        return metrics.aggregate();
    }

    /**
     * Stored chunks of a connection with {@code sequence >= fromSequence}, decoded, in sequence order.
     *
     * @throws RelayException.DecryptionError if a stored batch fails authentication
     */
    public List<Chunk> replay(String connectionId, long fromSequence) {
        List<ChunkBatch> stored;
        try {
            stored = store.findChunkBatches(connectionId);
        } catch (Exception e) {
            throw new RelayException.StoreFailure("Failed to load chunks of connection " + connectionId, e);
        }
        List<Chunk> out = new ArrayList<>();
        for (ChunkBatch batch : stored) {
            if (batch.lastSequence() < fromSequence) continue;
            for (Chunk chunk : pipeline.decode(batch)) {
                if (chunk.sequence() >= fromSequence) out.add(chunk);
            }
        }
        out.sort(Comparator.comparingLong(Chunk::sequence));
        return out;
    }

    public void addListener(RelayListener listener) {
        listeners.add(listener);
    }

    public void removeListener(RelayListener listener) {
        listeners.remove(listener);
    }

    public int openConnections() {
        return registry.openCount();
    }

    public CompressionHistory compressionHistory() {
        return compressionHistory;
    }

    public RelayConfig config() {
        return config;
    }

    LifecycleTimers timers() {
        return timers;
    }

    BufferManager buffers() {
        return buffers;
    }

    /**
     * Stops timers, closes every open connection (flushing its buffer) and shuts down worker threads.
     */
    @Override
    public void close() {
        timers.close();
        for (Connection connection : registry.snapshot()) {
            registry.close(connection.id());
        }
        streams.shutdownNow();
        transformWorkers.shutdown();
        try {
            if (!transformWorkers.awaitTermination(5, TimeUnit.SECONDS)) {
                transformWorkers.shutdownNow();
            }
        } catch (InterruptedException e) {
            transformWorkers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Token relay stopped");
    }

    /**
     * Builder for {@link TokenRelay}.
     */
    public static final class Builder {
        private final RelayStore store;
        private final FragmentProducer producer;
        private RelayConfig config;
        private MetricsCache metricsCache;
        private JsonCodec json;
        private Clock clock;
        private CompressionStrategy compression;
        private EncryptionStrategy encryption;
        private ExecutorService streamExecutor;
        private boolean scheduleTimers = true;

        private Builder(RelayStore store, FragmentProducer producer) {
            this.store = Objects.requireNonNull(store, "store");
            this.producer = Objects.requireNonNull(producer, "producer");
        }

        /** Sets the configuration. Default: {@link RelayConfig#defaults()}. */
        public Builder config(RelayConfig config) {
            this.config = config;
            return this;
        }

        /** Sets the metrics cache. Default: {@link InMemoryMetricsCache}. */
        public Builder metricsCache(MetricsCache metricsCache) {
            this.metricsCache = metricsCache;
            return this;
        }

        /** Sets the JSON codec. Default: the highest-priority codec found by ServiceLoader. */
        public Builder jsonCodec(JsonCodec json) {
            this.json = json;
            return this;
        }

        /** Sets the clock for time-based operations. Default: system UTC. */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /** Overrides the compression strategy chosen from the configuration. */
        public Builder compression(CompressionStrategy compression) {
            this.compression = compression;
            return this;
        }

        /**
         * Overrides the encryption strategy chosen from the configuration. Required to share
         * key material between relay instances reading the same store.
         */
        public Builder encryption(EncryptionStrategy encryption) {
            this.encryption = encryption;
            return this;
        }

        /** Sets the executor that runs asynchronous streams. Default: virtual threads when available. */
        public Builder streamExecutor(ExecutorService streamExecutor) {
            this.streamExecutor = streamExecutor;
            return this;
        }

        /**
         * Whether the periodic reaper, heartbeat, idle flush and metrics tasks are scheduled.
         * Default: true. Delayed closes after completion are scheduled either way.
         */
        public Builder scheduleTimers(boolean scheduleTimers) {
            this.scheduleTimers = scheduleTimers;
            return this;
        }

        public TokenRelay build() {
            return new TokenRelay(this);
        }
    }
}
