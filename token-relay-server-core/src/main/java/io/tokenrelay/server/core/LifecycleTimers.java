package io.tokenrelay.server.core;

import io.tokenrelay.core.ConnectionStatus;
import io.tokenrelay.core.EventType;
import io.tokenrelay.core.Protocol;
import io.tokenrelay.json.spi.JsonCodec;
import io.tokenrelay.server.core.buffer.BufferManager;
import io.tokenrelay.server.core.metrics.MetricsAggregator;
import io.tokenrelay.server.core.metrics.RelayMetrics;
import io.tokenrelay.server.core.registry.Connection;
import io.tokenrelay.server.core.registry.ConnectionRegistry;
import io.tokenrelay.server.spi.ActivitySnapshot;
import io.tokenrelay.server.spi.MetricsCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic relay maintenance: idle reaping, heartbeats, idle buffer flushes and metrics
 * publication, plus delayed closes after a stream finishes.
 *
 * <p>Each task catches and logs its own failures so that one failing run never cancels the
 * schedule. Idle flushes write to the store, so they run on a separate flush executor and at
 * most one flush pass is in flight; the timer thread itself never blocks on the store.
 */
public final class LifecycleTimers implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LifecycleTimers.class);

    private final ConnectionRegistry registry;
    private final BufferManager buffers;
    private final EventEmitter emitter;
    private final MetricsAggregator metrics;
    private final MetricsCache cache;
    private final JsonCodec json;
    private final RelayConfig config;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService flusher;
    private final AtomicBoolean flushing = new AtomicBoolean();

    LifecycleTimers(ConnectionRegistry registry, BufferManager buffers, EventEmitter emitter,
                    MetricsAggregator metrics, MetricsCache cache, JsonCodec json, RelayConfig config,
                    Clock clock, ScheduledExecutorService scheduler, ExecutorService flusher) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.buffers = Objects.requireNonNull(buffers, "buffers");
        this.emitter = Objects.requireNonNull(emitter, "emitter");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.json = Objects.requireNonNull(json, "json");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.flusher = Objects.requireNonNull(flusher, "flusher");
    }

    void start() {
        repeat("idle-reaper", config.cleanupInterval(), this::reapIdle);
        repeat("heartbeat", config.heartbeatInterval(), this::sendHeartbeats);
        repeat("idle-flush", config.flushInterval(), this::dispatchIdleFlush);
        repeat("metrics", config.metricsInterval(), this::publishMetrics);
        log.debug("Lifecycle timers started (cleanup {}, heartbeat {}, flush {}, metrics {})",
                config.cleanupInterval(), config.heartbeatInterval(), config.flushInterval(), config.metricsInterval());
    }

    /**
     * Closes {@code connectionId} after {@code delay}.
     */
    void scheduleClose(String connectionId, Duration delay) {
        scheduler.schedule(guarded("close " + connectionId, () -> registry.close(connectionId)),
                delay.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Closes connections idle for longer than the connection timeout.
     *
     * @return number of connections closed
     */
    int reapIdle() {
        Instant now = clock.instant();
        int reaped = 0;
        for (Connection connection : registry.snapshot()) {
            Duration idle = Duration.between(connection.lastActivity(), now);
            if (idle.compareTo(config.connectionTimeout()) > 0 && registry.close(connection.id())) {
                log.info("Reaped idle connection {} (idle {})", connection.id(), idle);
                reaped++;
            }
        }
        return reaped;
    }

    /**
     * Sends a heartbeat to every streaming connection.
     *
     * @return number of heartbeats sent
     */
    int sendHeartbeats() {
        int sent = 0;
        for (Connection connection : registry.snapshot()) {
            if (connection.status() != ConnectionStatus.STREAMING) continue;
            ActivitySnapshot activity = connection.activity();
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("connectionId", connection.id());
            data.put("timestamp", clock.instant().toString());
            data.put("chunksReceived", activity.chunksReceived());
            data.put("bytesReceived", activity.bytesReceived());
            emitter.emit(connection, EventType.HEARTBEAT, data);
            sent++;
        }
        return sent;
    }

    /**
     * Hands an idle flush pass to the flush executor unless one is still running.
     *
     * @return whether a pass was started
     */
    boolean dispatchIdleFlush() {
        if (!flushing.compareAndSet(false, true)) {
            log.debug("Previous idle flush still running, skipping this round");
            return false;
        }
        try {
            flusher.execute(() -> {
                try {
                    flushIdleBuffers();
                } catch (RuntimeException e) {
                    log.warn("Idle flush failed", e);
                } finally {
                    flushing.set(false);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            flushing.set(false);
            log.debug("Flush executor is shut down, idle flush skipped");
            return false;
        }
    }

    /**
     * Flushes buffers that have not been flushed for their connection's flush interval.
     */
    void flushIdleBuffers() {
        for (Connection connection : registry.snapshot()) {
            buffers.flushIfIdle(connection.id(), connection.options().flushInterval());
        }
    }

    /**
     * Aggregates metrics and publishes them to the metrics cache.
     */
    RelayMetrics publishMetrics() {
        RelayMetrics snapshot = metrics.aggregate();
        log.debug("Relay metrics: {}", snapshot);
        try {
            cache.set(Protocol.METRICS_CACHE_KEY, json.writeString(snapshot), config.metricsTtl());
        } catch (Exception e) {
            log.warn("Failed to publish relay metrics", e);
        }
        return snapshot;
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        flusher.shutdown();
    }

    private void repeat(String name, Duration period, Runnable task) {
        long nanos = period.toNanos();
        scheduler.scheduleAtFixedRate(guarded(name, task), nanos, nanos, TimeUnit.NANOSECONDS);
    }

    private static Runnable guarded(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.warn("Timer task {} failed", name, e);
            }
        };
    }
}
