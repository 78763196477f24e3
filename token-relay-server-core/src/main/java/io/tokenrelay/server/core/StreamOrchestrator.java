package io.tokenrelay.server.core;

import io.tokenrelay.core.ChunkType;
import io.tokenrelay.core.EventType;
import io.tokenrelay.core.Fragment;
import io.tokenrelay.core.Protocol;
import io.tokenrelay.core.RelayEvent;
import io.tokenrelay.core.RelayException;
import io.tokenrelay.core.Usage;
import io.tokenrelay.json.spi.JsonCodec;
import io.tokenrelay.json.spi.JsonException;
import io.tokenrelay.server.core.buffer.BufferManager;
import io.tokenrelay.server.core.metrics.RelayStats;
import io.tokenrelay.server.core.registry.Connection;
import io.tokenrelay.server.core.registry.ConnectionRegistry;
import io.tokenrelay.server.spi.ActivitySnapshot;
import io.tokenrelay.server.spi.Chunk;
import io.tokenrelay.server.spi.FragmentProducer;
import io.tokenrelay.server.spi.FragmentStream;
import io.tokenrelay.server.spi.StreamRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * Drives one upstream generation per connection: fragments become sequenced chunks in the
 * connection's buffer and {@code chunk} events on its channel.
 *
 * <p>A stream ends in exactly one {@code complete} or {@code error} event, after which the
 * connection is closed once the completion grace period has passed. Upstream failures never
 * propagate to the caller of {@link #startStream}.
 */
public final class StreamOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(StreamOrchestrator.class);

    private final ConnectionRegistry registry;
    private final BufferManager buffers;
    private final FragmentProducer producer;
    private final EventEmitter emitter;
    private final LifecycleTimers timers;
    private final JsonCodec json;
    private final RelayConfig config;
    private final RelayStats stats;
    private final RelayListeners listeners;
    private final Clock clock;
    private final ExecutorService streams;

    StreamOrchestrator(ConnectionRegistry registry, BufferManager buffers, FragmentProducer producer,
                       EventEmitter emitter, LifecycleTimers timers, JsonCodec json, RelayConfig config,
                       RelayStats stats, RelayListeners listeners, Clock clock, ExecutorService streams) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.buffers = Objects.requireNonNull(buffers, "buffers");
        this.producer = Objects.requireNonNull(producer, "producer");
        this.emitter = Objects.requireNonNull(emitter, "emitter");
        this.timers = Objects.requireNonNull(timers, "timers");
        this.json = Objects.requireNonNull(json, "json");
        this.config = Objects.requireNonNull(config, "config");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.listeners = Objects.requireNonNull(listeners, "listeners");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.streams = Objects.requireNonNull(streams, "streams");
    }

    /**
     * Runs the stream on the calling thread and returns when it has completed, failed or been
     * interrupted by a close.
     *
     * @throws RelayException.ConnectionNotFound if the connection is not open
     * @throws RelayException.IllegalStateTransition if the connection is not CONNECTING
     */
    public void startStream(String connectionId, StreamRequest request) {
        Connection connection = begin(connectionId, request);
        StreamHandle handle = new StreamHandle(connectionId);
        try {
            consume(connection, request, handle);
        } finally {
            handle.finished();
        }
    }

    /**
     * Validates and starts the stream synchronously, then consumes it on a stream thread.
     */
    public StreamHandle startStreamAsync(String connectionId, StreamRequest request) {
        Connection connection = begin(connectionId, request);
        StreamHandle handle = new StreamHandle(connectionId);
        try {
            streams.execute(() -> {
                try {
                    consume(connection, request, handle);
                } finally {
                    handle.finished();
                }
            });
        } catch (RuntimeException e) {
            handle.finished();
            fail(connection, new RelayException.UpstreamGenerationError("Stream could not be scheduled", e));
        }
        return handle;
    }

    private Connection begin(String connectionId, StreamRequest request) {
        Objects.requireNonNull(request, "request");
        Connection connection = registry.require(connectionId);
        connection.beginStreaming(clock.instant());
        registry.persist(connection);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("connectionId", connectionId);
        data.put("provider", request.provider());
        data.put("model", request.model());
        data.put("requestId", request.id());
        emitter.emit(connection, EventType.START, data);
        log.debug("Stream started for connection {} ({}/{})", connectionId, request.provider(), request.model());
        return connection;
    }

    private void consume(Connection connection, StreamRequest request, StreamHandle handle) {
        Instant started = clock.instant();
        try (FragmentStream upstream = producer.open(request)) {
            handle.attach(upstream);
            String finishReason = null;
            while (!stopped(connection, handle) && upstream.hasNext()) {
                Fragment fragment = upstream.next();
                onFragment(connection, fragment);
                if (fragment.isTerminal()) {
                    finishReason = fragment.finishReason();
                    break;
                }
            }
            if (stopped(connection, handle)) {
                cancelled(connection);
                return;
            }
            complete(connection, finishReason != null ? finishReason : Protocol.FINISH_END_OF_STREAM, started);
        } catch (Exception e) {
            if (stopped(connection, handle)) {
                cancelled(connection);
                return;
            }
            RelayException error = e instanceof RelayException
                    ? (RelayException) e
                    : new RelayException.UpstreamGenerationError(messageOf(e), e);
            fail(connection, error);
        } catch (Error e) {
            if (stopped(connection, handle)) {
                cancelled(connection);
            } else {
                fail(connection, new RelayException.UpstreamGenerationError(messageOf(e), e));
            }
            if (e instanceof VirtualMachineError) throw e;
        }
    }

    private void onFragment(Connection connection, Fragment fragment) throws JsonException {
        Instant now = clock.instant();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("content", fragment.content());
        body.put("delta", fragment.delta());
        body.put("finishReason", fragment.finishReason());
        fragment.usageIfPresent().ifPresent(u -> body.put("usage", usageMap(u)));
        byte[] payload = json.writeBytes(body);

        Chunk chunk = new Chunk(Ids.chunkId(), connection.id(), connection.nextSequence(), ChunkType.CONTENT,
                payload, now, payload.length, Ids.sha256(payload));
        buffers.append(connection.id(), chunk);
        connection.recordFragment(payload.length, now);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("content", fragment.content());
        data.put("delta", fragment.delta());
        data.put("finishReason", fragment.finishReason());
        data.put("sequence", chunk.sequence());
        fragment.usageIfPresent().ifPresent(u -> data.put("usage", usageMap(u)));
        emitter.emit(connection, EventType.CHUNK, data);
    }

    private void complete(Connection connection, String finishReason, Instant started) {
        buffers.flush(connection.id());
        if (!connection.complete(clock.instant())) {
            log.debug("Connection {} left streaming before completion", connection.id());
            return;
        }
        registry.persist(connection);

        ActivitySnapshot activity = connection.activity();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("connectionId", connection.id());
        data.put("finishReason", finishReason);
        data.put("totalChunks", activity.chunksReceived());
        data.put("totalBytes", activity.bytesReceived());
        data.put("duration", Duration.between(started, clock.instant()).toMillis());
        RelayEvent event = emitter.emit(connection, EventType.COMPLETE, data);

        stats.streamCompleted();
        listeners.fire(l -> l.streamCompleted(connection.id(), event));
        log.info("Stream completed for connection {} ({}, {} chunks)", connection.id(), finishReason, activity.chunksReceived());
        timers.scheduleClose(connection.id(), config.completionGrace());
    }

    private void fail(Connection connection, RelayException error) {
        if (!connection.fail(clock.instant())) {
            log.debug("Ignoring error for finished connection {}: {}", connection.id(), error.getMessage());
            return;
        }
        registry.persist(connection);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("connectionId", connection.id());
        data.put("error", error.getMessage());
        data.put("code", error.code());
        emitter.emit(connection, EventType.ERROR, data);

        stats.streamErrored();
        listeners.fire(l -> l.streamError(connection.id(), error));
        log.warn("Stream failed for connection {}: {}", connection.id(), error.getMessage(), error);
        timers.scheduleClose(connection.id(), config.completionGrace());
    }

    private void cancelled(Connection connection) {
        log.info("Stream for connection {} stopped before completion", connection.id());
        registry.close(connection.id());
    }

    private static boolean stopped(Connection connection, StreamHandle handle) {
        return handle.isCancelled() || connection.isDisconnected();
    }

    private static Map<String, Object> usageMap(Usage usage) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("promptTokens", usage.promptTokens());
        map.put("completionTokens", usage.completionTokens());
        map.put("totalTokens", usage.totalTokens());
        return map;
    }

    private static String messageOf(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
