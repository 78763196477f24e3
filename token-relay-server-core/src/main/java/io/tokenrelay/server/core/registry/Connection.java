package io.tokenrelay.server.core.registry;

import io.tokenrelay.core.ConnectionStatus;
import io.tokenrelay.core.RelayException;
import io.tokenrelay.server.core.EventChannel;
import io.tokenrelay.server.spi.ActivitySnapshot;
import io.tokenrelay.server.spi.ConnectionOptions;
import io.tokenrelay.server.spi.ConnectionRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live state of one client connection.
 *
 * <p>Status moves {@code CONNECTING -> STREAMING -> COMPLETED | ERROR}; any status may move to
 * {@code DISCONNECTED}, which is final. Mutations are synchronized on the instance.
 */
public final class Connection {

    private final String id;
    private final String clientId;
    private final String userId;
    private final String sessionId;
    private final String requestId;
    private final String provider;
    private final String model;
    private final ConnectionOptions options;
    private final Instant createdAt;
    private final EventChannel channel;
    private final AtomicLong sequence = new AtomicLong();

    private ConnectionStatus status = ConnectionStatus.CONNECTING;
    private Instant updatedAt;
    private Instant lastActivity;
    private Instant streamStartedAt;
    private Instant lastFragmentAt;
    private long chunksReceived;
    private long bytesReceived;
    private double totalLatencyMillis;
    private double averageLatencyMillis;

    Connection(String id, String clientId, String userId, String sessionId, String requestId,
               String provider, String model, ConnectionOptions options, Instant createdAt) {
        this.id = id;
        this.clientId = clientId;
        this.userId = userId;
        this.sessionId = sessionId;
        this.requestId = requestId;
        this.provider = provider;
        this.model = model;
        this.options = options;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.lastActivity = createdAt;
        this.channel = new EventChannel(id);
    }

    public String id() {
        return id;
    }

    public String clientId() {
        return clientId;
    }

    public String requestId() {
        return requestId;
    }

    public String provider() {
        return provider;
    }

    public String model() {
        return model;
    }

    public ConnectionOptions options() {
        return options;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public EventChannel channel() {
        return channel;
    }

    /** Next chunk sequence number, starting at 0. */
    public long nextSequence() {
        return sequence.getAndIncrement();
    }

    public synchronized ConnectionStatus status() {
        return status;
    }

    /**
     * {@code CONNECTING -> STREAMING}.
     *
     * @throws RelayException.IllegalStateTransition from any other status
     */
    public synchronized void beginStreaming(Instant now) {
        if (status != ConnectionStatus.CONNECTING) {
            throw new RelayException.IllegalStateTransition(id, status, ConnectionStatus.STREAMING);
        }
        status = ConnectionStatus.STREAMING;
        streamStartedAt = now;
        lastFragmentAt = now;
        touch(now);
    }

    /**
     * {@code STREAMING -> COMPLETED}.
     *
     * @return false if the connection was no longer streaming
     */
    public synchronized boolean complete(Instant now) {
        if (status != ConnectionStatus.STREAMING) return false;
        status = ConnectionStatus.COMPLETED;
        touch(now);
        return true;
    }

    /**
     * Any non-final status to {@code ERROR}.
     *
     * @return false if the connection had already finished
     */
    public synchronized boolean fail(Instant now) {
        if (status.isTerminal()) return false;
        status = ConnectionStatus.ERROR;
        touch(now);
        return true;
    }

    /**
     * @return the status before disconnecting
     */
    public synchronized ConnectionStatus disconnect(Instant now) {
        ConnectionStatus previous = status;
        status = ConnectionStatus.DISCONNECTED;
        updatedAt = now;
        return previous;
    }

    public synchronized boolean isDisconnected() {
        return status == ConnectionStatus.DISCONNECTED;
    }

    /**
     * Accounts one upstream fragment: the gap since the previous fragment (or the stream start)
     * is added to the latency total.
     */
    public synchronized void recordFragment(int bytes, Instant now) {
        Instant previous = lastFragmentAt != null ? lastFragmentAt : now;
        totalLatencyMillis += Math.max(0, Duration.between(previous, now).toNanos() / 1_000_000.0);
        chunksReceived++;
        bytesReceived += bytes;
        averageLatencyMillis = totalLatencyMillis / chunksReceived;
        lastFragmentAt = now;
        touch(now);
    }

    public synchronized void touch(Instant now) {
        lastActivity = now;
        updatedAt = now;
    }

    public synchronized Instant lastActivity() {
        return lastActivity;
    }

    /** Time since the stream started, or zero before it did. */
    public synchronized Duration streamDuration(Instant now) {
        return streamStartedAt == null ? Duration.ZERO : Duration.between(streamStartedAt, now);
    }

    public synchronized ActivitySnapshot activity() {
        return new ActivitySnapshot(createdAt, lastActivity, chunksReceived, bytesReceived, averageLatencyMillis);
    }

    public synchronized ConnectionRecord toRecord() {
        return new ConnectionRecord(id, clientId, userId, sessionId, requestId, status, provider, model,
                activity(), options, createdAt, updatedAt);
    }

    @Override
    public String toString() {
        return "Connection{" + id + ", " + status() + "}";
    }
}
