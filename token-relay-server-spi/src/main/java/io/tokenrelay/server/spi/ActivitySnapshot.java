package io.tokenrelay.server.spi;

import java.time.Instant;
import java.util.Objects;

/**
 * Point-in-time copy of a connection's activity counters.
 *
 * @param connectedAt creation time
 * @param lastActivity last fragment, event or heartbeat time
 * @param chunksReceived fragments received so far
 * @param bytesReceived payload bytes received so far
 * @param averageLatencyMillis running mean of inter-fragment gaps
 */
public record ActivitySnapshot(
        Instant connectedAt,
        Instant lastActivity,
        long chunksReceived,
        long bytesReceived,
        double averageLatencyMillis
) {
    public ActivitySnapshot {
        Objects.requireNonNull(connectedAt, "connectedAt");
        Objects.requireNonNull(lastActivity, "lastActivity");
    }
}
