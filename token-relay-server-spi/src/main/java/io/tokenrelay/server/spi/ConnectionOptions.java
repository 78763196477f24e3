package io.tokenrelay.server.spi;

import java.time.Duration;
import java.util.Objects;

/**
 * Options captured when a connection is created. Immutable for the connection's lifetime.
 *
 * @param bufferSize buffer byte capacity
 * @param flushInterval idle time after which a non-empty buffer is flushed
 * @param compression whether flushed payloads are compressed
 * @param encryption whether flushed payloads are encrypted
 * @param heartbeatInterval heartbeat period for the connection
 */
public record ConnectionOptions(
        int bufferSize,
        Duration flushInterval,
        boolean compression,
        boolean encryption,
        Duration heartbeatInterval
) {
    public ConnectionOptions {
        if (bufferSize <= 0) throw new IllegalArgumentException("bufferSize must be positive");
        Objects.requireNonNull(flushInterval, "flushInterval");
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
    }
}
