package io.tokenrelay.server.core.metrics;

import java.time.Instant;

/**
 * Aggregate relay metrics, published periodically to the metrics cache.
 */
public record RelayMetrics(
        int totalConnections,
        int streamingConnections,
        double averageLatency,
        double errorRate,
        double completionRate,
        double reconnectionRate,
        long bytesTransferred,
        Instant timestamp
) {
}
