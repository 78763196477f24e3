package io.tokenrelay.server.core.metrics;

import io.tokenrelay.core.ConnectionStatus;

import java.time.Instant;

/**
 * Metrics of one connection over a time window, computed from its chunks.
 *
 * @param connectionId connection
 * @param from window start (inclusive)
 * @param to window end (inclusive)
 * @param status connection status when computed
 * @param totalChunks chunks created in the window
 * @param totalBytes original payload bytes of those chunks
 * @param averageChunkSize bytes per chunk
 * @param chunksPerSecond chunks over the window length
 * @param bytesPerSecond bytes over the window length
 * @param latency gaps between consecutive chunks
 * @param averageRttMillis running mean of inter-fragment gaps over the connection's lifetime
 */
public record ConnectionMetrics(
        String connectionId,
        Instant from,
        Instant to,
        ConnectionStatus status,
        long totalChunks,
        long totalBytes,
        double averageChunkSize,
        double chunksPerSecond,
        double bytesPerSecond,
        LatencyStats latency,
        double averageRttMillis
) {
}
