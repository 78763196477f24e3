package io.tokenrelay.server.spi;

import io.tokenrelay.core.ConnectionStatus;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted form of a connection, as written by {@link RelayStore#saveConnection}.
 */
public record ConnectionRecord(
        String id,
        String clientId,
        String userId,
        String sessionId,
        String requestId,
        ConnectionStatus status,
        String provider,
        String model,
        ActivitySnapshot activity,
        ConnectionOptions options,
        Instant createdAt,
        Instant updatedAt
) {
    public ConnectionRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(activity, "activity");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
    }
}
