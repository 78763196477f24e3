package io.tokenrelay.core;

/**
 * Base class for relay exceptions.
 *
 * <p>Every subclass carries a machine-readable {@link #code()} that is surfaced to clients
 * in {@code error} events. Failures that only affect data at rest (flush, compression) are
 * recovered locally; the others are surfaced to the caller or the event stream.
 */
public abstract class RelayException extends RuntimeException {

    private final String code;

    protected RelayException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected RelayException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Raised synchronously by connection creation when the ceiling is reached.
     */
    public static class CapacityExceeded extends RelayException {
        private final int maxConnections;

        public CapacityExceeded(int maxConnections) {
            super("capacity_exceeded", "Maximum connections reached (" + maxConnections + ")");
            this.maxConnections = maxConnections;
        }

        public int maxConnections() {
            return maxConnections;
        }
    }

    /**
     * Raised when operating on an unknown connection id.
     */
    public static class ConnectionNotFound extends RelayException {
        private final String connectionId;

        public ConnectionNotFound(String connectionId) {
            super("connection_not_found", "Connection " + connectionId + " not found");
            this.connectionId = connectionId;
        }

        public String connectionId() {
            return connectionId;
        }
    }

    /**
     * Raised when an operation requires a status the connection is not in.
     */
    public static class IllegalStateTransition extends RelayException {
        public IllegalStateTransition(String connectionId, ConnectionStatus from, ConnectionStatus to) {
            super("illegal_state", "Connection " + connectionId + " cannot move from "
                    + from.wireName() + " to " + to.wireName());
        }
    }

    /**
     * Failure reading the upstream fragment producer. Reported as an {@code error} event.
     */
    public static class UpstreamGenerationError extends RelayException {
        public UpstreamGenerationError(String message) {
            super("upstream_error", message);
        }

        public UpstreamGenerationError(String message, Throwable cause) {
            super("upstream_error", message, cause);
        }
    }

    /**
     * Storage write failure during flush. Logged; the buffer is kept for a retry.
     */
    public static class FlushFailure extends RelayException {
        public FlushFailure(String connectionId, Throwable cause) {
            super("flush_failed", "Flush failed for connection " + connectionId + ": " + cause.getMessage(), cause);
        }
    }

    /**
     * Authentication tag mismatch (corrupted data or wrong key). Never returns garbage.
     */
    public static class DecryptionError extends RelayException {
        public DecryptionError(String message) {
            super("decryption_failed", message);
        }

        public DecryptionError(String message, Throwable cause) {
            super("decryption_failed", message, cause);
        }
    }

    /**
     * Compression or decompression failure. Non-fatal on write: the payload is stored uncompressed.
     */
    public static class CompressionFailure extends RelayException {
        public CompressionFailure(String message, Throwable cause) {
            super("compression_failed", message, cause);
        }
    }

    /**
     * Durable store failure outside the flush path (connection creation or lookup).
     */
    public static class StoreFailure extends RelayException {
        public StoreFailure(String message, Throwable cause) {
            super("store_failed", message, cause);
        }
    }
}
