package io.tokenrelay.server.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Relay configuration.
 *
 * <pre>{@code
 * RelayConfig config = RelayConfig.builder()
 *     .maxConnections(500)
 *     .bufferSize(16 * 1024)
 *     .compressionAlgorithm("adaptive")
 *     .build();
 * }</pre>
 */
public final class RelayConfig {

    public static final int DEFAULT_MAX_CONNECTIONS = 1000;
    public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofMinutes(5);
    public static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofMinutes(1);
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_METRICS_INTERVAL = Duration.ofMinutes(1);
    public static final int DEFAULT_BUFFER_SIZE = 8192;
    public static final double DEFAULT_FLUSH_THRESHOLD_FRACTION = 0.8;
    public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofMillis(100);
    public static final Duration DEFAULT_COMPLETION_GRACE = Duration.ofSeconds(5);
    public static final String DEFAULT_COMPRESSION_ALGORITHM = "gzip";
    public static final String DEFAULT_ENCRYPTION_ALGORITHM = "aes-256-gcm";
    public static final Duration DEFAULT_KEY_ROTATION = Duration.ofHours(24);
    public static final Duration DEFAULT_KEY_RETENTION = Duration.ofDays(7);
    public static final Duration DEFAULT_METRICS_TTL = Duration.ofSeconds(300);

    private final int maxConnections;
    private final Duration connectionTimeout;
    private final Duration cleanupInterval;
    private final Duration heartbeatInterval;
    private final Duration metricsInterval;
    private final int bufferSize;
    private final double flushThresholdFraction;
    private final Duration flushInterval;
    private final Duration completionGrace;
    private final boolean compressionEnabled;
    private final String compressionAlgorithm;
    private final boolean encryptionEnabled;
    private final String encryptionAlgorithm;
    private final Duration keyRotationInterval;
    private final Duration keyRetention;
    private final int transformWorkers;
    private final Duration metricsTtl;

    private RelayConfig(Builder b) {
        this.maxConnections = b.maxConnections;
        this.connectionTimeout = b.connectionTimeout;
        this.cleanupInterval = b.cleanupInterval;
        this.heartbeatInterval = b.heartbeatInterval;
        this.metricsInterval = b.metricsInterval;
        this.bufferSize = b.bufferSize;
        this.flushThresholdFraction = b.flushThresholdFraction;
        this.flushInterval = b.flushInterval;
        this.completionGrace = b.completionGrace;
        this.compressionEnabled = b.compressionEnabled;
        this.compressionAlgorithm = b.compressionAlgorithm;
        this.encryptionEnabled = b.encryptionEnabled;
        this.encryptionAlgorithm = b.encryptionAlgorithm;
        this.keyRotationInterval = b.keyRotationInterval;
        this.keyRetention = b.keyRetention;
        this.transformWorkers = b.transformWorkers;
        this.metricsTtl = b.metricsTtl;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RelayConfig defaults() {
        return builder().build();
    }

    public int maxConnections() {
        return maxConnections;
    }

    /** Idle time after which a connection is reaped. */
    public Duration connectionTimeout() {
        return connectionTimeout;
    }

    public Duration cleanupInterval() {
        return cleanupInterval;
    }

    public Duration heartbeatInterval() {
        return heartbeatInterval;
    }

    public Duration metricsInterval() {
        return metricsInterval;
    }

    public int bufferSize() {
        return bufferSize;
    }

    public double flushThresholdFraction() {
        return flushThresholdFraction;
    }

    /** Flush threshold for a buffer of {@code maxSize} bytes: {@code ceil(maxSize * fraction)}. */
    public int flushThreshold(int maxSize) {
        return (int) Math.ceil(maxSize * flushThresholdFraction);
    }

    public Duration flushInterval() {
        return flushInterval;
    }

    /** Delay between a stream's completion (or error) and closing its connection. */
    public Duration completionGrace() {
        return completionGrace;
    }

    public boolean compressionEnabled() {
        return compressionEnabled;
    }

    public String compressionAlgorithm() {
        return compressionAlgorithm;
    }

    public boolean encryptionEnabled() {
        return encryptionEnabled;
    }

    public String encryptionAlgorithm() {
        return encryptionAlgorithm;
    }

    public Duration keyRotationInterval() {
        return keyRotationInterval;
    }

    /** How long retired keys stay available for decryption. */
    public Duration keyRetention() {
        return keyRetention;
    }

    public int transformWorkers() {
        return transformWorkers;
    }

    public Duration metricsTtl() {
        return metricsTtl;
    }

    /**
     * Builder for {@link RelayConfig}.
     */
    public static final class Builder {
        private int maxConnections = DEFAULT_MAX_CONNECTIONS;
        private Duration connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;
        private Duration cleanupInterval = DEFAULT_CLEANUP_INTERVAL;
        private Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;
        private Duration metricsInterval = DEFAULT_METRICS_INTERVAL;
        private int bufferSize = DEFAULT_BUFFER_SIZE;
        private double flushThresholdFraction = DEFAULT_FLUSH_THRESHOLD_FRACTION;
        private Duration flushInterval = DEFAULT_FLUSH_INTERVAL;
        private Duration completionGrace = DEFAULT_COMPLETION_GRACE;
        private boolean compressionEnabled = true;
        private String compressionAlgorithm = DEFAULT_COMPRESSION_ALGORITHM;
        private boolean encryptionEnabled;
        private String encryptionAlgorithm = DEFAULT_ENCRYPTION_ALGORITHM;
        private Duration keyRotationInterval = DEFAULT_KEY_ROTATION;
        private Duration keyRetention = DEFAULT_KEY_RETENTION;
        private int transformWorkers = Runtime.getRuntime().availableProcessors();
        private Duration metricsTtl = DEFAULT_METRICS_TTL;

        private Builder() {
        }

        /** Ceiling on simultaneously open connections. Default: 1000. */
        public Builder maxConnections(int maxConnections) {
            this.maxConnections = positive(maxConnections, "maxConnections");
            return this;
        }

        /** Idle timeout before a connection is reaped. Default: 5 minutes. */
        public Builder connectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = positive(connectionTimeout, "connectionTimeout");
            return this;
        }

        /** Period of the idle reaper. Default: 1 minute. */
        public Builder cleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = positive(cleanupInterval, "cleanupInterval");
            return this;
        }

        /** Period of heartbeats to streaming connections. Default: 30 seconds. */
        public Builder heartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = positive(heartbeatInterval, "heartbeatInterval");
            return this;
        }

        /** Period of aggregate metrics publication. Default: 1 minute. */
        public Builder metricsInterval(Duration metricsInterval) {
            this.metricsInterval = positive(metricsInterval, "metricsInterval");
            return this;
        }

        /** Default buffer byte capacity. Default: 8192. */
        public Builder bufferSize(int bufferSize) {
            this.bufferSize = positive(bufferSize, "bufferSize");
            return this;
        }

        /** Fraction of the buffer capacity that triggers a flush, in (0, 1]. Default: 0.8. */
        public Builder flushThresholdFraction(double flushThresholdFraction) {
            if (!(flushThresholdFraction > 0.0 && flushThresholdFraction <= 1.0)) {
                throw new IllegalArgumentException("flushThresholdFraction must be in (0, 1]");
            }
            this.flushThresholdFraction = flushThresholdFraction;
            return this;
        }

        /** Default idle flush interval. Default: 100 ms. */
        public Builder flushInterval(Duration flushInterval) {
            this.flushInterval = positive(flushInterval, "flushInterval");
            return this;
        }

        /** Delay before a finished connection is closed. Default: 5 seconds. */
        public Builder completionGrace(Duration completionGrace) {
            Objects.requireNonNull(completionGrace, "completionGrace");
            if (completionGrace.isNegative()) throw new IllegalArgumentException("completionGrace must not be negative");
            this.completionGrace = completionGrace;
            return this;
        }

        public Builder compressionEnabled(boolean compressionEnabled) {
            this.compressionEnabled = compressionEnabled;
            return this;
        }

        /** {@code gzip}, {@code deflate}, {@code brotli}, {@code identity} or {@code adaptive}. Default: gzip. */
        public Builder compressionAlgorithm(String compressionAlgorithm) {
            this.compressionAlgorithm = Objects.requireNonNull(compressionAlgorithm, "compressionAlgorithm");
            return this;
        }

        public Builder encryptionEnabled(boolean encryptionEnabled) {
            this.encryptionEnabled = encryptionEnabled;
            return this;
        }

        /** {@code aes-256-gcm} or {@code chacha20-poly1305}. Default: aes-256-gcm. */
        public Builder encryptionAlgorithm(String encryptionAlgorithm) {
            this.encryptionAlgorithm = Objects.requireNonNull(encryptionAlgorithm, "encryptionAlgorithm");
            return this;
        }

        /** Key rotation period. Default: 24 hours. */
        public Builder keyRotationInterval(Duration keyRotationInterval) {
            this.keyRotationInterval = positive(keyRotationInterval, "keyRotationInterval");
            return this;
        }

        /** Retention of retired keys. Default: 7 days. */
        public Builder keyRetention(Duration keyRetention) {
            this.keyRetention = positive(keyRetention, "keyRetention");
            return this;
        }

        /** Size of the transform worker pool. Default: available processors. */
        public Builder transformWorkers(int transformWorkers) {
            this.transformWorkers = positive(transformWorkers, "transformWorkers");
            return this;
        }

        /** TTL of the published metrics snapshot. Default: 300 seconds. */
        public Builder metricsTtl(Duration metricsTtl) {
            this.metricsTtl = positive(metricsTtl, "metricsTtl");
            return this;
        }

        public RelayConfig build() {
            return new RelayConfig(this);
        }

        private static int positive(int value, String name) {
            if (value <= 0) throw new IllegalArgumentException(name + " must be positive");
            return value;
        }

        private static Duration positive(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isZero() || value.isNegative()) throw new IllegalArgumentException(name + " must be positive");
            return value;
        }
    }
}
