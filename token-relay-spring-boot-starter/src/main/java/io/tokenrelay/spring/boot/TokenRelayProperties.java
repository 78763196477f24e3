package io.tokenrelay.spring.boot;

import io.tokenrelay.server.core.RelayConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * {@code token-relay.*} configuration properties. Unset values keep the {@link RelayConfig}
 * defaults.
 */
@ConfigurationProperties("token-relay")
public class TokenRelayProperties {

    private int maxConnections = RelayConfig.DEFAULT_MAX_CONNECTIONS;
    private Duration connectionTimeout = RelayConfig.DEFAULT_CONNECTION_TIMEOUT;
    private Duration cleanupInterval = RelayConfig.DEFAULT_CLEANUP_INTERVAL;
    private Duration heartbeatInterval = RelayConfig.DEFAULT_HEARTBEAT_INTERVAL;
    private Duration metricsInterval = RelayConfig.DEFAULT_METRICS_INTERVAL;
    private Duration metricsTtl = RelayConfig.DEFAULT_METRICS_TTL;
    private Duration completionGrace = RelayConfig.DEFAULT_COMPLETION_GRACE;
    private Integer transformWorkers;
    private final Buffer buffer = new Buffer();
    private final Compression compression = new Compression();
    private final Encryption encryption = new Encryption();

    public RelayConfig toRelayConfig() {
        RelayConfig.Builder builder = RelayConfig.builder()
                .maxConnections(maxConnections)
                .connectionTimeout(connectionTimeout)
                .cleanupInterval(cleanupInterval)
                .heartbeatInterval(heartbeatInterval)
                .metricsInterval(metricsInterval)
                .metricsTtl(metricsTtl)
                .completionGrace(completionGrace)
                .bufferSize(buffer.size)
                .flushThresholdFraction(buffer.flushThreshold)
                .flushInterval(buffer.flushInterval)
                .compressionEnabled(compression.enabled)
                .compressionAlgorithm(compression.algorithm)
                .encryptionEnabled(encryption.enabled)
                .encryptionAlgorithm(encryption.algorithm)
                .keyRotationInterval(encryption.keyRotation)
                .keyRetention(encryption.keyRetention);
        if (transformWorkers != null) builder.transformWorkers(transformWorkers);
        return builder.build();
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public void setMaxConnections(int maxConnections) {
        this.maxConnections = maxConnections;
    }

    public Duration getConnectionTimeout() {
        return connectionTimeout;
    }

    public void setConnectionTimeout(Duration connectionTimeout) {
        this.connectionTimeout = connectionTimeout;
    }

    public Duration getCleanupInterval() {
        return cleanupInterval;
    }

    public void setCleanupInterval(Duration cleanupInterval) {
        this.cleanupInterval = cleanupInterval;
    }

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public void setHeartbeatInterval(Duration heartbeatInterval) {
        this.heartbeatInterval = heartbeatInterval;
    }

    public Duration getMetricsInterval() {
        return metricsInterval;
    }

    public void setMetricsInterval(Duration metricsInterval) {
        this.metricsInterval = metricsInterval;
    }

    public Duration getMetricsTtl() {
        return metricsTtl;
    }

    public void setMetricsTtl(Duration metricsTtl) {
        this.metricsTtl = metricsTtl;
    }

    public Duration getCompletionGrace() {
        return completionGrace;
    }

    public void setCompletionGrace(Duration completionGrace) {
        this.completionGrace = completionGrace;
    }

    public Integer getTransformWorkers() {
        return transformWorkers;
    }

    public void setTransformWorkers(Integer transformWorkers) {
        this.transformWorkers = transformWorkers;
    }

    public Buffer getBuffer() {
        return buffer;
    }

    public Compression getCompression() {
        return compression;
    }

    public Encryption getEncryption() {
        return encryption;
    }

    public static class Buffer {
        /** Buffer capacity in bytes. */
        private int size = RelayConfig.DEFAULT_BUFFER_SIZE;
        /** Fraction of the capacity at which a flush is triggered. */
        private double flushThreshold = RelayConfig.DEFAULT_FLUSH_THRESHOLD_FRACTION;
        private Duration flushInterval = RelayConfig.DEFAULT_FLUSH_INTERVAL;

        public int getSize() {
            return size;
        }

        public void setSize(int size) {
            this.size = size;
        }

        public double getFlushThreshold() {
            return flushThreshold;
        }

        public void setFlushThreshold(double flushThreshold) {
            this.flushThreshold = flushThreshold;
        }

        public Duration getFlushInterval() {
            return flushInterval;
        }

        public void setFlushInterval(Duration flushInterval) {
            this.flushInterval = flushInterval;
        }
    }

    public static class Compression {
        private boolean enabled = true;
        /** {@code gzip}, {@code deflate}, {@code brotli}, {@code identity} or {@code adaptive}. */
        private String algorithm = RelayConfig.DEFAULT_COMPRESSION_ALGORITHM;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getAlgorithm() {
            return algorithm;
        }

        public void setAlgorithm(String algorithm) {
            this.algorithm = algorithm;
        }
    }

    public static class Encryption {
        private boolean enabled;
        /** {@code aes-256-gcm} or {@code chacha20-poly1305}. */
        private String algorithm = RelayConfig.DEFAULT_ENCRYPTION_ALGORITHM;
        private Duration keyRotation = RelayConfig.DEFAULT_KEY_ROTATION;
        private Duration keyRetention = RelayConfig.DEFAULT_KEY_RETENTION;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getAlgorithm() {
            return algorithm;
        }

        public void setAlgorithm(String algorithm) {
            this.algorithm = algorithm;
        }

        public Duration getKeyRotation() {
            return keyRotation;
        }

        public void setKeyRotation(Duration keyRotation) {
            this.keyRotation = keyRotation;
        }

        public Duration getKeyRetention() {
            return keyRetention;
        }

        public void setKeyRetention(Duration keyRetention) {
            this.keyRetention = keyRetention;
        }
    }
}
