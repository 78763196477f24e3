package io.tokenrelay.server.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RelayConfigTest {

    @Test
    void defaults() {
        RelayConfig config = RelayConfig.defaults();

        assertThat(config.maxConnections()).isEqualTo(1000);
        assertThat(config.connectionTimeout()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.heartbeatInterval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.bufferSize()).isEqualTo(8192);
        assertThat(config.flushInterval()).isEqualTo(Duration.ofMillis(100));
        assertThat(config.completionGrace()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.compressionEnabled()).isTrue();
        assertThat(config.compressionAlgorithm()).isEqualTo("gzip");
        assertThat(config.encryptionEnabled()).isFalse();
        assertThat(config.keyRotationInterval()).isEqualTo(Duration.ofHours(24));
        assertThat(config.metricsTtl()).isEqualTo(Duration.ofSeconds(300));
    }

    @Test
    void flushThresholdRoundsUp() {
        RelayConfig config = RelayConfig.defaults();

        assertThat(config.flushThreshold(8192)).isEqualTo(6554);
        assertThat(config.flushThreshold(10)).isEqualTo(8);
        assertThat(RelayConfig.builder().flushThresholdFraction(1.0).build().flushThreshold(100)).isEqualTo(100);
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> RelayConfig.builder().maxConnections(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RelayConfig.builder().flushThresholdFraction(0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RelayConfig.builder().flushThresholdFraction(1.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RelayConfig.builder().heartbeatInterval(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RelayConfig.builder().completionGrace(Duration.ofSeconds(-1))).isInstanceOf(IllegalArgumentException.class);
    }
}
