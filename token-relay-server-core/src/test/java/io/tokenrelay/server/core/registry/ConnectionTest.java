package io.tokenrelay.server.core.registry;

import io.tokenrelay.core.ConnectionStatus;
import io.tokenrelay.core.RelayException;
import io.tokenrelay.server.spi.ConnectionOptions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    @Test
    void followsStreamingLifecycle() {
        Connection connection = connection();
        assertThat(connection.status()).isEqualTo(ConnectionStatus.CONNECTING);

        connection.beginStreaming(T0);
        assertThatThrownBy(() -> connection.beginStreaming(T0))
                .isInstanceOf(RelayException.IllegalStateTransition.class);

        assertThat(connection.complete(T0.plusSeconds(1))).isTrue();
        assertThat(connection.fail(T0.plusSeconds(2))).isFalse();
        assertThat(connection.status()).isEqualTo(ConnectionStatus.COMPLETED);

        assertThat(connection.disconnect(T0.plusSeconds(3))).isEqualTo(ConnectionStatus.COMPLETED);
        assertThat(connection.isDisconnected()).isTrue();
    }

    @Test
    void errorIsReachableBeforeStreaming() {
        Connection connection = connection();

        assertThat(connection.fail(T0)).isTrue();
        assertThat(connection.complete(T0)).isFalse();
        assertThat(connection.status()).isEqualTo(ConnectionStatus.ERROR);
    }

    @Test
    void averageLatencyIsTotalGapOverFragments() {
        Connection connection = connection();
        connection.beginStreaming(T0);

        connection.recordFragment(10, T0.plusMillis(100));
        connection.recordFragment(20, T0.plusMillis(400));

        assertThat(connection.activity().chunksReceived()).isEqualTo(2);
        assertThat(connection.activity().bytesReceived()).isEqualTo(30);
        assertThat(connection.activity().averageLatencyMillis()).isEqualTo(200.0);
        assertThat(connection.lastActivity()).isEqualTo(T0.plusMillis(400));
    }

    @Test
    void sequencesStartAtZero() {
        Connection connection = connection();

        assertThat(connection.nextSequence()).isZero();
        assertThat(connection.nextSequence()).isEqualTo(1);
    }

    private static Connection connection() {
        return new Connection("c1", "client", null, null, "req", "openai", "gpt",
                new ConnectionOptions(8192, Duration.ofMillis(100), true, false, Duration.ofSeconds(30)), T0);
    }
}
