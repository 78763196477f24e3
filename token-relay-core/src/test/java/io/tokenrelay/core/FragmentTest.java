package io.tokenrelay.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FragmentTest {

    @Test
    void normalizesNullTextAndBlankFinishReason() {
        Fragment fragment = new Fragment(null, null, "  ", null);

        assertThat(fragment.content()).isEmpty();
        assertThat(fragment.delta()).isEmpty();
        assertThat(fragment.isTerminal()).isFalse();
        assertThat(fragment.usageIfPresent()).isEmpty();
    }

    @Test
    void terminalFragmentCarriesUsage() {
        Fragment fragment = Fragment.last("Hello world!", "!", "stop", new Usage(3, 4, 7));

        assertThat(fragment.isTerminal()).isTrue();
        assertThat(fragment.usageIfPresent()).contains(new Usage(3, 4, 7));
    }

    @Test
    void usageRejectsNegativeCounts() {
        assertThatThrownBy(() -> new Usage(-1, 0, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void eventIdsAreSixteenHexCharacters() {
        RelayEvent event = RelayEvent.of(EventType.START, Map.of("k", "v"), Instant.EPOCH);

        assertThat(event.eventId()).matches("[0-9a-f]{16}");
        assertThat(event.type().wireName()).isEqualTo("start");
        assertThat(EventType.fromWireName("heartbeat")).isEqualTo(EventType.HEARTBEAT);
    }

    @Test
    void exceptionsExposeMachineReadableCodes() {
        assertThat(new RelayException.CapacityExceeded(2).code()).isEqualTo("capacity_exceeded");
        assertThat(new RelayException.ConnectionNotFound("x").code()).isEqualTo("connection_not_found");
        assertThat(new RelayException.DecryptionError("bad tag").code()).isEqualTo("decryption_failed");
        assertThat(ConnectionStatus.fromWireName("streaming")).isEqualTo(ConnectionStatus.STREAMING);
        assertThat(ConnectionStatus.COMPLETED.isTerminal()).isTrue();
    }
}
