package io.tokenrelay.server.core;

import io.tokenrelay.core.EventType;
import io.tokenrelay.core.RelayEvent;
import io.tokenrelay.core.SseParser;
import io.tokenrelay.json.jackson.JacksonJsonCodec;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SseFrameTest {

    @Test
    void rendersFieldsInWireOrder() {
        SseFrame frame = new SseFrame("chunk", "00112233aabbccdd", "{\"delta\":\"Hi\"}", Instant.parse("2025-01-01T00:00:00Z"));

        assertThat(frame.render()).isEqualTo("event: chunk\n"
                + "id: 00112233aabbccdd\n"
                + "data: {\"delta\":\"Hi\"}\n"
                + "timestamp: 2025-01-01T00:00:00Z\n"
                + "\n");
    }

    @Test
    void splitsMultiLineData() {
        SseFrame frame = new SseFrame("error", "id", "line1\nline2", Instant.EPOCH);

        assertThat(frame.render()).contains("data: line1\ndata: line2\n");
    }

    @Test
    void renderedEventParsesBack() throws Exception {
        RelayEvent event = RelayEvent.of(EventType.HEARTBEAT, Map.of("connectionId", "c1"), Instant.parse("2025-01-01T00:00:05Z"));
        String wire = SseFrame.of(event, new JacksonJsonCodec()).render();

        try (SseParser parser = new SseParser(new ByteArrayInputStream(wire.getBytes(StandardCharsets.UTF_8)))) {
            SseParser.Event parsed = parser.next();
            assertThat(parsed.eventType()).isEqualTo("heartbeat");
            assertThat(parsed.id()).isEqualTo(event.eventId());
            assertThat(parsed.data()).isEqualTo("{\"connectionId\":\"c1\"}");
            assertThat(parsed.timestamp()).isEqualTo(event.timestamp());
        }
    }
}
