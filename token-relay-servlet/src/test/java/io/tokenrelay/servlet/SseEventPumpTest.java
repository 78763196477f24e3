package io.tokenrelay.servlet;

import io.tokenrelay.core.EventType;
import io.tokenrelay.core.RelayEvent;
import io.tokenrelay.core.SseParser;
import io.tokenrelay.json.jackson.JacksonJsonCodec;
import io.tokenrelay.server.core.EventChannel;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SseEventPumpTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private final SseEventPump pump = new SseEventPump(new JacksonJsonCodec(), Duration.ofMillis(10));

    @Test
    void writesFramesUntilTerminalEvent() throws Exception {
        EventChannel channel = new EventChannel("c1");
        channel.publish(RelayEvent.of(EventType.START, Map.of("connectionId", "c1"), NOW));
        channel.publish(RelayEvent.of(EventType.CHUNK, Map.of("delta", "Hi", "sequence", 0), NOW));
        channel.publish(RelayEvent.of(EventType.COMPLETE, Map.of("finishReason", "stop"), NOW));
        channel.publish(RelayEvent.of(EventType.HEARTBEAT, Map.of(), NOW));
        CountingOutputStream out = new CountingOutputStream();

        assertThat(pump.pump(channel, out)).isEqualTo(3);
        assertThat(out.flushes).isEqualTo(3);

        List<SseParser.Event> events = parse(out.toByteArray());
        assertThat(events).extracting(SseParser.Event::eventType).containsExactly("start", "chunk", "complete");
        assertThat(events.get(1).data()).contains("\"delta\":\"Hi\"");
        assertThat(events).allSatisfy(e -> assertThat(e.timestamp()).isEqualTo(NOW));
        assertThat(events).extracting(SseParser.Event::id).doesNotContainNull().doesNotHaveDuplicates();
    }

    @Test
    void stopsWhenChannelClosesWithoutTerminalEvent() throws Exception {
        EventChannel channel = new EventChannel("c1");
        channel.publish(RelayEvent.of(EventType.START, Map.of("connectionId", "c1"), NOW));
        channel.close();
        CountingOutputStream out = new CountingOutputStream();

        assertThat(pump.pump(channel, out)).isEqualTo(1);
    }

    @Test
    void propagatesClientWriteFailure() {
        EventChannel channel = new EventChannel("c1");
        channel.publish(RelayEvent.of(EventType.START, Map.of("connectionId", "c1"), NOW));
        OutputStream broken = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("Broken pipe");
            }
        };

        assertThatThrownBy(() -> pump.pump(channel, broken)).isInstanceOf(IOException.class);
    }

    private static List<SseParser.Event> parse(byte[] bytes) throws IOException {
        List<SseParser.Event> events = new ArrayList<>();
        try (SseParser parser = new SseParser(new ByteArrayInputStream(bytes))) {
            SseParser.Event event;
            while ((event = parser.next()) != null) {
                events.add(event);
            }
        }
        return events;
    }

    private static final class CountingOutputStream extends ByteArrayOutputStream {
        int flushes;

        @Override
        public void flush() {
            flushes++;
        }
    }
}
