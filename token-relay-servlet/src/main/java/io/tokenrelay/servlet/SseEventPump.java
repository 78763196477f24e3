package io.tokenrelay.servlet;

import io.tokenrelay.core.EventType;
import io.tokenrelay.core.RelayEvent;
import io.tokenrelay.json.spi.JsonCodec;
import io.tokenrelay.json.spi.JsonException;
import io.tokenrelay.server.core.EventChannel;
import io.tokenrelay.server.core.SseFrame;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Copies events from a connection's channel to an output stream as SSE frames, flushing after
 * every frame. Stops after a terminal event or once the channel is closed and drained.
 */
final class SseEventPump {

    private final JsonCodec json;
    private final Duration pollInterval;

    SseEventPump(JsonCodec json, Duration pollInterval) {
        this.json = json;
        this.pollInterval = pollInterval;
    }

    /**
     * @return number of frames written
     * @throws IOException when the client can no longer be written to
     */
    int pump(EventChannel channel, OutputStream out) throws IOException, InterruptedException, JsonException {
        int written = 0;
        while (true) {
            RelayEvent event = channel.poll(pollInterval);
            if (event == null) {
                if (channel.isClosed() && channel.isDrained()) return written;
                continue;
            }
            out.write(SseFrame.of(event, json).render().getBytes(StandardCharsets.UTF_8));
            out.flush();
            written++;
            if (event.type() == EventType.COMPLETE || event.type() == EventType.ERROR) return written;
        }
    }
}
