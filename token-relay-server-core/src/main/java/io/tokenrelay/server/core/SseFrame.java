package io.tokenrelay.server.core;

import io.tokenrelay.core.Protocol;
import io.tokenrelay.core.RelayEvent;
import io.tokenrelay.json.spi.JsonCodec;
import io.tokenrelay.json.spi.JsonException;

import java.time.Instant;
import java.util.Objects;

/**
 * Server-Sent Events (SSE) frame for one {@link RelayEvent}.
 *
 * <p>Fields are rendered in the order {@code event}, {@code id}, {@code data},
 * {@code timestamp}, followed by a blank line.
 */
public final class SseFrame {
    private final String event;
    private final String id;
    private final String data;
    private final Instant timestamp;

    public SseFrame(String event, String id, String data, Instant timestamp) {
        this.event = Objects.requireNonNull(event, "event");
        this.id = Objects.requireNonNull(id, "id");
        this.data = data == null ? "" : data;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    public static SseFrame of(RelayEvent event, JsonCodec json) throws JsonException {
        return new SseFrame(event.type().wireName(), event.eventId(), json.writeString(event.data()), event.timestamp());
    }

    public String event() {
        return event;
    }

    public String id() {
        return id;
    }

    public String data() {
        return data;
    }

    public Instant timestamp() {
        return timestamp;
    }

    /**
     * Render as an SSE event block (without HTTP headers).
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append(Protocol.F_EVENT).append(": ").append(event).append("\n");
        sb.append(Protocol.F_ID).append(": ").append(id).append("\n");
        // data can include newlines; each line must be prefixed with "data:"
        String[] lines = data.split("\r?\n", -1);
        for (String line : lines) {
            sb.append(Protocol.F_DATA).append(": ").append(line).append("\n");
        }
        sb.append(Protocol.F_TIMESTAMP).append(": ").append(timestamp).append("\n");
        sb.append("\n");
        return sb.toString();
    }
}
