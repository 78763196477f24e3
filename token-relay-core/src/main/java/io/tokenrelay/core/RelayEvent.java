package io.tokenrelay.core;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Event delivered to a connection's client.
 *
 * <p>Events are ephemeral: they are emitted once and never persisted by the relay.
 *
 * @param type event type
 * @param data JSON-serializable payload (insertion ordered)
 * @param timestamp emission time
 * @param eventId random 16 hex character identifier
 */
public record RelayEvent(EventType type, Map<String, Object> data, Instant timestamp, String eventId) {

    private static final SecureRandom RANDOM = new SecureRandom();

    public RelayEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(eventId, "eventId");
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /**
     * Creates an event with a fresh random id.
     */
    public static RelayEvent of(EventType type, Map<String, Object> data, Instant timestamp) {
        return new RelayEvent(type, data, timestamp, newEventId());
    }

    public static String newEventId() {
        byte[] bytes = new byte[8];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
