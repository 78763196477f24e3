package io.tokenrelay.server.core;

import io.tokenrelay.core.EventType;
import io.tokenrelay.core.RelayEvent;
import io.tokenrelay.server.core.registry.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Publishes events to a connection's {@link EventChannel} and to listeners.
 */
final class EventEmitter {
    private static final Logger log = LoggerFactory.getLogger(EventEmitter.class);

    private final Clock clock;
    private final RelayListeners listeners;

    EventEmitter(Clock clock, RelayListeners listeners) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.listeners = Objects.requireNonNull(listeners, "listeners");
    }

    RelayEvent emit(Connection connection, EventType type, Map<String, Object> data) {
        Instant now = clock.instant();
        RelayEvent event = RelayEvent.of(type, data, now);
        connection.touch(now);
        if (!connection.channel().publish(event)) {
            log.debug("Dropped {} event for closed connection {}", type.wireName(), connection.id());
        }
        listeners.fire(l -> l.eventEmitted(connection.id(), event));
        return event;
    }
}
