package io.tokenrelay.core;

import java.util.Locale;

/**
 * Event types emitted to a connection's client.
 */
public enum EventType {
    /** Stream accepted and upstream consumption started. */
    START,

    /** One upstream fragment. */
    CHUNK,

    /** Liveness signal carrying running counters. */
    HEARTBEAT,

    /** Upstream finished; carries totals. Emitted at most once per connection. */
    COMPLETE,

    /** Upstream failed; carries a message and a machine-readable code. */
    ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EventType fromWireName(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
