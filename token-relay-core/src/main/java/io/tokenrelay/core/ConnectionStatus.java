package io.tokenrelay.core;

import java.util.Locale;

/**
 * Lifecycle status of a relay connection.
 *
 * <p>Transitions: {@code CONNECTING -> STREAMING -> (COMPLETED | ERROR)}, followed by
 * {@code DISCONNECTED} once the connection is closed. Any state may move straight to
 * {@code DISCONNECTED} on explicit close or idle eviction.
 */
public enum ConnectionStatus {
    CONNECTING,
    STREAMING,
    COMPLETED,
    ERROR,
    DISCONNECTED;

    /**
     * Wire/storage name ({@code "streaming"}, {@code "completed"}, ...).
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR || this == DISCONNECTED;
    }

    public static ConnectionStatus fromWireName(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
