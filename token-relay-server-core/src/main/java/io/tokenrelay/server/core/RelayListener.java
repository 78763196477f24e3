package io.tokenrelay.server.core;

import io.tokenrelay.core.RelayEvent;
import io.tokenrelay.core.RelayException;
import io.tokenrelay.server.spi.ConnectionRecord;

/**
 * Callbacks for relay lifecycle notifications. All methods default to no-ops.
 *
 * <p>Listeners are invoked on relay threads and must not block. A listener that throws is
 * logged and does not affect the relay or other listeners.
 */
public interface RelayListener {

    default void connectionCreated(ConnectionRecord connection) {
    }

    default void connectionClosed(String connectionId) {
    }

    default void streamCompleted(String connectionId, RelayEvent completeEvent) {
    }

    default void streamError(String connectionId, RelayException error) {
    }

    /** Every event emitted to a connection, in emission order. */
    default void eventEmitted(String connectionId, RelayEvent event) {
    }
}
