package io.tokenrelay.server.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fan-out to registered {@link RelayListener}s.
 */
public final class RelayListeners {
    private static final Logger log = LoggerFactory.getLogger(RelayListeners.class);

    private final List<RelayListener> listeners = new CopyOnWriteArrayList<>();

    public void add(RelayListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void remove(RelayListener listener) {
        listeners.remove(listener);
    }

    public void fire(Consumer<RelayListener> call) {
        for (RelayListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Relay listener {} failed", listener, e);
            }
        }
    }
}
