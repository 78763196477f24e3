package io.tokenrelay.server.core;

import io.tokenrelay.core.RelayEvent;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ordered queue of events for one connection.
 *
 * <p>The relay publishes from several threads (orchestrator, timers); a single writer per
 * connection drains it. Events published after {@link #close()} are dropped.
 */
public final class EventChannel {

    private final String connectionId;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final ArrayDeque<RelayEvent> pending = new ArrayDeque<>();
    private boolean closed;

    public EventChannel(String connectionId) {
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
    }

    public String connectionId() {
        return connectionId;
    }

    /**
     * @return false if the channel was already closed and the event was dropped
     */
    public boolean publish(RelayEvent event) {
        Objects.requireNonNull(event, "event");
        lock.lock();
        try {
            if (closed) return false;
            pending.addLast(event);
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code timeout} for the next event.
     *
     * @return the next event, or null on timeout or when the channel is closed and drained
     */
    public RelayEvent poll(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            while (pending.isEmpty()) {
                if (closed || nanos <= 0) return null;
                nanos = changed.awaitNanos(nanos);
            }
            return pending.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    public RelayEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        return poll(Duration.ofNanos(unit.toNanos(timeout)));
    }

    /** Removes and returns every pending event without waiting. */
    public List<RelayEvent> drain() {
        lock.lock();
        try {
            List<RelayEvent> out = new ArrayList<>(pending);
            pending.clear();
            return out;
        } finally {
            lock.unlock();
        }
    }

    public void close() {
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /** Closed and nothing left to deliver. */
    public boolean isDrained() {
        lock.lock();
        try {
            return closed && pending.isEmpty();
        } finally {
            lock.unlock();
        }
    }
}
