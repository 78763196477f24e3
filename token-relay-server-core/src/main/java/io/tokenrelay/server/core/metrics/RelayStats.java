package io.tokenrelay.server.core.metrics;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lifetime counters of the relay process.
 */
public final class RelayStats {
    /** Request ids remembered for reconnection counting; the least recently seen are forgotten first. */
    public static final int DEFAULT_REMEMBERED_REQUESTS = 10_000;

    private final AtomicLong created = new AtomicLong();
    private final AtomicLong reconnections = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong errored = new AtomicLong();
    private final AtomicLong closed = new AtomicLong();
    private final Map<String, Boolean> seenRequests;

    public RelayStats() {
        this(DEFAULT_REMEMBERED_REQUESTS);
    }

    public RelayStats(int rememberedRequests) {
        if (rememberedRequests < 1) {
            throw new IllegalArgumentException("rememberedRequests must be positive");
        }
        this.seenRequests = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > rememberedRequests;
            }
        };
    }

    /**
     * Counts a new connection; a request id seen before counts as a reconnection.
     */
    public void connectionCreated(String requestId) {
        created.incrementAndGet();
        boolean seen;
        synchronized (seenRequests) {
            seen = seenRequests.put(requestId, Boolean.TRUE) != null;
        }
        if (seen) {
            reconnections.incrementAndGet();
        }
    }

    public void connectionClosed() {
        closed.incrementAndGet();
    }

    public void streamCompleted() {
        completed.incrementAndGet();
    }

    public void streamErrored() {
        errored.incrementAndGet();
    }

    /** Number of request ids currently remembered. */
    public int rememberedRequests() {
        synchronized (seenRequests) {
            return seenRequests.size();
        }
    }

    public long created() {
        return created.get();
    }

    public long reconnections() {
        return reconnections.get();
    }

    public long completed() {
        return completed.get();
    }

    public long errored() {
        return errored.get();
    }

    public long closed() {
        return closed.get();
    }

    /** Errored streams over finished streams. */
    public double errorRate() {
        long finished = completed.get() + errored.get();
        return finished == 0 ? 0.0 : (double) errored.get() / finished;
    }

    /** Completed streams over finished streams. */
    public double completionRate() {
        long finished = completed.get() + errored.get();
        return finished == 0 ? 0.0 : (double) completed.get() / finished;
    }

    /** Reconnections over created connections. */
    public double reconnectionRate() {
        long total = created.get();
        return total == 0 ? 0.0 : (double) reconnections.get() / total;
    }
}
