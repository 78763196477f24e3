package io.tokenrelay.server.core;

import io.tokenrelay.server.spi.FragmentStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle to a stream running in the background.
 *
 * <p>{@link #cancel()} is cooperative: the consuming loop stops pulling fragments, the
 * upstream is closed and the connection is closed. A flush already in progress finishes.
 */
public final class StreamHandle {
    private static final Logger log = LoggerFactory.getLogger(StreamHandle.class);

    private final String connectionId;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicReference<FragmentStream> upstream = new AtomicReference<>();
    private final CountDownLatch done = new CountDownLatch(1);

    StreamHandle(String connectionId) {
        this.connectionId = connectionId;
    }

    public String connectionId() {
        return connectionId;
    }

    /**
     * Requests cancellation. Idempotent.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) return;
        FragmentStream stream = upstream.get();
        if (stream != null) {
            try {
                stream.close();
            } catch (RuntimeException e) {
                log.debug("Closing upstream of {} on cancel failed", connectionId, e);
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isDone() {
        return done.getCount() == 0;
    }

    /**
     * Waits for the stream to finish.
     *
     * @return false on timeout
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return done.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    void attach(FragmentStream stream) {
        upstream.set(stream);
        if (cancelled.get()) {
            stream.close();
        }
    }

    void finished() {
        done.countDown();
    }
}
