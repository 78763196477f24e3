package io.tokenrelay.server.core;

import io.tokenrelay.server.spi.BufferRecord;
import io.tokenrelay.server.spi.ChunkBatch;
import io.tokenrelay.server.spi.ConnectionRecord;
import io.tokenrelay.server.spi.RelayStore;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory store whose batch writes (and optionally connection inserts) can be switched to fail
 * or held until a test lets them continue.
 */
public final class FailingRelayStore implements RelayStore {
    private final InMemoryRelayStore delegate = new InMemoryRelayStore();
    private final AtomicInteger failedBatchWrites = new AtomicInteger();
    private volatile boolean failBatches;
    private volatile boolean failConnections;
    private volatile CountDownLatch batchEntered;
    private volatile CountDownLatch batchProceed;

    public void failBatches(boolean fail) {
        this.failBatches = fail;
    }

    public void failConnections(boolean fail) {
        this.failConnections = fail;
    }

    /** The next batch writes count down {@code entered} and then wait for {@code proceed}. */
    public void holdBatches(CountDownLatch entered, CountDownLatch proceed) {
        this.batchEntered = entered;
        this.batchProceed = proceed;
    }

    public int failedBatchWrites() {
        return failedBatchWrites.get();
    }

    @Override
    public void saveConnection(ConnectionRecord connection) throws IOException {
        if (failConnections) throw new IOException("store unavailable");
        delegate.saveConnection(connection);
    }

    @Override
    public void updateConnection(ConnectionRecord connection) {
        delegate.updateConnection(connection);
    }

    @Override
    public Optional<ConnectionRecord> findConnection(String connectionId) {
        return delegate.findConnection(connectionId);
    }

    @Override
    public void saveChunkBatch(ChunkBatch batch) throws IOException, InterruptedException {
        CountDownLatch proceed = batchProceed;
        if (proceed != null) {
            batchEntered.countDown();
            proceed.await();
        }
        if (failBatches) {
            failedBatchWrites.incrementAndGet();
            throw new IOException("disk full");
        }
        delegate.saveChunkBatch(batch);
    }

    @Override
    public List<ChunkBatch> findChunkBatches(String connectionId) {
        return delegate.findChunkBatches(connectionId);
    }

    @Override
    public void saveBuffer(BufferRecord buffer) {
        delegate.saveBuffer(buffer);
    }

    @Override
    public void updateBuffer(BufferRecord buffer) {
        delegate.updateBuffer(buffer);
    }
}
