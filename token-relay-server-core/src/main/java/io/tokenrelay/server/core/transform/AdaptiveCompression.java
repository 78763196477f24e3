package io.tokenrelay.server.core.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Picks a concrete compression per payload.
 *
 * <p>Payloads under 1 KiB use gzip. Under 10 KiB gzip and deflate compete; larger payloads
 * also try brotli when its native library is available. Each size class learns from its own
 * trials: once every candidate has {@value #LEARNING_SAMPLES} recorded trials, the best
 * average ratio is chosen without compressing the sample again, and a fresh trial runs once
 * every {@value #RETRIAL_EVERY} decisions. Trials are also recorded in the shared
 * {@link CompressionHistory}.
 */
public final class AdaptiveCompression implements CompressionStrategy {
    public static final String NAME = "adaptive";

    static final int SMALL_PAYLOAD = 1024;
    static final int MEDIUM_PAYLOAD = 10 * 1024;
    static final int LEARNING_SAMPLES = 8;
    static final int RETRIAL_EVERY = 64;

    private static final List<CompressionStrategy> MEDIUM_CANDIDATES =
            List.of(GzipCompression.INSTANCE, DeflateCompression.INSTANCE);

    private final List<CompressionStrategy> candidates;
    private final CompressionHistory history;
    private final CompressionHistory mediumTrials = new CompressionHistory();
    private final CompressionHistory largeTrials = new CompressionHistory();
    private final AtomicLong mediumDecisions = new AtomicLong();
    private final AtomicLong largeDecisions = new AtomicLong();

    public AdaptiveCompression(CompressionHistory history) {
        this(defaultCandidates(), history);
    }

    public AdaptiveCompression(List<CompressionStrategy> candidates, CompressionHistory history) {
        if (candidates.isEmpty()) throw new IllegalArgumentException("candidates must not be empty");
        this.candidates = List.copyOf(candidates);
        this.history = Objects.requireNonNull(history, "history");
    }

    static List<CompressionStrategy> defaultCandidates() {
        List<CompressionStrategy> all = new ArrayList<>(MEDIUM_CANDIDATES);
        if (BrotliCompression.isAvailable()) all.add(BrotliCompression.INSTANCE);
        return all;
    }

    @Override
    public String name() {
        return NAME;
    }

    /**
     * @param sample a payload representative of what will be compressed; its size selects the class
     */
    @Override
    public CompressionStrategy resolve(byte[] sample) {
        if (sample.length < SMALL_PAYLOAD) {
            return GzipCompression.INSTANCE;
        }
        boolean medium = sample.length < MEDIUM_PAYLOAD;
        List<CompressionStrategy> trial = medium ? MEDIUM_CANDIDATES : candidates;
        CompressionHistory trials = medium ? mediumTrials : largeTrials;
        long decision = (medium ? mediumDecisions : largeDecisions).incrementAndGet();

        CompressionStrategy learned = learned(trial, trials);
        if (learned != null && decision % RETRIAL_EVERY != 0) {
            return learned;
        }
        CompressionStrategy best = GzipCompression.INSTANCE;
        int bestSize = Integer.MAX_VALUE;
        for (CompressionStrategy candidate : trial) {
            long start = System.nanoTime();
            int size = candidate.compress(sample).length;
            long elapsed = System.nanoTime() - start;
            history.record(candidate.name(), sample.length, size, elapsed);
            trials.record(candidate.name(), sample.length, size, elapsed);
            if (size < bestSize) {
                bestSize = size;
                best = candidate;
            }
        }
        return best;
    }

    private static CompressionStrategy learned(List<CompressionStrategy> trial, CompressionHistory trials) {
        CompressionStrategy best = null;
        double bestRatio = Double.MAX_VALUE;
        for (CompressionStrategy candidate : trial) {
            CompressionHistory.Stats stats = trials.stats(candidate.name());
            if (stats.samples() < LEARNING_SAMPLES) return null;
            if (stats.averageRatio() < bestRatio) {
                bestRatio = stats.averageRatio();
                best = candidate;
            }
        }
        return best;
    }

    @Override
    public byte[] compress(byte[] input) {
        return resolve(input).compress(input);
    }

    /**
     * Output of {@link #compress} is gzip, zlib or brotli. Gzip and zlib are recognised by their
     * headers; anything else, or a header that fails to decode, is read as brotli.
     */
    @Override
    public byte[] decompress(byte[] input) {
        CompressionStrategy detected = Compressions.detect(input);
        if (detected == IdentityCompression.INSTANCE) {
            return BrotliCompression.INSTANCE.decompress(input);
        }
        try {
            return detected.decompress(input);
        } catch (RuntimeException e) {
            if (!BrotliCompression.isAvailable()) throw e;
            return BrotliCompression.INSTANCE.decompress(input);
        }
    }

    public CompressionHistory history() {
        return history;
    }
}
