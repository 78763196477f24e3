package io.tokenrelay.server.core.transform;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Running compression statistics per algorithm. Thread-safe.
 */
public final class CompressionHistory {

    /**
     * Totals for one algorithm.
     *
     * @param samples number of compressions recorded
     * @param inputBytes total bytes before compression
     * @param outputBytes total bytes after compression
     * @param nanos total time spent compressing
     */
    public record Stats(long samples, long inputBytes, long outputBytes, long nanos) {
        /** Compressed size over original size; below 1 means the data shrank. */
        public double averageRatio() {
            return inputBytes == 0 ? 1.0 : (double) outputBytes / inputBytes;
        }

        /** Input bytes per millisecond. */
        public double throughput() {
            double millis = nanos / 1_000_000.0;
            return millis <= 0 ? 0.0 : inputBytes / millis;
        }

        Stats plus(int in, int out, long elapsed) {
            return new Stats(samples + 1, inputBytes + in, outputBytes + out, nanos + elapsed);
        }
    }

    private final Map<String, Stats> byAlgorithm = new ConcurrentHashMap<>();

    public void record(String algorithm, int inputBytes, int outputBytes, long nanos) {
        Objects.requireNonNull(algorithm, "algorithm");
        byAlgorithm.merge(algorithm, new Stats(1, inputBytes, outputBytes, nanos),
                (prev, ignored) -> prev.plus(inputBytes, outputBytes, nanos));
    }

    public Stats stats(String algorithm) {
        return byAlgorithm.getOrDefault(algorithm, new Stats(0, 0, 0, 0));
    }

    /** Sorted copy of all recorded statistics. */
    public Map<String, Stats> snapshot() {
        return new TreeMap<>(byAlgorithm);
    }
}
