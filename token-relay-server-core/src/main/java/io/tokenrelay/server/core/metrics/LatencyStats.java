package io.tokenrelay.server.core.metrics;

import java.util.Arrays;
import java.util.Collection;

/**
 * Distribution of latency samples in milliseconds. Percentiles interpolate linearly between
 * the closest ranks.
 */
public record LatencyStats(double min, double max, double average, double p95, double p99) {

    public static final LatencyStats EMPTY = new LatencyStats(0, 0, 0, 0, 0);

    public static LatencyStats of(Collection<Double> samplesMillis) {
        if (samplesMillis.isEmpty()) return EMPTY;
        double[] sorted = samplesMillis.stream().mapToDouble(Double::doubleValue).sorted().toArray();
        double sum = Arrays.stream(sorted).sum();
        return new LatencyStats(sorted[0], sorted[sorted.length - 1], sum / sorted.length,
                percentile(sorted, 0.95), percentile(sorted, 0.99));
    }

    static double percentile(double[] sorted, double fraction) {
        if (sorted.length == 1) return sorted[0];
        double rank = fraction * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (rank - lower);
    }
}
