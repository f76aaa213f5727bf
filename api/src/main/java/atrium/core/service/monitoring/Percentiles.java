package atrium.core.service.monitoring;

import java.util.Arrays;

/**
 * Nearest-rank percentiles over sorted samples.
 */
public final class Percentiles {

    private Percentiles() {}

    /**
     * Value at {@code floor(p * n)} of the sorted samples, clamped to the last index.
     *
     * @param sorted samples in ascending order
     * @param p      percentile in {@code [0, 1]}
     * @return the percentile, or 0 for no samples
     */
    public static long percentile(long[] sorted, double p) {
        if (sorted.length == 0) {
            return 0;
        }
        if (p < 0.0 || p > 1.0) {
            throw new IllegalArgumentException("Percentile must be within [0, 1]: " + p);
        }
        final var index = (int) Math.floor(p * sorted.length);
        return sorted[Math.min(index, sorted.length - 1)];
    }

    /**
     * @return a sorted copy of the samples
     */
    public static long[] sorted(long[] samples) {
        final var copy = Arrays.copyOf(samples, samples.length);
        Arrays.sort(copy);
        return copy;
    }
}
