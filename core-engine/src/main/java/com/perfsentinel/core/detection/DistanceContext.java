package com.perfsentinel.core.detection;

/**
 * Pairwise absolute differences of one series, {@code D[i][j] = |s[i] - s[j]|}.
 *
 * <p>
 * Built by {@link DistanceEngine#build(double[])} for a single segment and
 * consumed by {@link DistanceEngine#sweep(DistanceContext)}. Never shared
 * between segments: a child segment needs its own context.
 * </p>
 *
 * @since 1.0.0
 */
public final class DistanceContext {

    private final double[][] diffs;

    DistanceContext(double[][] diffs) {
        this.diffs = diffs;
    }

    /**
     * @return length of the series the context was built from
     */
    public int size() {
        return diffs.length;
    }

    /**
     * @return {@code |s[i] - s[j]|}
     */
    public double distance(int i, int j) {
        return diffs[i][j];
    }

    double[] row(int i) {
        return diffs[i];
    }
}
