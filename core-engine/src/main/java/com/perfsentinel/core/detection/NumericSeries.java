package com.perfsentinel.core.detection;

import org.apache.commons.math3.stat.StatUtils;

import java.util.BitSet;
import java.util.Collection;
import java.util.Objects;

/**
 * Numeric helpers shared by the detectors.
 *
 * @since 1.0.0
 */
public final class NumericSeries {

    private NumericSeries() {
        // utility class, not instantiable
    }

    /**
     * Check that {@code series} can be analysed.
     *
     * @param series the series; must not be {@code null}
     * @throws InvalidInputException if the series is empty or holds a
     *                               {@code NaN} or infinite value
     */
    public static void requireUsable(double[] series) {
        Objects.requireNonNull(series, "series must not be null");
        if (series.length == 0) {
            throw new InvalidInputException("series must not be empty");
        }
        for (int i = 0; i < series.length; i++) {
            if (!Double.isFinite(series[i])) {
                throw new InvalidInputException(
                        "series must only hold finite values, got " + series[i] + " at index " + i);
            }
        }
    }

    /**
     * Express every value as its number of (population) standard deviations
     * from the mean. A constant series standardizes to all zeros.
     *
     * @param series the series
     * @return a new standardized array
     */
    public static double[] standardize(double[] series) {
        requireUsable(series);
        double mean = StatUtils.mean(series);
        double std = Math.sqrt(StatUtils.populationVariance(series, mean));
        double[] result = new double[series.length];
        if (std == 0) {
            return result;
        }
        for (int i = 0; i < series.length; i++) {
            result[i] = (series[i] - mean) / std;
        }
        return result;
    }

    /**
     * Rescale the series to the range {@code [0, 1]}. A constant series
     * normalizes to all zeros.
     *
     * @param series the series
     * @return a new normalized array
     */
    public static double[] normalize(double[] series) {
        requireUsable(series);
        double min = StatUtils.min(series);
        double range = StatUtils.max(series) - min;
        double[] result = new double[series.length];
        if (range == 0) {
            return result;
        }
        for (int i = 0; i < series.length; i++) {
            result[i] = (series[i] - min) / range;
        }
        return result;
    }

    /**
     * Remove the values at {@code indexes}, keeping track of where the
     * surviving values came from.
     *
     * @param series  the series
     * @param indexes positions to drop; each must be a valid index
     * @return the masked series
     * @throws IndexOutOfBoundsException if an index is outside the series
     */
    public static MaskedSeries withoutIndexes(double[] series, Collection<Integer> indexes) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(indexes, "indexes must not be null");

        BitSet masked = new BitSet(series.length);
        for (int index : indexes) {
            Objects.checkIndex(index, series.length);
            masked.set(index);
        }

        int kept = series.length - masked.cardinality();
        double[] values = new double[kept];
        int[] positions = new int[kept];
        int j = 0;
        for (int i = 0; i < series.length; i++) {
            if (!masked.get(i)) {
                values[j] = series[i];
                positions[j] = i;
                j++;
            }
        }
        return new MaskedSeries(values, positions);
    }
}
