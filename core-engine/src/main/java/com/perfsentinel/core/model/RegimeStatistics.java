package com.perfsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.io.Serializable;
import java.util.Objects;

/**
 * Descriptive statistics of one regime, the stretch of a series between two
 * neighbouring change points.
 *
 * <p>
 * Variance, skewness and kurtosis are the bias-corrected sample estimates.
 * A single-point regime reports a {@code NaN} variance, a skewness of
 * {@code 0} and a kurtosis of {@code -3}.
 * </p>
 *
 * @since 1.0.0
 */
public final class RegimeStatistics implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int start;
    private final int end;
    private final long nobs;
    private final double min;
    private final double max;
    private final double mean;
    private final double variance;
    private final double skewness;
    private final double kurtosis;

    @JsonCreator
    public RegimeStatistics(@JsonProperty("start") int start,
            @JsonProperty("end") int end,
            @JsonProperty("nobs") long nobs,
            @JsonProperty("min") double min,
            @JsonProperty("max") double max,
            @JsonProperty("mean") double mean,
            @JsonProperty("variance") double variance,
            @JsonProperty("skewness") double skewness,
            @JsonProperty("kurtosis") double kurtosis) {
        this.start = start;
        this.end = end;
        this.nobs = nobs;
        this.min = min;
        this.max = max;
        this.mean = mean;
        this.variance = variance;
        this.skewness = skewness;
        this.kurtosis = kurtosis;
    }

    /**
     * Describe {@code values[start, end)}.
     *
     * @param values the series
     * @param start  first index, inclusive
     * @param end    last index, exclusive; must be greater than {@code start}
     * @return statistics of the range
     * @throws IllegalArgumentException if the range is empty or out of bounds
     */
    public static RegimeStatistics describe(double[] values, int start, int end) {
        Objects.requireNonNull(values, "values must not be null");
        if (start < 0 || end > values.length || start >= end) {
            throw new IllegalArgumentException("Invalid regime range [" + start + ", " + end
                    + ") for a series of length " + values.length);
        }
        if (end - start == 1) {
            double only = values[start];
            return new RegimeStatistics(start, end, 1, only, only, only, Double.NaN, 0.0, -3.0);
        }

        DescriptiveStatistics stats = new DescriptiveStatistics();
        for (int i = start; i < end; i++) {
            stats.addValue(values[i]);
        }
        return new RegimeStatistics(start, end, stats.getN(), stats.getMin(), stats.getMax(),
                stats.getMean(), stats.getVariance(), stats.getSkewness(), stats.getKurtosis());
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public long getNobs() {
        return nobs;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getMean() {
        return mean;
    }

    public double getVariance() {
        return variance;
    }

    public double getSkewness() {
        return skewness;
    }

    public double getKurtosis() {
        return kurtosis;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RegimeStatistics that))
            return false;
        return start == that.start && end == that.end && nobs == that.nobs
                && Double.compare(mean, that.mean) == 0
                && Double.compare(variance, that.variance) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, nobs, mean, variance);
    }

    @Override
    public String toString() {
        return "RegimeStatistics{" +
                "range=[" + start + ", " + end + ")" +
                ", nobs=" + nobs +
                ", mean=" + mean +
                ", variance=" + variance +
                '}';
    }
}
