package com.perfsentinel.core.detection;

import com.perfsentinel.core.model.OutlierResult;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Generalized Extreme Studentized Deviate (GESD) outlier test.
 *
 * <p>
 * Repeatedly removes the value furthest from the centre of the remaining
 * values, recording its normalized deviation {@code R_i} and the critical
 * value {@code λ_i}. The number of confirmed outliers is the largest
 * {@code i} with {@code R_i > λ_i}; earlier iterations may fail their own
 * threshold and still be confirmed.
 * </p>
 *
 * <h3>Centre and spread</h3>
 * <ul>
 * <li>classical: mean and sample standard deviation</li>
 * <li>robust ({@code useMad}): median and the median absolute deviation
 * scaled by {@value #MAD_CONSISTENCY}</li>
 * </ul>
 *
 * <h3>Early stop</h3>
 * <p>
 * Iteration ends before {@code maxOutliers} when fewer than three values
 * remain or when every remaining value sits on the centre. A deviation over a
 * zero spread scores {@code +Infinity}.
 * </p>
 *
 * <p>
 * Instances are immutable and thread-safe.
 * </p>
 *
 * @see <a href=
 *      "https://www.itl.nist.gov/div898/handbook/eda/section3/eda35h3.htm">NIST
 *      Generalized ESD Test for Outliers</a>
 * @since 1.0.0
 */
public class GesdOutlierDetector {

    private static final Logger LOG = LoggerFactory.getLogger(GesdOutlierDetector.class);

    /** Scales the MAD to the standard deviation of a normal distribution. */
    public static final double MAD_CONSISTENCY = 1.4826;

    /** Share of the series tested when no percentage is configured. */
    public static final double DEFAULT_MAX_OUTLIERS_PERCENTAGE = 0.20;

    private static final int MIN_REMAINING = 3;

    private final double significance;
    private final boolean useMad;

    /**
     * @param significance test level, in {@code (0, 1)}
     * @param useMad       use median/MAD instead of mean/standard deviation
     * @throws InvalidInputException if {@code significance} is out of range
     */
    public GesdOutlierDetector(double significance, boolean useMad) {
        if (!(significance > 0 && significance < 1)) {
            throw new InvalidInputException("significance must be in (0, 1), got: " + significance);
        }
        this.significance = significance;
        this.useMad = useMad;
    }

    /**
     * Run the test.
     *
     * @param series      the values
     * @param maxOutliers upper bound on the number of candidates, in
     *                    {@code [0, series.length]}
     * @return the outlier result; its indexes refer to {@code series}
     * @throws InvalidInputException if the series is empty or not finite, or
     *                               {@code maxOutliers} is out of range
     */
    public OutlierResult detect(double[] series, int maxOutliers) {
        NumericSeries.requireUsable(series);
        int n = series.length;
        if (maxOutliers < 0 || maxOutliers > n) {
            throw new InvalidInputException(
                    "maxOutliers must be in [0, " + n + "], got: " + maxOutliers);
        }

        List<Integer> remaining = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            remaining.add(i);
        }

        List<Integer> order = new ArrayList<>();
        List<Double> statistics = new ArrayList<>();
        List<Double> criticalValues = new ArrayList<>();

        for (int i = 1; i <= maxOutliers && remaining.size() >= MIN_REMAINING; i++) {
            double[] values = new double[remaining.size()];
            for (int k = 0; k < values.length; k++) {
                values[k] = series[remaining.get(k)];
            }
            double center = center(values);
            double spread = spread(values, center);

            int worst = 0;
            double worstDeviation = -1;
            for (int k = 0; k < values.length; k++) {
                double deviation = Math.abs(values[k] - center);
                if (deviation > worstDeviation) {
                    worstDeviation = deviation;
                    worst = k;
                }
            }
            if (worstDeviation == 0) {
                break;
            }

            double statistic = spread == 0 ? Double.POSITIVE_INFINITY : worstDeviation / spread;
            order.add(remaining.remove(worst));
            statistics.add(statistic);
            criticalValues.add(criticalValue(n, i));
        }

        int confirmed = 0;
        for (int i = order.size(); i >= 1; i--) {
            if (statistics.get(i - 1) > criticalValues.get(i - 1)) {
                confirmed = i;
                break;
            }
        }

        LOG.debug("GESD over {} values (mad={}): {} candidates, {} confirmed",
                n, useMad, order.size(), confirmed);
        return new OutlierResult(order, confirmed, statistics, criticalValues);
    }

    /**
     * Critical value {@code λ_i} of the {@code i}-th iteration over a series
     * of length {@code n}.
     */
    double criticalValue(int n, int i) {
        double p = 1 - significance / (2.0 * (n - i + 1));
        double t = new TDistribution(n - i - 1).inverseCumulativeProbability(p);
        return (n - i) * t / Math.sqrt((n - i - 1 + t * t) * (n - i + 1));
    }

    /**
     * Number of candidates to test for a series of {@code length} values.
     *
     * @param length     series length
     * @param percentage share of the series in {@code [0, 1]}; {@code 0}
     *                   selects {@value #DEFAULT_MAX_OUTLIERS_PERCENTAGE}
     * @return {@code floor(length * percentage)} clamped to
     *         {@code [1, length - 1]}, or {@code 0} for an empty series
     * @throws InvalidInputException if {@code percentage} is outside
     *                               {@code [0, 1]}
     */
    public static int maxOutliersFor(int length, double percentage) {
        if (!(percentage >= 0 && percentage <= 1)) {
            throw new InvalidInputException("percentage must be in [0, 1], got: " + percentage);
        }
        if (length <= 0) {
            return 0;
        }
        double share = percentage == 0 ? DEFAULT_MAX_OUTLIERS_PERCENTAGE : percentage;
        int max = (int) Math.floor(length * share);
        return Math.max(1, Math.min(max, length - 1));
    }

    public double getSignificance() {
        return significance;
    }

    public boolean isUseMad() {
        return useMad;
    }

    // ---------------------------------------------------------------
    // Centre and spread
    // ---------------------------------------------------------------

    private double center(double[] values) {
        return useMad ? new Median().evaluate(values) : new Mean().evaluate(values);
    }

    private double spread(double[] values, double center) {
        if (!useMad) {
            return new StandardDeviation(true).evaluate(values, center);
        }
        double[] deviations = new double[values.length];
        for (int k = 0; k < values.length; k++) {
            deviations[k] = Math.abs(values[k] - center);
        }
        return MAD_CONSISTENCY * new Median().evaluate(deviations);
    }
}
