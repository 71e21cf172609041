package com.perfsentinel.core.detection;

import java.util.Objects;

/**
 * Computes the E-Divisive divergence statistic Q for every split of a
 * series.
 *
 * <h3>Statistic</h3>
 * <p>
 * For a split at {@code m} (left {@code [0, m)}, right {@code [m, n)}):
 * </p>
 *
 * <pre>
 *   Q(m) = (m(n-m)/n) * (2*cross/(m(n-m)) - left/C(m,2) - right/C(n-m,2))
 * </pre>
 *
 * <p>
 * where {@code cross} sums the distances between the two sides and
 * {@code left}/{@code right} sum the distances within each side. Only
 * {@code 2 <= m <= n-2} is defined.
 * </p>
 *
 * <h3>Sweep</h3>
 * <p>
 * The three sums are computed once for {@code m = 2} and then updated as the
 * boundary moves right: the point crossing from right to left adds its
 * distances to earlier points to {@code left} and to {@code cross}'s losses,
 * and moves its distances to later points from {@code right} into
 * {@code cross}.
 * </p>
 *
 * <p>
 * Callers must pass at least {@value #MIN_LENGTH} values.
 * </p>
 *
 * @see <a href="https://arxiv.org/pdf/1306.4933.pdf">Matteson and James, A
 *      Nonparametric Approach for Multiple Change Point Analysis</a>
 * @since 1.0.0
 */
public final class DistanceEngine {

    /** Smallest series that has a valid split. */
    public static final int MIN_LENGTH = 5;

    /** Smallest side of a split. */
    static final int MIN_SIDE = 2;

    private DistanceEngine() {
        // utility class, not instantiable
    }

    /**
     * Build the difference structure of {@code series}.
     *
     * @param series the values; must not be {@code null}
     * @return the distance context
     */
    public static DistanceContext build(double[] series) {
        Objects.requireNonNull(series, "series must not be null");
        int n = series.length;
        double[][] diffs = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double d = Math.abs(series[i] - series[j]);
                diffs[i][j] = d;
                diffs[j][i] = d;
            }
        }
        return new DistanceContext(diffs);
    }

    /**
     * Compute Q for every valid split.
     *
     * @param context distance context of a series of length {@code n}
     * @return array of length {@code n}; slot {@code m} holds {@code Q(m)} for
     *         {@code 2 <= m <= n-2}, other slots are {@code 0} and meaningless
     * @throws IllegalArgumentException if the series is shorter than
     *                                  {@value #MIN_LENGTH}
     */
    public static double[] sweep(DistanceContext context) {
        Objects.requireNonNull(context, "context must not be null");
        int n = context.size();
        if (n < MIN_LENGTH) {
            throw new IllegalArgumentException(
                    "Q sweep needs at least " + MIN_LENGTH + " values, got: " + n);
        }

        double[] q = new double[n];
        int m = MIN_SIDE;

        double cross = 0;
        double left = 0;
        double right = 0;
        for (int i = 0; i < m; i++) {
            double[] row = context.row(i);
            for (int j = m; j < n; j++) {
                cross += row[j];
            }
            for (int k = i + 1; k < m; k++) {
                left += row[k];
            }
        }
        for (int j = m; j < n; j++) {
            double[] row = context.row(j);
            for (int k = j + 1; k < n; k++) {
                right += row[k];
            }
        }
        q[m] = q(m, n, cross, left, right);

        for (m = MIN_SIDE + 1; m <= n - MIN_SIDE; m++) {
            double[] moving = context.row(m - 1);
            double columnDelta = 0;
            for (int y = 0; y < m - 1; y++) {
                columnDelta += moving[y];
            }
            double rowDelta = 0;
            for (int y = m; y < n; y++) {
                rowDelta += moving[y];
            }

            cross = cross - columnDelta + rowDelta;
            left += columnDelta;
            right -= rowDelta;

            q[m] = q(m, n, cross, left, right);
        }
        return q;
    }

    /**
     * Position of the largest Q among the valid splits, smallest index on
     * ties.
     *
     * @param q output of {@link #sweep(DistanceContext)}
     * @return the best split position
     */
    public static int argMax(double[] q) {
        int best = MIN_SIDE;
        for (int m = MIN_SIDE + 1; m <= q.length - MIN_SIDE; m++) {
            if (q[m] > q[best]) {
                best = m;
            }
        }
        return best;
    }

    static double q(int m, int n, double cross, double left, double right) {
        int r = n - m;
        double leftPairs = pairs(m);
        double rightPairs = pairs(r);
        double within = (leftPairs == 0 ? 0 : left / leftPairs) + (rightPairs == 0 ? 0 : right / rightPairs);
        double scale = (double) m * r / n;
        return scale * (2.0 * cross / ((double) m * r) - within);
    }

    /** C(a, 2), with C(1, 2) = 0. */
    static double pairs(int a) {
        return a < 2 ? 0 : a * (a - 1.0) / 2.0;
    }
}
