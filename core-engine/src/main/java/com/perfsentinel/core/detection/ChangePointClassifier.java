package com.perfsentinel.core.detection;

import com.perfsentinel.core.model.ChangeCategory;
import com.perfsentinel.core.model.ChangePoint;
import com.perfsentinel.core.model.ChangeWindow;
import com.perfsentinel.core.model.ClassifiedChangePoint;
import com.perfsentinel.core.model.RegimeStatistics;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Locates the window of each change point, describes the regimes around it
 * and buckets the shift.
 *
 * <p>
 * Windows come from {@link ChangePointRangeFinder}. The regime before a
 * change point runs from the end of the previous window (or the start of
 * the series) up to the start of its own window; the regime after runs from
 * the end of its window up to the start of the next window (or the end of
 * the series). The positions inside a window belong to neither regime.
 * </p>
 *
 * <h3>Magnitude</h3>
 * <p>
 * {@code log(next / previous)} of the regime means when both are
 * non-negative, {@code log(previous / next)} otherwise, so a negative
 * magnitude is always a regression for throughput-like series and for
 * latency-like series (reported as negative values) alike.
 * </p>
 *
 * @since 1.0.0
 */
public final class ChangePointClassifier {

    private ChangePointClassifier() {
        // utility class, not instantiable
    }

    /**
     * Classify with the default {@link DecayWeights#DEFAULT_WEIGHTING}.
     *
     * @see #classify(double[], List, List, double)
     */
    public static List<ClassifiedChangePoint> classify(double[] series, List<ChangePoint> changePoints,
            List<String> revisions) {
        return classify(series, changePoints, revisions, DecayWeights.DEFAULT_WEIGHTING);
    }

    /**
     * Classify {@code changePoints} against {@code series}.
     *
     * @param series       the full series the change points refer to
     * @param changePoints change points, in any order; indexes must lie in
     *                     {@code [0, series.length)}
     * @param revisions    revision of every position, or an empty list when
     *                     unknown
     * @param weighting    decay weighting of the window search
     * @return classified change points sorted by index
     * @throws IllegalArgumentException if a change point lies outside the
     *                                  series, revisions do not match it or
     *                                  the weighting is not in {@code (0, 1)}
     */
    public static List<ClassifiedChangePoint> classify(double[] series, List<ChangePoint> changePoints,
            List<String> revisions, double weighting) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(changePoints, "changePoints must not be null");
        Objects.requireNonNull(revisions, "revisions must not be null");
        if (!revisions.isEmpty() && revisions.size() != series.length) {
            throw new IllegalArgumentException("Expected " + series.length + " revisions, got: "
                    + revisions.size());
        }
        if (!(weighting > 0 && weighting < 1)) {
            throw new IllegalArgumentException("weighting must be in (0, 1), got: " + weighting);
        }

        List<ChangePoint> sorted = new ArrayList<>(changePoints);
        sorted.sort(ChangePoint.BY_INDEX);
        int[] indexes = new int[sorted.size()];
        for (int k = 0; k < indexes.length; k++) {
            indexes[k] = sorted.get(k).getIndex();
            if (indexes[k] < 0 || indexes[k] >= series.length) {
                throw new IllegalArgumentException("Change point " + indexes[k]
                        + " is outside a series of length " + series.length);
            }
        }
        List<ChangeWindow> windows = ChangePointRangeFinder.findWindows(series, indexes, weighting);

        List<ClassifiedChangePoint> classified = new ArrayList<>(sorted.size());
        for (int k = 0; k < sorted.size(); k++) {
            ChangeWindow window = windows.get(k);
            int previousStart = k == 0 ? 0 : windows.get(k - 1).getEnd();
            int nextEnd = k == windows.size() - 1 ? series.length : windows.get(k + 1).getStart();

            RegimeStatistics previous = regime(series, previousStart, window.getStart());
            RegimeStatistics next = regime(series, window.getEnd(), nextEnd);
            double magnitude = previous == null || next == null
                    ? Double.NaN
                    : magnitude(previous.getMean(), next.getMean());

            classified.add(new ClassifiedChangePoint(sorted.get(k), window,
                    revisionAt(revisions, window.getIndex()),
                    revisionAt(revisions, window.getStart()),
                    revisionAt(revisions, window.getEnd()),
                    previous, next, magnitude, ChangeCategory.fromMagnitude(magnitude)));
        }
        return classified;
    }

    /**
     * Log ratio of two regime means.
     *
     * @param previousMean mean before the change
     * @param nextMean     mean after the change
     * @return the magnitude, possibly infinite
     */
    public static double magnitude(double previousMean, double nextMean) {
        if (previousMean == 0 && nextMean == 0) {
            return 0.0;
        }
        if (previousMean == 0) {
            return Double.POSITIVE_INFINITY;
        }
        if (nextMean == 0) {
            return Double.NEGATIVE_INFINITY;
        }
        if (previousMean >= 0 && nextMean >= 0) {
            return Math.log(nextMean / previousMean);
        }
        return Math.log(previousMean / nextMean);
    }

    private static RegimeStatistics regime(double[] series, int start, int end) {
        int from = Math.max(start, 0);
        int to = Math.min(end, series.length);
        return from < to ? RegimeStatistics.describe(series, from, to) : null;
    }

    private static String revisionAt(List<String> revisions, int index) {
        return index >= 0 && index < revisions.size() ? revisions.get(index) : null;
    }
}
