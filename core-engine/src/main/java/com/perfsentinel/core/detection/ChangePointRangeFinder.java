package com.perfsentinel.core.detection;

import com.perfsentinel.core.model.ChangeLocation;
import com.perfsentinel.core.model.ChangeWindow;
import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Narrows each change point down to the pair of positions between which the
 * level actually moved.
 *
 * <h3>Selection</h3>
 * <p>
 * For a change point at {@code index} between a lower bound {@code prev}
 * (the end of the previous window, or {@code 0}) and an upper bound
 * {@code next} (the next change point, or the series length):
 * </p>
 * <ol>
 * <li>the mean behind is taken over {@code [prev, index - 1)}, the mean
 * ahead over {@code [index + 1, next)}</li>
 * <li>equal means leave the window at {@code (index, index)}</li>
 * <li>otherwise the {@link ChangeLocation} is the side whose mean the value
 * at {@code index} is further from; an empty side takes that value as its
 * mean and fixes the location to the other side</li>
 * <li>candidates within {@value #SEARCH_BOUNDS} position(s) of
 * {@code index} are scored by their weighted squared distance to the mean
 * of the chosen side; the window starts one before the best candidate and
 * is clamped into {@code (prev, next)}</li>
 * </ol>
 *
 * @since 1.0.0
 */
public final class ChangePointRangeFinder {

    private static final Logger LOG = LoggerFactory.getLogger(ChangePointRangeFinder.class);

    /** Candidates considered on the chosen side of the reported index. */
    static final int SEARCH_BOUNDS = 1;

    private ChangePointRangeFinder() {
        // utility class, not instantiable
    }

    /**
     * Compute the window of every change point.
     *
     * @param series        the full series
     * @param sortedIndexes change point indexes, ascending, each in
     *                      {@code [0, series.length)}
     * @param weighting     decay weighting, see {@link DecayWeights}
     * @return one window per index, in the same order
     */
    public static List<ChangeWindow> findWindows(double[] series, int[] sortedIndexes, double weighting) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(sortedIndexes, "sortedIndexes must not be null");

        List<ChangeWindow> windows = new ArrayList<>(sortedIndexes.length);
        int prev = 0;
        for (int k = 0; k < sortedIndexes.length; k++) {
            int next = k + 1 < sortedIndexes.length ? sortedIndexes[k + 1] : series.length;
            ChangeWindow window = select(series, prev, sortedIndexes[k], next, weighting);
            windows.add(window);
            prev = window.getEnd();
        }
        return windows;
    }

    static ChangeWindow select(double[] series, int prev, int index, int next, double weighting) {
        if (next == prev) {
            return new ChangeWindow(index, next, next, ChangeLocation.AHEAD);
        }

        double value = series[index];
        double behindMean = mean(series, prev, index - 1);
        double aheadMean = mean(series, index + 1, next);
        if (behindMean == aheadMean) {
            return new ChangeWindow(index, index, index, ChangeLocation.AHEAD);
        }

        ChangeLocation location;
        if (Double.isNaN(aheadMean)) {
            aheadMean = value;
            location = ChangeLocation.BEHIND;
        } else if (Double.isNaN(behindMean)) {
            behindMean = value;
            location = ChangeLocation.AHEAD;
        } else {
            location = locate(behindMean, value, aheadMean);
        }

        int start;
        int end;
        double reference;
        if (location == ChangeLocation.BEHIND) {
            start = Math.max(index - SEARCH_BOUNDS + 1, prev);
            end = index + 1;
            reference = behindMean;
        } else {
            start = index;
            end = Math.min(index + SEARCH_BOUNDS, next);
            reference = aheadMean;
        }

        int best = bestCandidate(series, start, end, reference, location, weighting);
        // the last candidate is pulled back so the window keeps a position after it
        if (best + 1 == end - start) {
            best--;
        }
        start += best;

        if (start < prev) {
            start = prev + 1;
        }
        if (start > next) {
            start = next - 1;
        }
        LOG.trace("Change point {} in [{}, {}): {} window ({}, {})", index, prev, next, location, start, start + 1);
        return new ChangeWindow(index, start, start + 1, location);
    }

    /**
     * @return {@link ChangeLocation#AHEAD} when {@code value} is strictly
     *         further from the mean ahead than from the mean behind
     */
    static ChangeLocation locate(double behindMean, double value, double aheadMean) {
        return Math.abs(aheadMean - value) > Math.abs(behindMean - value)
                ? ChangeLocation.AHEAD
                : ChangeLocation.BEHIND;
    }

    private static int bestCandidate(double[] series, int start, int end, double reference,
            ChangeLocation location, double weighting) {
        int count = end - start;
        if (count <= 0) {
            return 0;
        }
        double[] weights = DecayWeights.exponential(count, weighting);
        int best = 0;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < count; i++) {
            // weights grow instead of decay when searching ahead
            int slot = location == ChangeLocation.AHEAD ? count - 1 - i : i;
            double weight = weights[Math.min(slot, weights.length - 1)];
            double delta = (series[start + i] - reference) * weight;
            double score = delta * delta;
            if (score > bestScore) {
                bestScore = score;
                best = i;
            }
        }
        return best;
    }

    private static double mean(double[] series, int from, int to) {
        if (to <= from) {
            return Double.NaN;
        }
        return StatUtils.sum(series, from, to - from) / (to - from);
    }
}
