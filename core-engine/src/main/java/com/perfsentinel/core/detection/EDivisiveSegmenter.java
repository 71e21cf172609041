package com.perfsentinel.core.detection;

import com.perfsentinel.core.model.ChangePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * E-Divisive change-point detection.
 *
 * <p>
 * Splits a series at the position of maximal {@link DistanceEngine Q}, keeps
 * the split only when a permutation test says it is significant, and repeats
 * on both halves until no segment has a significant split left.
 * </p>
 *
 * <h3>Permutation test</h3>
 * <p>
 * A working copy of the segment is shuffled {@code permutations} times with
 * the injected {@link PermutationSource}; every shuffle whose best Q reaches
 * the observed one counts against the split. The probability is
 * {@code above / (permutations + 1)} and a split is accepted when it does not
 * exceed the significance level.
 * </p>
 *
 * <h3>Exploration</h3>
 * <p>
 * Segments are processed from an explicit stack, left half before right
 * half, so that long series cannot exhaust the call stack. Each segment gets
 * its own {@link DistanceContext}.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * The segmenter holds no per-call state but shares its permutation source;
 * it is only as thread-safe as that source.
 * </p>
 *
 * @since 1.0.0
 */
public class EDivisiveSegmenter {

    private static final Logger LOG = LoggerFactory.getLogger(EDivisiveSegmenter.class);

    public static final double DEFAULT_SIGNIFICANCE = 0.05;
    public static final int DEFAULT_PERMUTATIONS = 100;

    private final double significance;
    private final int permutations;
    private final PermutationSource permutationSource;

    /**
     * @param significance      largest accepted permutation probability, in
     *                          {@code (0, 1)}
     * @param permutations      number of shuffles per candidate split,
     *                          positive
     * @param permutationSource source of shuffles
     * @throws InvalidInputException if {@code significance} or
     *                               {@code permutations} is out of range
     */
    public EDivisiveSegmenter(double significance, int permutations, PermutationSource permutationSource) {
        if (!(significance > 0 && significance < 1)) {
            throw new InvalidInputException("significance must be in (0, 1), got: " + significance);
        }
        if (permutations <= 0) {
            throw new InvalidInputException("permutations must be > 0, got: " + permutations);
        }
        this.significance = significance;
        this.permutations = permutations;
        this.permutationSource = Objects.requireNonNull(permutationSource, "permutationSource must not be null");
    }

    /**
     * Segmenter with the default significance and permutation count.
     *
     * @param permutationSource source of shuffles
     */
    public EDivisiveSegmenter(PermutationSource permutationSource) {
        this(DEFAULT_SIGNIFICANCE, DEFAULT_PERMUTATIONS, permutationSource);
    }

    /**
     * Find the change points of {@code series}.
     *
     * @param series the values, in order
     * @return accepted change points sorted by index; empty when there are
     *         none
     * @throws InvalidInputException if the series is empty or not finite
     */
    public List<ChangePoint> detect(double[] series) {
        NumericSeries.requireUsable(series);

        List<ChangePoint> accepted = new ArrayList<>();
        Deque<int[]> pending = new ArrayDeque<>();
        pending.push(new int[] { 0, series.length });

        while (!pending.isEmpty()) {
            int[] bounds = pending.pop();
            int start = bounds[0];
            int end = bounds[1];
            if (end - start < DistanceEngine.MIN_LENGTH) {
                continue;
            }

            double[] segment = Arrays.copyOfRange(series, start, end);
            double[] q = DistanceEngine.sweep(DistanceEngine.build(segment));
            int split = DistanceEngine.argMax(q);
            double statistic = q[split];
            double probability = permutationProbability(segment, statistic);

            if (probability > significance) {
                LOG.trace("Segment [{}, {}): split at {} rejected (q={}, p={})",
                        start, end, start + split, statistic, probability);
                continue;
            }

            ChangePoint point = new ChangePoint(start + split, statistic, probability);
            LOG.debug("Segment [{}, {}): change point {}", start, end, point);
            accepted.add(point);

            // right pushed first so the left half is explored first
            pending.push(new int[] { start + split, end });
            pending.push(new int[] { start, start + split });
        }

        accepted.sort(ChangePoint.BY_INDEX);
        return accepted;
    }

    public double getSignificance() {
        return significance;
    }

    public int getPermutations() {
        return permutations;
    }

    // ---------------------------------------------------------------
    // Permutation test
    // ---------------------------------------------------------------

    private double permutationProbability(double[] segment, double observed) {
        double[] shuffled = segment.clone();
        int above = 0;
        for (int trial = 0; trial < permutations; trial++) {
            permutationSource.shuffle(shuffled);
            double[] q = DistanceEngine.sweep(DistanceEngine.build(shuffled));
            if (q[DistanceEngine.argMax(q)] >= observed) {
                above++;
            }
        }
        return above / (permutations + 1.0);
    }
}
