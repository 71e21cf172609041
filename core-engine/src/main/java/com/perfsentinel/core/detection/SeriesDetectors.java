package com.perfsentinel.core.detection;

import com.perfsentinel.core.model.ChangePoint;
import com.perfsentinel.core.model.OutlierResult;

import java.util.List;

/**
 * Entry points of the detection engine.
 *
 * <p>
 * Both operations take a plain series and return plain data. They either
 * return a complete result or throw {@link InvalidInputException}; "nothing
 * found" is a normal result.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesDetectors {

    private SeriesDetectors() {
        // utility class, not instantiable
    }

    /**
     * E-Divisive change points with the default significance and permutation
     * count and an unseeded permutation source.
     */
    public static List<ChangePoint> detectChangePoints(double[] series) {
        return detectChangePoints(series, EDivisiveSegmenter.DEFAULT_SIGNIFICANCE,
                EDivisiveSegmenter.DEFAULT_PERMUTATIONS);
    }

    /**
     * E-Divisive change points with an unseeded permutation source.
     */
    public static List<ChangePoint> detectChangePoints(double[] series, double significance, int permutations) {
        return detectChangePoints(series, significance, permutations, SeededPermutationSource.unseeded());
    }

    /**
     * E-Divisive change points.
     *
     * @param series            the values, in order
     * @param significance      largest accepted permutation probability
     * @param permutations      shuffles per candidate split
     * @param permutationSource source of shuffles
     * @return change points ordered by index
     * @throws InvalidInputException on an empty or non-finite series, or
     *                               invalid parameters
     */
    public static List<ChangePoint> detectChangePoints(double[] series, double significance, int permutations,
            PermutationSource permutationSource) {
        return new EDivisiveSegmenter(significance, permutations, permutationSource).detect(series);
    }

    /**
     * GESD outliers.
     *
     * @param series       the values
     * @param significance test level
     * @param maxOutliers  upper bound on candidates, in {@code [0, n]}
     * @param useMad       median/MAD instead of mean/standard deviation
     * @return the outlier result
     * @throws InvalidInputException on an empty or non-finite series, or
     *                               invalid parameters
     */
    public static OutlierResult detectOutliers(double[] series, double significance, int maxOutliers,
            boolean useMad) {
        return new GesdOutlierDetector(significance, useMad).detect(series, maxOutliers);
    }
}
