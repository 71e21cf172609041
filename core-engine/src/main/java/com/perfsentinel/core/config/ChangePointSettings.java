package com.perfsentinel.core.config;

import com.perfsentinel.core.detection.DecayWeights;
import com.perfsentinel.core.detection.EDivisiveSegmenter;
import com.perfsentinel.core.detection.PermutationSource;
import com.perfsentinel.core.detection.SeededPermutationSource;

import java.io.Serializable;
import java.util.List;

/**
 * E-Divisive parameters.
 *
 * @since 1.0.0
 */
public class ChangePointSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Largest accepted permutation probability. */
    private double significance = EDivisiveSegmenter.DEFAULT_SIGNIFICANCE;

    /** Shuffles per candidate split. */
    private int permutations = EDivisiveSegmenter.DEFAULT_PERMUTATIONS;

    /** Decay of the search for the window that brackets each change point. */
    private double weighting = DecayWeights.DEFAULT_WEIGHTING;

    /** Permutation seed; {@code null} means a fresh source for every series. */
    private Long seed;

    void collectErrors(List<String> errors) {
        if (!(significance > 0 && significance < 1)) {
            errors.add("changePoints.significance must be in (0, 1), got: " + significance);
        }
        if (permutations <= 0) {
            errors.add("changePoints.permutations must be > 0, got: " + permutations);
        }
        if (!(weighting > 0 && weighting < 1)) {
            errors.add("changePoints.weighting must be in (0, 1), got: " + weighting);
        }
    }

    /**
     * @return a new permutation source, seeded when a seed is configured
     */
    public PermutationSource newPermutationSource() {
        return seed != null
                ? SeededPermutationSource.withSeed(seed)
                : SeededPermutationSource.unseeded();
    }

    /**
     * @return a segmenter using these settings and a new permutation source
     */
    public EDivisiveSegmenter newSegmenter() {
        return new EDivisiveSegmenter(significance, permutations, newPermutationSource());
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getSignificance() {
        return significance;
    }

    public void setSignificance(double significance) {
        this.significance = significance;
    }

    public int getPermutations() {
        return permutations;
    }

    public void setPermutations(int permutations) {
        this.permutations = permutations;
    }

    public double getWeighting() {
        return weighting;
    }

    public void setWeighting(double weighting) {
        this.weighting = weighting;
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    @Override
    public String toString() {
        return "ChangePointSettings{significance=" + significance
                + ", permutations=" + permutations
                + ", weighting=" + weighting
                + ", seed=" + seed + '}';
    }
}
