package com.perfsentinel.core.detection;

import org.apache.commons.math3.distribution.ExponentialDistribution;

/**
 * Decaying weights that favour positions close to a reference point.
 *
 * <h3>Shape</h3>
 * <p>
 * {@code min(size, 100)} points are spread evenly over
 * {@code [1, F^-1(1 - weighting)]} of the unit exponential distribution;
 * every tenth density value is kept and the result is scaled so the first
 * weight is {@code 1}. The default weighting of {@code 0.001} gives roughly
 * {@code 1, 0.55, 0.30, 0.17, ...}; a smaller weighting decays faster.
 * </p>
 *
 * @since 1.0.0
 */
public final class DecayWeights {

    public static final double DEFAULT_WEIGHTING = 0.001;

    private static final int MAX_POINTS = 100;
    private static final int STRIDE = 10;

    private static final ExponentialDistribution UNIT_EXPONENTIAL = new ExponentialDistribution(null, 1.0);

    private DecayWeights() {
        // utility class, not instantiable
    }

    /**
     * @param size      number of positions to weigh; must be positive
     * @param weighting tail probability in {@code (0, 1)}
     * @return weights in decreasing order, starting at {@code 1}; callers
     *         reverse them to grow instead of decay
     * @throws IllegalArgumentException if an argument is out of range
     */
    public static double[] exponential(int size, double weighting) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be > 0, got: " + size);
        }
        if (!(weighting > 0 && weighting < 1)) {
            throw new IllegalArgumentException("weighting must be in (0, 1), got: " + weighting);
        }
        int points = Math.min(size, MAX_POINTS);
        double upper = UNIT_EXPONENTIAL.inverseCumulativeProbability(1 - weighting);
        double step = points == 1 ? 0.0 : (upper - 1.0) / (points - 1);

        double[] weights = new double[(points + STRIDE - 1) / STRIDE];
        double first = UNIT_EXPONENTIAL.density(1.0);
        for (int k = 0; k < weights.length; k++) {
            weights[k] = UNIT_EXPONENTIAL.density(1.0 + step * k * STRIDE) / first;
        }
        return weights;
    }
}
