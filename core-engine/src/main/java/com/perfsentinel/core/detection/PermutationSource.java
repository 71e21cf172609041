package com.perfsentinel.core.detection;

/**
 * Source of random reorderings for the permutation significance test.
 *
 * <p>
 * Injected into {@link EDivisiveSegmenter} so that tests can pin the
 * sequence of permutations with a fixed seed.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface PermutationSource {

    /**
     * Reorder {@code values} in place, uniformly at random.
     *
     * @param values the values to shuffle
     */
    void shuffle(double[] values);
}
