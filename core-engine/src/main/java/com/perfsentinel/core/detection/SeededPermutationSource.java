package com.perfsentinel.core.detection;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.RandomGeneratorFactory;

import java.util.Objects;
import java.util.Random;

/**
 * Fisher-Yates shuffling driven by a commons-math {@link RandomGenerator}.
 *
 * <p>
 * Instances are <strong>not</strong> thread-safe; give each concurrent
 * detection its own source.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeededPermutationSource implements PermutationSource {

    private final RandomGenerator rng;

    public SeededPermutationSource(RandomGenerator rng) {
        this.rng = Objects.requireNonNull(rng, "rng must not be null");
    }

    /**
     * @param seed generator seed
     * @return a reproducible source
     */
    public static SeededPermutationSource withSeed(long seed) {
        return new SeededPermutationSource(RandomGeneratorFactory.createRandomGenerator(new Random(seed)));
    }

    /**
     * @return a source seeded from the system clock
     */
    public static SeededPermutationSource unseeded() {
        return new SeededPermutationSource(RandomGeneratorFactory.createRandomGenerator(new Random()));
    }

    @Override
    public void shuffle(double[] values) {
        for (int i = values.length - 1; i > 0; i--) {
            int j = rng.nextInt(i + 1);
            double tmp = values[i];
            values[i] = values[j];
            values[j] = tmp;
        }
    }
}
