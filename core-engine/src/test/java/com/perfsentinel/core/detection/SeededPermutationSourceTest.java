package com.perfsentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SeededPermutationSource}.
 */
class SeededPermutationSourceTest {

    @Test
    @DisplayName("Shuffle should keep the same multiset of values")
    void shouldPermute() {
        double[] values = { 1, 2, 3, 4, 5, 6, 7, 8 };

        SeededPermutationSource.withSeed(3).shuffle(values);

        double[] sorted = values.clone();
        Arrays.sort(sorted);
        assertThat(sorted).containsExactly(1, 2, 3, 4, 5, 6, 7, 8);
    }

    @Test
    @DisplayName("Equal seeds should produce equal permutation sequences")
    void shouldBeReproducible() {
        SeededPermutationSource first = SeededPermutationSource.withSeed(1234);
        SeededPermutationSource second = SeededPermutationSource.withSeed(1234);
        double[] a = { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 };
        double[] b = a.clone();

        for (int i = 0; i < 5; i++) {
            first.shuffle(a);
            second.shuffle(b);
            assertThat(a).containsExactly(b);
        }
    }

    @Test
    @DisplayName("Shuffling should eventually move values")
    void shouldReorder() {
        double[] values = { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 };

        SeededPermutationSource.withSeed(5).shuffle(values);

        assertThat(values).isNotEqualTo(new double[] { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 });
    }

    @Test
    @DisplayName("Empty and single-element arrays should be left alone")
    void shouldHandleTrivialArrays() {
        double[] empty = {};
        double[] single = { 42 };

        SeededPermutationSource.unseeded().shuffle(empty);
        SeededPermutationSource.unseeded().shuffle(single);

        assertThat(empty).isEmpty();
        assertThat(single).containsExactly(42);
    }
}
