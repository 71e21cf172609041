package com.perfsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RegimeStatistics} and {@link ChangeCategory}.
 */
class RegimeStatisticsTest {

    @Test
    @DisplayName("Should describe a sub-range of the series")
    void shouldDescribeRange() {
        double[] values = { 99, 2, 4, 4, 4, 5, 5, 7, 9, 99 };

        RegimeStatistics stats = RegimeStatistics.describe(values, 1, 9);

        assertThat(stats.getNobs()).isEqualTo(8);
        assertThat(stats.getMin()).isEqualTo(2.0);
        assertThat(stats.getMax()).isEqualTo(9.0);
        assertThat(stats.getMean()).isEqualTo(5.0);
        assertThat(stats.getVariance()).isCloseTo(32.0 / 7, within(1e-12));
    }

    @Test
    @DisplayName("A single-point regime should have undefined variance")
    void shouldDescribeSinglePoint() {
        RegimeStatistics stats = RegimeStatistics.describe(new double[] { 3, 8 }, 1, 2);

        assertThat(stats.getMean()).isEqualTo(8.0);
        assertThat(stats.getVariance()).isNaN();
        assertThat(stats.getSkewness()).isZero();
        assertThat(stats.getKurtosis()).isEqualTo(-3.0);
    }

    @Test
    @DisplayName("Should reject empty and out-of-bounds ranges")
    void shouldRejectInvalidRange() {
        assertThatThrownBy(() -> RegimeStatistics.describe(new double[] { 1, 2 }, 1, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RegimeStatistics.describe(new double[] { 1, 2 }, 0, 3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Magnitudes should map onto categories at the documented thresholds")
    void shouldCategorizeMagnitudes() {
        assertThat(ChangeCategory.fromMagnitude(-0.6)).isEqualTo(ChangeCategory.MAJOR_REGRESSION);
        assertThat(ChangeCategory.fromMagnitude(-0.5)).isEqualTo(ChangeCategory.MODERATE_REGRESSION);
        assertThat(ChangeCategory.fromMagnitude(-0.1)).isEqualTo(ChangeCategory.MINOR_REGRESSION);
        assertThat(ChangeCategory.fromMagnitude(0.0)).isEqualTo(ChangeCategory.MINOR_IMPROVEMENT);
        assertThat(ChangeCategory.fromMagnitude(0.3)).isEqualTo(ChangeCategory.MODERATE_IMPROVEMENT);
        assertThat(ChangeCategory.fromMagnitude(Double.POSITIVE_INFINITY)).isEqualTo(ChangeCategory.MAJOR_IMPROVEMENT);
        assertThat(ChangeCategory.fromMagnitude(Double.NaN)).isEqualTo(ChangeCategory.UNCATEGORIZED);
        assertThat(ChangeCategory.MAJOR_REGRESSION.getLabel()).isEqualTo("Major Regression");
    }
}
