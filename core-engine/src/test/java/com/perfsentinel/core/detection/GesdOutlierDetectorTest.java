package com.perfsentinel.core.detection;

import com.perfsentinel.core.model.OutlierResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link GesdOutlierDetector}.
 */
class GesdOutlierDetectorTest {

    private static final double[] PATTERN = { 10.0, 10.2, 9.8, 10.1, 9.9 };

    @Test
    @DisplayName("MAD mode should confirm a single extreme value")
    void shouldConfirmSpikeWithMad() {
        OutlierResult result = new GesdOutlierDetector(0.05, true).detect(spikeSeries(), 3);

        assertThat(result.getOrder()).containsExactly(10, 1, 2);
        assertThat(result.getConfirmedCount()).isEqualTo(1);
        assertThat(result.getConfirmedIndexes()).containsExactly(10);
        assertThat(result.getSuspiciousIndexes()).containsExactly(1, 2);
        assertThat(result.getStatistics().get(0)).isCloseTo(6677.46, within(0.01));
        assertThat(result.getStatistics().get(1)).isCloseTo(1.349, within(1e-3));
        assertThat(result.getCriticalValues().get(0)).isCloseTo(2.7082, within(1e-3));
        assertThat(result.getCriticalValues().get(1)).isCloseTo(2.6809, within(1e-3));
        assertThat(result.getCriticalValues().get(2)).isCloseTo(2.6516, within(1e-3));
    }

    @Test
    @DisplayName("Classical mode should confirm the same spike")
    void shouldConfirmSpikeClassically() {
        OutlierResult result = new GesdOutlierDetector(0.05, false).detect(spikeSeries(), 3);

        assertThat(result.getOrder()).containsExactly(10, 1, 6);
        assertThat(result.getConfirmedCount()).isEqualTo(1);
        assertThat(result.getStatistics().get(0)).isCloseTo(4.2485, within(1e-3));
    }

    @Test
    @DisplayName("Confirmed count should be the deepest passing iteration, not the first")
    void shouldUseLargestPassingIteration() {
        double[] series = pattern(10);
        series[3] = 20.0;
        series[7] = 20.0;

        OutlierResult result = new GesdOutlierDetector(0.05, false).detect(series, 3);

        assertThat(result.getOrder()).containsExactly(3, 7, 2);
        // the first removal fails its own threshold, the second passes
        assertThat(result.getStatistics().get(0)).isLessThan(result.getCriticalValues().get(0));
        assertThat(result.getStatistics().get(1)).isGreaterThan(result.getCriticalValues().get(1));
        assertThat(result.getConfirmedCount()).isEqualTo(2);
        assertThat(result.getConfirmedIndexes()).containsExactly(3, 7);
    }

    @Test
    @DisplayName("Should stop when fewer than three values remain")
    void shouldStopOnThreeRemaining() {
        OutlierResult result = new GesdOutlierDetector(0.05, false).detect(new double[] { 1, 2, 3, 100 }, 4);

        assertThat(result.getOrder()).containsExactly(3, 0);
        assertThat(result.getStatistics().get(1)).isCloseTo(1.0, within(1e-9));
        assertThat(result.getConfirmedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Constant series should have no candidates in either mode")
    void shouldFindNothingInConstantSeries() {
        double[] constant = new double[20];
        Arrays.fill(constant, 5.0);

        assertThat(new GesdOutlierDetector(0.05, false).detect(constant, 3)).isEqualTo(OutlierResult.empty());
        assertThat(new GesdOutlierDetector(0.05, true).detect(constant, 3)).isEqualTo(OutlierResult.empty());
    }

    @Test
    @DisplayName("A deviation over zero spread should score infinity")
    void shouldScoreInfinityOverZeroSpread() {
        double[] series = new double[10];
        Arrays.fill(series, 3.0);
        series[4] = 4.0;

        OutlierResult result = new GesdOutlierDetector(0.05, true).detect(series, 1);

        assertThat(result.getOrder()).containsExactly(4);
        assertThat(result.getStatistics().get(0)).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(result.getConfirmedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Zero max outliers should return an empty result")
    void shouldHandleZeroMaxOutliers() {
        OutlierResult result = new GesdOutlierDetector(0.05, false).detect(spikeSeries(), 0);

        assertThat(result.getOrder()).isEmpty();
        assertThat(result.getConfirmedCount()).isZero();
    }

    @Test
    @DisplayName("Critical value should follow the ESD formula")
    void shouldComputeCriticalValue() {
        GesdOutlierDetector detector = new GesdOutlierDetector(0.05, false);

        // n = 12, i = 1: p = 1 - 0.05 / 24, df = 10
        assertThat(detector.criticalValue(12, 1)).isCloseTo(2.4116, within(1e-3));
    }

    @Test
    @DisplayName("Should reject invalid input")
    void shouldRejectInvalidInput() {
        GesdOutlierDetector detector = new GesdOutlierDetector(0.05, false);

        assertThatThrownBy(() -> detector.detect(new double[0], 0))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> detector.detect(new double[] { 1, Double.NaN, 3 }, 1))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> detector.detect(new double[] { 1, 2, 3 }, 4))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("maxOutliers");
        assertThatThrownBy(() -> detector.detect(new double[] { 1, 2, 3 }, -1))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> new GesdOutlierDetector(1.5, true))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("maxOutliersFor should clamp the share of the series")
    void shouldComputeMaxOutliers() {
        assertThat(GesdOutlierDetector.maxOutliersFor(100, 0.0)).isEqualTo(20);
        assertThat(GesdOutlierDetector.maxOutliersFor(100, 0.15)).isEqualTo(15);
        assertThat(GesdOutlierDetector.maxOutliersFor(3, 0.1)).isEqualTo(1);
        assertThat(GesdOutlierDetector.maxOutliersFor(10, 1.0)).isEqualTo(9);
        assertThat(GesdOutlierDetector.maxOutliersFor(0, 0.5)).isZero();
        assertThatThrownBy(() -> GesdOutlierDetector.maxOutliersFor(10, 1.5))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> GesdOutlierDetector.maxOutliersFor(10, -0.1))
                .isInstanceOf(InvalidInputException.class);
    }

    static double[] pattern(int length) {
        double[] series = new double[length];
        for (int i = 0; i < length; i++) {
            series[i] = PATTERN[i % PATTERN.length];
        }
        return series;
    }

    /** Twenty values near 10 with 1000 at index 10. */
    static double[] spikeSeries() {
        double[] series = pattern(20);
        series[10] = 1000.0;
        return series;
    }
}
