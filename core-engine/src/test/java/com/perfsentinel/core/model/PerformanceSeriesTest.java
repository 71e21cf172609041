package com.perfsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PerformanceSeries} and {@link SeriesIdentifier}.
 */
class PerformanceSeriesTest {

    private static final SeriesIdentifier ID =
            new SeriesIdentifier("sys-perf", "linux-standalone", "bestbuy_agg", "count_with_type", "1");

    @Test
    @DisplayName("Should order points by commit order and keep the last re-run")
    void shouldAssembleFromPoints() {
        PerformanceSeries series = PerformanceSeries.fromPoints(ID, List.of(
                new PerformancePoint(ID, "c3", 3, 300.0),
                new PerformancePoint(ID, "c1", 1, 100.0),
                new PerformancePoint(ID, "c2", 2, 200.0),
                new PerformancePoint(ID, "c1", 1, 110.0)));

        assertThat(series.getValues()).containsExactly(110.0, 200.0, 300.0);
        assertThat(series.getRevisions()).containsExactly("c1", "c2", "c3");
        assertThat(series.revisionAt(1)).isEqualTo("c2");
    }

    @Test
    @DisplayName("Should reject points of another series")
    void shouldRejectForeignPoints() {
        SeriesIdentifier other = new SeriesIdentifier("sys-perf", "linux-standalone", "bestbuy_agg",
                "count_with_type", "8");

        assertThatThrownBy(() -> PerformanceSeries.fromPoints(ID, List.of(new PerformancePoint(other, "c1", 1, 1.0))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not belong");
    }

    @Test
    @DisplayName("Values should be copied in and out")
    void shouldCopyValues() {
        double[] values = { 1, 2, 3 };
        PerformanceSeries series = new PerformanceSeries(ID, values, null);

        values[0] = 99;
        series.getValues()[1] = 99;

        assertThat(series.getValues()).containsExactly(1, 2, 3);
        assertThat(series.getRevisions()).isEmpty();
        assertThat(series.revisionAt(0)).isNull();
    }

    @Test
    @DisplayName("Should reject revisions that do not match the values")
    void shouldRejectMismatchedRevisions() {
        assertThatThrownBy(() -> new PerformanceSeries(ID, new double[] { 1, 2 }, List.of("a")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Identifier should require every component and join them into a key")
    void shouldBuildIdentifierKey() {
        assertThat(ID.key()).isEqualTo("sys-perf/linux-standalone/bestbuy_agg/count_with_type/1");
        assertThatThrownBy(() -> new SeriesIdentifier("sys-perf", " ", "t", "test", "1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("variant");
    }
}
