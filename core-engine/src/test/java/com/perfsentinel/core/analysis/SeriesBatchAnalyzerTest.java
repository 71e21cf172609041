package com.perfsentinel.core.analysis;

import com.perfsentinel.core.config.AnalysisConfig;
import com.perfsentinel.core.model.PerformanceSeries;
import com.perfsentinel.core.model.SeriesAnalysis;
import com.perfsentinel.core.model.SeriesIdentifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SeriesBatchAnalyzer}.
 */
class SeriesBatchAnalyzerTest {

    @Test
    @DisplayName("A failing series should be reported without aborting the others")
    void shouldIsolateFailures() {
        SeriesIdentifier brokenId = new SeriesIdentifier("sys-perf", "linux", "task", "broken", "1");
        PerformanceSeries broken = new PerformanceSeries(brokenId, new double[0], null);

        try (SeriesBatchAnalyzer batch = new SeriesBatchAnalyzer(seededConfig())) {
            BatchReport report = batch.analyzeAll(List.of(
                    SeriesAnalyzerTest.spikedSeries(), broken, SeriesAnalyzerTest.spikedSeries()));

            assertThat(report.size()).isEqualTo(3);
            assertThat(report.hasFailures()).isTrue();
            assertThat(report.getSuccesses()).hasSize(2);
            assertThat(report.getFailures()).singleElement().satisfies(outcome -> {
                assertThat(outcome.getIdentifier()).isEqualTo(brokenId);
                assertThat(outcome.getAnalysis()).isEmpty();
                assertThat(outcome.getFailure()).hasValueSatisfying(m -> assertThat(m).contains("empty"));
            });
            assertThat(report.getOutcomes().get(1).isSuccess()).isFalse();
        }
    }

    @Test
    @DisplayName("Seeded analyses should not depend on the worker that runs them")
    void shouldBeDeterministicAcrossWorkers() {
        try (SeriesBatchAnalyzer batch = new SeriesBatchAnalyzer(seededConfig())) {
            BatchReport report = batch.analyzeAll(List.of(
                    SeriesAnalyzerTest.spikedSeries(), SeriesAnalyzerTest.spikedSeries(),
                    SeriesAnalyzerTest.spikedSeries(), SeriesAnalyzerTest.spikedSeries()));

            List<SeriesAnalysis> analyses = report.getSuccesses().stream()
                    .map(outcome -> outcome.getAnalysis().orElseThrow())
                    .toList();
            assertThat(analyses).hasSize(4);
            assertThat(analyses).extracting(SeriesAnalysis::getChangePoints).allSatisfy(points ->
                    assertThat(points).isEqualTo(analyses.get(0).getChangePoints()));
            assertThat(analyses.get(0).getChangePoints()).hasSize(2);
        }
    }

    @Test
    @DisplayName("Should use the configured pool size and reject non-positive sizes")
    void shouldSizePool() {
        try (SeriesBatchAnalyzer batch = new SeriesBatchAnalyzer(seededConfig())) {
            assertThat(batch.getPoolSize()).isEqualTo(2);
            assertThat(batch.analyzeAll(List.of()).size()).isZero();
        }
        assertThatThrownBy(() -> new SeriesBatchAnalyzer(new SeriesAnalyzer(new AnalysisConfig()), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static AnalysisConfig seededConfig() {
        AnalysisConfig config = new AnalysisConfig();
        config.setPoolSize(2);
        config.getChangePoints().setSeed(7L);
        config.getChangePoints().setPermutations(50);
        config.validate();
        return config;
    }
}
