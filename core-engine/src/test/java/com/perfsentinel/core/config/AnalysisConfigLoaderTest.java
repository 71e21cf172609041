package com.perfsentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnalysisConfigLoader}.
 */
class AnalysisConfigLoaderTest {

    @Test
    @DisplayName("Should load test configuration from classpath")
    void shouldLoadFromClasspath() {
        AnalysisConfig config = AnalysisConfigLoader.fromClasspath("test-analysis.yml");

        assertThat(config.getPoolSize()).isEqualTo(2);
        assertThat(config.effectivePoolSize()).isEqualTo(2);
        assertThat(config.getChangePoints().getSignificance()).isEqualTo(0.01);
        assertThat(config.getChangePoints().getPermutations()).isEqualTo(50);
        assertThat(config.getChangePoints().getSeed()).isEqualTo(1234L);
        assertThat(config.getChangePoints().getWeighting()).isEqualTo(0.01);
        assertThat(config.getOutliers().isUseMad()).isTrue();
        assertThat(config.getOutliers().isMaskOutliers()).isFalse();
        assertThat(config.getOutliers().getMaxOutliersPercentage()).isEqualTo(0.15);
    }

    @Test
    @DisplayName("Should load the bundled default configuration")
    void shouldLoadDefaults() {
        AnalysisConfig config = AnalysisConfigLoader.fromClasspath(AnalysisConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.getChangePoints().getPermutations()).isEqualTo(100);
        assertThat(config.getChangePoints().getSeed()).isNull();
        assertThat(config.getChangePoints().getWeighting()).isEqualTo(0.001);
        assertThat(config.getOutliers().isEnabled()).isTrue();
        assertThat(config.effectivePoolSize()).isPositive();
    }

    @Test
    @DisplayName("Missing sections should keep their defaults")
    void shouldKeepDefaultsForMissingSections() {
        AnalysisConfig config = AnalysisConfigLoader.fromClasspath("partial-analysis.yml");

        assertThat(config.getChangePoints().getPermutations()).isEqualTo(20);
        assertThat(config.getChangePoints().getSignificance()).isEqualTo(0.05);
        assertThat(config.getOutliers().getSignificance()).isEqualTo(0.05);
    }

    @Test
    @DisplayName("Should report every invalid value at once")
    void shouldCollectValidationErrors() {
        assertThatThrownBy(() -> AnalysisConfigLoader.fromClasspath("invalid-analysis.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("poolSize")
                .hasMessageContaining("changePoints.significance")
                .hasMessageContaining("changePoints.permutations")
                .hasMessageContaining("changePoints.weighting")
                .hasMessageContaining("outliers.maxOutliersPercentage");
    }

    @Test
    @DisplayName("Should report unknown properties as malformed")
    void shouldRejectUnknownProperty(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("unknown.yml");
        Files.writeString(file, "poolSize: 1\nworkers: 2\n");

        assertThatThrownBy(() -> AnalysisConfigLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("Should load from a file and treat an empty file as defaults")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("empty.yml");
        Files.writeString(file, "");

        AnalysisConfig config = AnalysisConfigLoader.fromFile(file.toString());

        assertThat(config.getPoolSize()).isZero();
        assertThat(config.getChangePoints().getPermutations()).isEqualTo(100);
    }

    @Test
    @DisplayName("Load should prefer an explicit path and fall back to the bundled defaults")
    void shouldResolveExplicitPathBeforeDefaults(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("custom.yml");
        Files.writeString(file, "changePoints:\n  permutations: 42\n");

        assertThat(AnalysisConfigLoader.load(file.toString()).getChangePoints().getPermutations()).isEqualTo(42);
        assertThat(AnalysisConfigLoader.load(" ").getChangePoints().getPermutations()).isEqualTo(100);
        assertThat(AnalysisConfigLoader.load(null).getChangePoints().getPermutations()).isEqualTo(100);
        assertThatThrownBy(() -> AnalysisConfigLoader.load(dir.resolve("missing.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should throw when the file or resource does not exist")
    void shouldThrowForMissingSource() {
        assertThatThrownBy(() -> AnalysisConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
        assertThatThrownBy(() -> AnalysisConfigLoader.fromFile("/nonexistent/analysis.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Masking outliers should require outlier detection")
    void shouldRequireOutliersForMasking() {
        AnalysisConfig config = new AnalysisConfig();
        config.getOutliers().setEnabled(false);

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("maskOutliers");

        config.getOutliers().setMaskOutliers(false);
        config.validate();
    }
}
