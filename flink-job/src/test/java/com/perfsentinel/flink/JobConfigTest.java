package com.perfsentinel.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Builder defaults should describe a local setup")
    void shouldUseDefaults() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("localhost:9092");
        assertThat(config.getKafkaInputTopic()).isEqualTo("perf-results");
        assertThat(config.getKafkaOutputTopic()).isEqualTo("perf-analysis");
        assertThat(config.getDebounceMs()).isEqualTo(30_000);
        assertThat(config.getMaxSeriesPoints()).isEqualTo(1_000);
        assertThat(config.getAnalysisConfigPath()).isEmpty();
        assertThat(config.kafkaConsumerProperties().getProperty("group.id")).isEqualTo("perf-sentinel");
    }

    @Test
    @DisplayName("Should reject out-of-range values")
    void shouldValidate() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
        assertThatThrownBy(() -> new JobConfig.Builder().debounceMs(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("debounceMs");
        assertThatThrownBy(() -> new JobConfig.Builder().maxSeriesPoints(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxSeriesPoints");
        assertThatThrownBy(() -> new JobConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobConfig.Builder().kafkaOutputTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaOutputTopic");
    }

    @Test
    @DisplayName("Zero debounce should be allowed")
    void shouldAllowImmediateAnalysis() {
        assertThat(new JobConfig.Builder().debounceMs(0).build().getDebounceMs()).isZero();
    }
}
