package com.perfsentinel.flink;

import java.io.Serializable;
import java.util.Objects;
import java.util.Properties;

/**
 * Immutable wiring configuration of the Perf Sentinel Flink job.
 *
 * <p>
 * Values come from environment variables, falling back to defaults. Analysis
 * parameters live in the YAML file named by {@code ANALYSIS_CONFIG_PATH}, not
 * here.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * {@link #fromEnvironment()} in production, the {@link Builder} in tests.
 * {@link Builder#build()} validates every value.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaInputTopic;
    private final String kafkaOutputTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;

    /** Quiet period after the last new point before a series is analysed. */
    private final long debounceMs;

    /** Newest points kept per series. */
    private final int maxSeriesPoints;

    // ---------------------------------------------------------------
    // Analysis
    // ---------------------------------------------------------------
    private final String analysisConfigPath;

    // ---------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------
    private final int healthPort;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaInputTopic = b.kafkaInputTopic;
        this.kafkaOutputTopic = b.kafkaOutputTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.debounceMs = b.debounceMs;
        this.maxSeriesPoints = b.maxSeriesPoints;
        this.analysisConfigPath = b.analysisConfigPath;
        this.healthPort = b.healthPort;
    }

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaInputTopic(env("KAFKA_INPUT_TOPIC", "perf-results"))
                    .kafkaOutputTopic(env("KAFKA_OUTPUT_TOPIC", "perf-analysis"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "perf-sentinel"))
                    .parallelism(parseIntEnv("FLINK_PARALLELISM", "1"))
                    .checkpointIntervalMs(parseLongEnv("FLINK_CHECKPOINT_INTERVAL_MS", "60000"))
                    .debounceMs(parseLongEnv("ANALYSIS_DEBOUNCE_MS", "30000"))
                    .maxSeriesPoints(parseIntEnv("ANALYSIS_MAX_SERIES_POINTS", "1000"))
                    .analysisConfigPath(env("ANALYSIS_CONFIG_PATH", ""))
                    .healthPort(parseIntEnv("HEALTH_PORT", "8080"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * @return Kafka consumer properties
     */
    public Properties kafkaConsumerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("group.id", kafkaGroupId);
        props.setProperty("auto.offset.reset", "earliest");
        return props;
    }

    /**
     * @return Kafka producer properties
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("transaction.timeout.ms", "900000");
        return props;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaInputTopic() {
        return kafkaInputTopic;
    }

    public String getKafkaOutputTopic() {
        return kafkaOutputTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    public long getDebounceMs() {
        return debounceMs;
    }

    public int getMaxSeriesPoints() {
        return maxSeriesPoints;
    }

    public String getAnalysisConfigPath() {
        return analysisConfigPath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * {@link #build()} checks parallelism &gt; 0, checkpoint interval &gt; 0,
     * debounce &gt;= 0, retained points &gt; 0, port in [1, 65535] and non-blank topic names.
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaInputTopic = "perf-results";
        private String kafkaOutputTopic = "perf-analysis";
        private String kafkaGroupId = "perf-sentinel";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private long debounceMs = 30_000;
        private int maxSeriesPoints = 1_000;
        private String analysisConfigPath = "";
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaInputTopic(String v) {
            this.kafkaInputTopic = v;
            return this;
        }

        public Builder kafkaOutputTopic(String v) {
            this.kafkaOutputTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder debounceMs(long v) {
            this.debounceMs = v;
            return this;
        }

        public Builder maxSeriesPoints(int v) {
            this.maxSeriesPoints = v;
            return this;
        }

        public Builder analysisConfigPath(String v) {
            this.analysisConfigPath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(kafkaInputTopic, "kafkaInputTopic");
            requireNonBlank(kafkaOutputTopic, "kafkaOutputTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");
            Objects.requireNonNull(analysisConfigPath, "analysisConfigPath required");

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (debounceMs < 0) {
                throw new IllegalArgumentException("debounceMs must be >= 0, got: " + debounceMs);
            }
            if (maxSeriesPoints < 1) {
                throw new IllegalArgumentException(
                        "maxSeriesPoints must be >= 1, got: " + maxSeriesPoints);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaInputTopic='" + kafkaInputTopic + '\'' +
                ", kafkaOutputTopic='" + kafkaOutputTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", debounceMs=" + debounceMs +
                ", maxSeriesPoints=" + maxSeriesPoints +
                ", analysisConfigPath='" + analysisConfigPath + '\'' +
                ", healthPort=" + healthPort +
                '}';
    }
}
