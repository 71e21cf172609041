package com.perfsentinel.flink;

import com.perfsentinel.core.config.AnalysisConfig;
import com.perfsentinel.core.config.AnalysisConfigLoader;
import com.perfsentinel.core.model.PerformancePoint;
import com.perfsentinel.core.model.SeriesAnalysis;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Main entry point for the Perf Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (perf results topic)
 *     → Deserialize JSON → PerformancePoint
 *     → Key by series (project/variant/task/test/thread level)
 *     → SeriesAnalysisFunction (outliers + change points per series)
 *     → Serialize SeriesAnalysis → JSON
 *     → Kafka (analysis topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Wiring comes from environment variables via {@link JobConfig}; analysis
 * parameters from the YAML loaded by {@link AnalysisConfigLoader}.
 * </p>
 *
 * <h3>Checkpointing</h3>
 * <p>
 * Exactly-once checkpoints keep the collected series in keyed state across
 * failures.
 * </p>
 *
 * @since 1.0.0
 */
public final class PerfSentinelJob {

        private static final Logger LOG = LoggerFactory.getLogger(PerfSentinelJob.class);

        private PerfSentinelJob() {
                // entry-point class, not instantiable
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Perf Sentinel with config: {}", config);

                // 2. Load analysis parameters
                AnalysisConfig analysisConfig = loadAnalysisConfig(config);

                // 3. Start health server (for K8s liveness and readiness checks) with shutdown hook
                HealthServer healthServer = new HealthServer();
                healthServer.start(config.getHealthPort());
                Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

                // 4. Set up Flink execution environment
                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                // 5. Build pipeline
                buildPipeline(env, config, analysisConfig);
                healthServer.markReady();

                // 6. Execute
                env.execute("Perf Sentinel – Change Point Detection");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        /**
         * Build the Kafka → Flink → Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        AnalysisConfig analysisConfig) {
                KafkaSource<PerformancePoint> kafkaSource = KafkaSource.<PerformancePoint>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaInputTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new PointDeserializationSchema())
                                .build();

                // analysis runs on processing-time timers, event time is not used
                DataStream<PerformancePoint> points = env.fromSource(
                                kafkaSource,
                                WatermarkStrategy.noWatermarks(),
                                "kafka-points-source");

                DataStream<SeriesAnalysis> analyses = points
                                .filter(Objects::nonNull) // drop deserialization failures
                                .keyBy(point -> point.getIdentifier().key())
                                .process(new SeriesAnalysisFunction(analysisConfig, config.getDebounceMs(),
                                                config.getMaxSeriesPoints()))
                                .name("series-analysis");

                KafkaSink<SeriesAnalysis> kafkaSink = KafkaSink.<SeriesAnalysis>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.builder()
                                                                .setTopic(config.getKafkaOutputTopic())
                                                                .setValueSerializationSchema(
                                                                                new AnalysisSerializationSchema())
                                                                .build())
                                .build();

                analyses.sinkTo(kafkaSink).name("kafka-analysis-sink");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        private static AnalysisConfig loadAnalysisConfig(JobConfig config) {
                return AnalysisConfigLoader.load(config.getAnalysisConfigPath());
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                // Retain checkpoints on cancellation so state can be restored
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}
