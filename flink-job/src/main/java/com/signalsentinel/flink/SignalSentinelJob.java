package com.signalsentinel.flink;

import com.signalsentinel.core.config.EngineConfig;
import com.signalsentinel.core.config.EngineConfigLoader;
import com.signalsentinel.core.dispatch.DispatchResult;
import com.signalsentinel.core.model.MarketSnapshot;
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
 * Main entry point for the Signal Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (snapshot topic)
 *     → Deserialize JSON → MarketSnapshot
 *     → AlertCycleFunction (evaluate + dispatch, parallelism 1)
 *     → Serialize DispatchResult → JSON
 *     → Kafka (result topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Deployment settings come from environment variables via {@link JobConfig};
 * alert thresholds and cooldowns from the engine YAML document loaded by
 * {@link EngineConfigLoader}.
 * </p>
 *
 * <h3>Checkpointing</h3>
 * <p>
 * Checkpoints cover the Kafka offsets only. Alert state is process-local and
 * is rebuilt from scratch after a restart.
 * </p>
 *
 * @since 1.0.0
 */
public final class SignalSentinelJob {

        private static final Logger LOG = LoggerFactory.getLogger(SignalSentinelJob.class);

        private SignalSentinelJob() {
                // entry-point class, not instantiable
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Signal Sentinel with config: {}", config);

                // 2. Load and validate engine thresholds (fail fast)
                EngineConfig engineConfig = loadEngineConfig(config);

                // 3. Start health server with shutdown hook
                HealthServer healthServer = new HealthServer(config.hasTelegramCredentials() ? "telegram" : "log");
                healthServer.start(config.getHealthPort());
                Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

                // 4. Set up Flink execution environment
                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(1);
                configureCheckpointing(env, config);

                // 5. Build pipeline
                buildPipeline(env, config, engineConfig);

                // 6. Execute
                env.execute("Signal Sentinel – Alert Dispatch");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        /**
         * Build the Kafka → Flink → Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        EngineConfig engineConfig) {
                // Only fresh snapshots are relevant for alerting
                KafkaSource<MarketSnapshot> kafkaSource = KafkaSource.<MarketSnapshot>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaSnapshotTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.latest())
                                .setValueOnlyDeserializer(new SnapshotDeserializationSchema())
                                .build();

                DataStream<MarketSnapshot> snapshots = env.fromSource(
                                kafkaSource,
                                WatermarkStrategy.noWatermarks(),
                                "kafka-snapshot-source");

                DataStream<DispatchResult> results = snapshots
                                .filter(Objects::nonNull) // drop deserialization failures
                                .process(new AlertCycleFunction(engineConfig, config))
                                .name("alert-cycle")
                                .setParallelism(1)
                                .setMaxParallelism(1);

                KafkaSink<DispatchResult> kafkaSink = KafkaSink.<DispatchResult>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.builder()
                                                                .setTopic(config.getKafkaResultTopic())
                                                                .setValueSerializationSchema(
                                                                                new DispatchResultSerializationSchema())
                                                                .build())
                                .build();

                results.sinkTo(kafkaSink).name("kafka-result-sink");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        private static EngineConfig loadEngineConfig(JobConfig config) {
                String path = config.getEngineConfigPath();
                if (path != null && !path.isBlank()) {
                        return EngineConfigLoader.fromFile(path);
                }
                return EngineConfigLoader.load();
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}
