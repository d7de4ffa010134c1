package com.spansentinel.flink;

import com.spansentinel.core.config.RulesConfig;
import com.spansentinel.core.config.RulesLoader;
import com.spansentinel.core.model.Anomaly;
import com.spansentinel.core.model.DetectionRule;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.SingleOutputStreamOperator;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Main entry point for the Span Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (observations topic)
 *     → Deserialize JSON → MetricObservation
 *     → Key by rule name
 *     → AnomalyProcessFunction (sample window, detection, cooldown)
 *     ├→ Serialize AlertNotification → JSON → Kafka (alerts topic)
 *     └→ side output: Serialize Anomaly → JSON → Kafka (anomalies topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * All configuration is resolved from environment variables via
 * {@link JobConfig}.
 * </p>
 *
 * <h3>Checkpointing</h3>
 * <p>
 * Exactly-once checkpointing keeps the per-rule sample windows and
 * last-alert timestamps across failures.
 * </p>
 *
 * @since 1.0.0
 */
public final class SpanSentinelJob {

        private static final Logger LOG = LoggerFactory.getLogger(SpanSentinelJob.class);

        private SpanSentinelJob() {
                // entry-point class, not instantiable
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Span Sentinel with config: {}", config);

                // 2. Load detection rules
                List<DetectionRule> rules = loadRules(config).enabledRules();
                if (rules.isEmpty()) {
                        throw new IllegalStateException(
                                        "No enabled detection rules. Provide rules via "
                                                        + RulesLoader.ENV_RULES_PATH
                                                        + " or a classpath rules.yml file.");
                }
                LOG.info("Running {} enabled detection rule(s)", rules.size());

                // 3. Start health server (for K8s probes) with shutdown hook
                HealthServer healthServer = new HealthServer(rules.size());
                healthServer.start(config.getHealthPort());
                Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

                // 4. Set up Flink execution environment
                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                // 5. Build pipeline
                buildPipeline(env, config, rules);

                // 6. Execute
                env.execute("Span Sentinel – Anomaly Detection");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        /**
         * Build the full Kafka → Flink → Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        List<DetectionRule> rules) {
                KafkaSource<MetricObservation> kafkaSource = KafkaSource.<MetricObservation>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaObservationTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new ObservationDeserializationSchema())
                                .build();

                DataStream<MetricObservation> observations = env.fromSource(
                                kafkaSource,
                                WatermarkStrategy.<MetricObservation>forBoundedOutOfOrderness(Duration.ofSeconds(5))
                                                .withIdleness(Duration.ofMinutes(1)),
                                "kafka-observations-source");

                SingleOutputStreamOperator<AlertNotification> alerts = observations
                                .filter(Objects::nonNull) // drop deserialization failures
                                .keyBy(MetricObservation::getRuleName)
                                .process(new AnomalyProcessFunction(rules, config.getMaxHistorySamples()))
                                .name("anomaly-detection");

                DataStream<Anomaly> anomalies = alerts.getSideOutput(AnomalyProcessFunction.ANOMALIES);

                alerts.sinkTo(kafkaSink(config, config.getKafkaAlertTopic(),
                                new JsonRecordSerializationSchema<AlertNotification>()))
                                .name("kafka-alerts-sink");
                anomalies.sinkTo(kafkaSink(config, config.getKafkaAnomalyTopic(),
                                new JsonRecordSerializationSchema<Anomaly>()))
                                .name("kafka-anomalies-sink");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        private static <T> KafkaSink<T> kafkaSink(JobConfig config, String topic,
                        JsonRecordSerializationSchema<T> serializer) {
                return KafkaSink.<T>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setKafkaProducerConfig(config.kafkaProducerProperties())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.<T>builder()
                                                                .setTopic(topic)
                                                                .setValueSerializationSchema(serializer)
                                                                .build())
                                .build();
        }

        private static RulesConfig loadRules(JobConfig config) {
                return RulesLoader.load(config.getRulesConfigPath());
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
