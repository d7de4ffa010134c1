package com.spansentinel.flink;

import java.io.Serializable;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed, immutable configuration object for the Span Sentinel Flink job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults.
 * This makes the job fully configurable via Kubernetes Deployment env vars,
 * Docker {@code -e} flags, or a shell environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
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
    private final String kafkaObservationTopic;
    private final String kafkaAnomalyTopic;
    private final String kafkaAlertTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;

    // ---------------------------------------------------------------
    // Rules and history
    // ---------------------------------------------------------------
    private final String rulesConfigPath;
    private final int maxHistorySamples;

    // ---------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------
    private final int healthPort;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaObservationTopic = b.kafkaObservationTopic;
        this.kafkaAnomalyTopic = b.kafkaAnomalyTopic;
        this.kafkaAlertTopic = b.kafkaAlertTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.rulesConfigPath = b.rulesConfigPath;
        this.maxHistorySamples = b.maxHistorySamples;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        return fromEnvironment(System.getenv()::get);
    }

    /**
     * Build a {@link JobConfig} from an arbitrary variable lookup.
     *
     * @param lookup returns the value of a variable, or {@code null} if unset
     * @return fully populated configuration
     */
    static JobConfig fromEnvironment(EnvLookup lookup) {
        Objects.requireNonNull(lookup, "lookup must not be null");
        try {
            return new Builder()
                    .kafkaBootstrapServers(env(lookup, "KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaObservationTopic(env(lookup, "KAFKA_OBSERVATION_TOPIC", "span-metrics"))
                    .kafkaAnomalyTopic(env(lookup, "KAFKA_ANOMALY_TOPIC", "anomalies"))
                    .kafkaAlertTopic(env(lookup, "KAFKA_ALERT_TOPIC", "anomaly-alerts"))
                    .kafkaGroupId(env(lookup, "KAFKA_GROUP_ID", "span-sentinel"))
                    .parallelism(Integer.parseInt(env(lookup, "FLINK_PARALLELISM", "1")))
                    .checkpointIntervalMs(Long.parseLong(env(lookup, "FLINK_CHECKPOINT_INTERVAL_MS", "60000")))
                    .rulesConfigPath(env(lookup, "RULES_CONFIG_PATH", ""))
                    .maxHistorySamples(Integer.parseInt(env(lookup, "MAX_HISTORY_SAMPLES", "10000")))
                    .healthPort(Integer.parseInt(env(lookup, "HEALTH_PORT", "8080")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /** Variable lookup, {@code System.getenv()::get} in production. */
    @FunctionalInterface
    interface EnvLookup {
        String get(String name);
    }

    // ---------------------------------------------------------------
    // Kafka properties helpers
    // ---------------------------------------------------------------

    /**
     * Build Kafka consumer {@link Properties}.
     *
     * @return new Properties instance configured for consumption
     */
    public Properties kafkaConsumerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("group.id", kafkaGroupId);
        props.setProperty("auto.offset.reset", "earliest");
        return props;
    }

    /**
     * Build Kafka producer {@link Properties}.
     *
     * @return new Properties instance configured for production
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

    public String getKafkaObservationTopic() {
        return kafkaObservationTopic;
    }

    public String getKafkaAnomalyTopic() {
        return kafkaAnomalyTopic;
    }

    public String getKafkaAlertTopic() {
        return kafkaAlertTopic;
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

    public String getRulesConfigPath() {
        return rulesConfigPath;
    }

    public int getMaxHistorySamples() {
        return maxHistorySamples;
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
     * The {@link #build()} method validates that all values are within legal
     * ranges (parallelism &gt; 0, checkpoint interval &gt; 0, history bound
     * &gt; 0, port in [1, 65535], non-blank topic names).
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaObservationTopic = "span-metrics";
        private String kafkaAnomalyTopic = "anomalies";
        private String kafkaAlertTopic = "anomaly-alerts";
        private String kafkaGroupId = "span-sentinel";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private String rulesConfigPath = "";
        private int maxHistorySamples = 10_000;
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaObservationTopic(String v) {
            this.kafkaObservationTopic = v;
            return this;
        }

        public Builder kafkaAnomalyTopic(String v) {
            this.kafkaAnomalyTopic = v;
            return this;
        }

        public Builder kafkaAlertTopic(String v) {
            this.kafkaAlertTopic = v;
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

        public Builder rulesConfigPath(String v) {
            this.rulesConfigPath = v;
            return this;
        }

        public Builder maxHistorySamples(int v) {
            this.maxHistorySamples = v;
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
            requireNonBlank(kafkaObservationTopic, "kafkaObservationTopic");
            requireNonBlank(kafkaAnomalyTopic, "kafkaAnomalyTopic");
            requireNonBlank(kafkaAlertTopic, "kafkaAlertTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (maxHistorySamples < 1) {
                throw new IllegalArgumentException(
                        "maxHistorySamples must be >= 1, got: " + maxHistorySamples);
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

    private static String env(EnvLookup lookup, String name, String defaultValue) {
        String value = lookup.get(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaObservationTopic='" + kafkaObservationTopic + '\'' +
                ", kafkaAnomalyTopic='" + kafkaAnomalyTopic + '\'' +
                ", kafkaAlertTopic='" + kafkaAlertTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", rulesConfigPath='" + rulesConfigPath + '\'' +
                ", maxHistorySamples=" + maxHistorySamples +
                ", healthPort=" + healthPort +
                '}';
    }
}
