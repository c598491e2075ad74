package com.validatorsentinel.flink;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;

/**
 * Typed, immutable configuration of the Validator Sentinel Flink job.
 *
 * <p>
 * Every setting is read from an environment variable, falling back to the
 * default listed below. {@link #from(Function)} takes the variable lookup as
 * a function so the same resolution runs against {@code System::getenv} in
 * production and a map in tests.
 * </p>
 *
 * <table>
 * <caption>Environment variables</caption>
 * <tr><th>Variable</th><th>Default</th></tr>
 * <tr><td>{@code KAFKA_BOOTSTRAP_SERVERS}</td><td>{@code localhost:9092}</td></tr>
 * <tr><td>{@code KAFKA_OBSERVATIONS_TOPIC}</td><td>{@code validator-observations}</td></tr>
 * <tr><td>{@code KAFKA_RECORDS_TOPIC}</td><td>{@code validator-records}</td></tr>
 * <tr><td>{@code KAFKA_ALERTS_TOPIC}</td><td>{@code validator-alerts}</td></tr>
 * <tr><td>{@code KAFKA_GROUP_ID}</td><td>{@code validator-sentinel}</td></tr>
 * <tr><td>{@code FLINK_PARALLELISM}</td><td>{@code 1}</td></tr>
 * <tr><td>{@code FLINK_CHECKPOINT_INTERVAL_MS}</td><td>{@code 60000}</td></tr>
 * <tr><td>{@code THRESHOLDS_CONFIG_PATH}</td><td>bundled {@code thresholds.yml}</td></tr>
 * <tr><td>{@code HEALTH_PORT}</td><td>{@code 8080}</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String kafkaBootstrapServers;
    private final String observationsTopic;
    private final String recordsTopic;
    private final String alertsTopic;
    private final String kafkaGroupId;
    private final int parallelism;
    private final long checkpointIntervalMs;
    private final String thresholdsConfigPath;
    private final int healthPort;

    private JobConfig(Function<String, String> env) {
        this.kafkaBootstrapServers = read(env, "KAFKA_BOOTSTRAP_SERVERS", "localhost:9092");
        this.observationsTopic = read(env, "KAFKA_OBSERVATIONS_TOPIC", "validator-observations");
        this.recordsTopic = read(env, "KAFKA_RECORDS_TOPIC", "validator-records");
        this.alertsTopic = read(env, "KAFKA_ALERTS_TOPIC", "validator-alerts");
        this.kafkaGroupId = read(env, "KAFKA_GROUP_ID", "validator-sentinel");
        this.parallelism = Integer.parseInt(read(env, "FLINK_PARALLELISM", "1"));
        this.checkpointIntervalMs = Long.parseLong(read(env, "FLINK_CHECKPOINT_INTERVAL_MS", "60000"));
        this.thresholdsConfigPath = read(env, "THRESHOLDS_CONFIG_PATH", "");
        this.healthPort = Integer.parseInt(read(env, "HEALTH_PORT", "8080"));
    }

    /**
     * Resolve the configuration from the process environment.
     *
     * @return validated configuration
     * @see #from(Function)
     */
    public static JobConfig fromEnvironment() {
        return from(System::getenv);
    }

    /**
     * Resolve and validate the configuration.
     *
     * @param env variable lookup returning {@code null} for unset variables
     * @return validated configuration
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException listing every invalid setting
     */
    public static JobConfig from(Function<String, String> env) {
        Objects.requireNonNull(env, "Environment lookup must not be null");
        JobConfig config;
        try {
            config = new JobConfig(env);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
        config.validate();
        return config;
    }

    private void validate() {
        List<String> errors = new ArrayList<>();
        if (observationsTopic.equals(recordsTopic) || observationsTopic.equals(alertsTopic)) {
            errors.add("output topics must differ from the observations topic '" + observationsTopic + "'");
        }
        if (parallelism < 1) {
            errors.add("FLINK_PARALLELISM must be >= 1, got: " + parallelism);
        }
        if (checkpointIntervalMs < 1) {
            errors.add("FLINK_CHECKPOINT_INTERVAL_MS must be >= 1, got: " + checkpointIntervalMs);
        }
        if (healthPort < 1 || healthPort > 65_535) {
            errors.add("HEALTH_PORT must be in [1, 65535], got: " + healthPort);
        }
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid job configuration: " + String.join("; ", errors));
        }
    }

    /**
     * Consumer settings for the observations source. Offsets are committed
     * by Flink on checkpoints.
     */
    public Properties kafkaConsumerProperties() {
        Properties props = new Properties();
        props.setProperty("auto.offset.reset", "earliest");
        props.setProperty("enable.auto.commit", "false");
        return props;
    }

    /**
     * Producer settings shared by the records and alerts sinks.
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("acks", "all");
        props.setProperty("enable.idempotence", "true");
        return props;
    }

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getObservationsTopic() {
        return observationsTopic;
    }

    public String getRecordsTopic() {
        return recordsTopic;
    }

    public String getAlertsTopic() {
        return alertsTopic;
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

    /**
     * @return thresholds file path, empty for the bundled thresholds
     */
    public String getThresholdsConfigPath() {
        return thresholdsConfigPath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    /** Blank values count as unset. */
    private static String read(Function<String, String> env, String name, String defaultValue) {
        String value = env.apply(name);
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{kafka=" + kafkaBootstrapServers
                + ", topics=" + observationsTopic + " -> " + recordsTopic + " / " + alertsTopic
                + ", group=" + kafkaGroupId
                + ", parallelism=" + parallelism
                + ", checkpointMs=" + checkpointIntervalMs
                + ", thresholds=" + (thresholdsConfigPath.isEmpty() ? "<bundled>" : thresholdsConfigPath)
                + ", healthPort=" + healthPort + '}';
    }
}
