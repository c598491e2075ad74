package com.validatorsentinel.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Unset variables should resolve to the defaults")
    void defaultsAreValid() {
        JobConfig config = JobConfig.from(name -> null);

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("localhost:9092");
        assertThat(config.getObservationsTopic()).isEqualTo("validator-observations");
        assertThat(config.getRecordsTopic()).isEqualTo("validator-records");
        assertThat(config.getAlertsTopic()).isEqualTo("validator-alerts");
        assertThat(config.getKafkaGroupId()).isEqualTo("validator-sentinel");
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getCheckpointIntervalMs()).isEqualTo(60_000L);
        assertThat(config.getHealthPort()).isEqualTo(8080);
        assertThat(config.getThresholdsConfigPath()).isEmpty();
        assertThat(config.toString()).contains("<bundled>");
    }

    @Test
    @DisplayName("Set variables should override the defaults; blank ones are ignored")
    void overrides() {
        JobConfig config = JobConfig.from(env(
                "KAFKA_BOOTSTRAP_SERVERS", "kafka-0:9092,kafka-1:9092",
                "FLINK_PARALLELISM", "4",
                "HEALTH_PORT", "9090",
                "KAFKA_GROUP_ID", "  ",
                "THRESHOLDS_CONFIG_PATH", "/etc/sentinel/thresholds.yml"));

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("kafka-0:9092,kafka-1:9092");
        assertThat(config.getParallelism()).isEqualTo(4);
        assertThat(config.getHealthPort()).isEqualTo(9090);
        assertThat(config.getKafkaGroupId()).isEqualTo("validator-sentinel");
        assertThat(config.getThresholdsConfigPath()).isEqualTo("/etc/sentinel/thresholds.yml");
    }

    @Test
    @DisplayName("Producer properties should require acknowledgement from all replicas")
    void kafkaProperties() {
        JobConfig config = JobConfig.from(name -> null);

        assertThat(config.kafkaProducerProperties().getProperty("acks")).isEqualTo("all");
        assertThat(config.kafkaConsumerProperties().getProperty("auto.offset.reset")).isEqualTo("earliest");
    }

    @Test
    @DisplayName("Should report every invalid setting at once")
    void reportsAllErrors() {
        assertThatThrownBy(() -> JobConfig.from(env(
                "FLINK_PARALLELISM", "0",
                "HEALTH_PORT", "70000")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("FLINK_PARALLELISM")
                .hasMessageContaining("HEALTH_PORT");
    }

    @Test
    @DisplayName("Should reject writing back to the observations topic")
    void rejectsFeedbackLoop() {
        assertThatThrownBy(() -> JobConfig.from(env(
                "KAFKA_OBSERVATIONS_TOPIC", "validators",
                "KAFKA_RECORDS_TOPIC", "validators")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must differ");
    }

    @Test
    @DisplayName("Should fail on a non-numeric number")
    void rejectsNonNumeric() {
        assertThatThrownBy(() -> JobConfig.from(env("FLINK_CHECKPOINT_INTERVAL_MS", "1m")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("1m");
    }

    private static Function<String, String> env(String... pairs) {
        Map<String, String> values = new HashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            values.put(pairs[i], pairs[i + 1]);
        }
        return values::get;
    }
}
