package com.validatorsentinel.flink;

import com.validatorsentinel.core.model.ValidatorObservation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ObservationDeserializationSchema}.
 */
class ObservationDeserializationSchemaTest {

    private final ObservationDeserializationSchema schema = new ObservationDeserializationSchema();

    @Test
    @DisplayName("Should parse a full observation")
    void parsesObservation() throws Exception {
        ValidatorObservation observation = schema.deserialize(bytes(
                "{\"entityId\":\"Vote111\",\"epoch\":873,\"slot\":377000000,"
                        + "\"observedAt\":\"2024-03-01T12:00:00Z\",\"commission\":5,"
                        + "\"mevCommission\":10,\"delinquent\":false}"));

        assertThat(observation).isNotNull();
        assertThat(observation.getEntityId()).isEqualTo("Vote111");
        assertThat(observation.getEpoch()).isEqualTo(873);
        assertThat(observation.getSlot()).isEqualTo(377_000_000L);
        assertThat(observation.getObservedAt()).isEqualTo(Instant.parse("2024-03-01T12:00:00Z"));
        assertThat(observation.getCommission()).isEqualTo(5);
        assertThat(observation.getMevCommission()).isEqualTo(10);
        assertThat(observation.getDelinquent()).isFalse();
    }

    @Test
    @DisplayName("Should convert MEV commission from basis points")
    void convertsBasisPoints() throws Exception {
        ValidatorObservation observation = schema.deserialize(bytes(
                "{\"entityId\":\"Vote111\",\"epoch\":873,\"commission\":5,\"mevCommissionBps\":850}"));

        assertThat(observation.getMevCommission()).isEqualTo(9);
        assertThat(observation.isLivenessSampled()).isFalse();
    }

    @Test
    @DisplayName("Missing MEV commission means MEV disabled")
    void missingMevIsDisabled() throws Exception {
        ValidatorObservation observation = schema.deserialize(bytes(
                "{\"entityId\":\"Vote111\",\"epoch\":873,\"commission\":5}"));

        assertThat(observation.getMevCommission()).isNull();
    }

    @Test
    @DisplayName("Should ignore unknown fields")
    void ignoresUnknownFields() throws Exception {
        ValidatorObservation observation = schema.deserialize(bytes(
                "{\"entityId\":\"Vote111\",\"epoch\":873,\"commission\":5,\"activatedStake\":42}"));

        assertThat(observation).isNotNull();
        assertThat(observation.getCommission()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should return null for malformed, empty or anonymous records")
    void rejectsBadRecords() throws Exception {
        assertThat(schema.deserialize(bytes("{not json"))).isNull();
        assertThat(schema.deserialize(new byte[0])).isNull();
        assertThat(schema.deserialize(null)).isNull();
        assertThat(schema.deserialize(bytes("{\"epoch\":873,\"commission\":5}"))).isNull();
        assertThat(schema.deserialize(bytes("{\"entityId\":\"  \",\"epoch\":873}"))).isNull();
    }

    @Test
    @DisplayName("Stream never ends")
    void neverEndOfStream() {
        assertThat(schema.isEndOfStream(ValidatorObservation.builder().entityId("Vote111").build())).isFalse();
        assertThat(schema.getProducedType().getTypeClass()).isEqualTo(ValidatorObservation.class);
    }

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }
}
