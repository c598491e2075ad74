package com.validatorsentinel.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.validatorsentinel.core.model.ValidatorObservation;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Kafka deserializer that converts JSON bytes into {@link ValidatorObservation}.
 *
 * <p>
 * Malformed records, and records without an {@code entityId}, are logged and
 * returned as {@code null}. The pipeline filters them out with a
 * {@code .filter(Objects::nonNull)} step so a single bad record never stops
 * the job.
 * </p>
 *
 * <p>
 * Accepts {@code mevCommissionBps} in place of {@code mevCommission}; basis
 * points are converted to whole percent by the model.
 * </p>
 */
public class ObservationDeserializationSchema implements DeserializationSchema<ValidatorObservation> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ObservationDeserializationSchema.class);

    /**
     * Lazily initialised per task; ObjectMapper is not serializable.
     */
    private transient ObjectMapper mapper;

    private ObjectMapper getMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper()
                    .registerModule(new JavaTimeModule())
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }
        return mapper;
    }

    @Override
    public ValidatorObservation deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            LOG.warn("Received null or empty Kafka message; skipping");
            return null;
        }
        try {
            ValidatorObservation observation = getMapper().readValue(message, ValidatorObservation.class);
            if (observation == null || observation.getEntityId() == null || observation.getEntityId().isBlank()) {
                LOG.warn("Observation without entityId; skipping: {}", truncate(message));
                return null;
            }
            return observation;
        } catch (Exception e) {
            LOG.warn("Failed to deserialize Kafka message ({}): {}", e.getMessage(), truncate(message));
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(ValidatorObservation nextElement) {
        return false;
    }

    @Override
    public TypeInformation<ValidatorObservation> getProducedType() {
        return TypeInformation.of(ValidatorObservation.class);
    }

    private static String truncate(byte[] message) {
        String text = new String(message, StandardCharsets.UTF_8);
        return text.length() > 256 ? text.substring(0, 256) + "..." : text;
    }
}
