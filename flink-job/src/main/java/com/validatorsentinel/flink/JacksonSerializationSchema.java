package com.validatorsentinel.flink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Kafka serializer that converts a record to UTF-8 JSON bytes.
 *
 * <p>
 * Used for both the sweep records topic and the alerts topic. Instants are
 * written as ISO-8601 strings. A record that cannot be serialized is logged
 * and written as an empty payload.
 * </p>
 *
 * @param <T> record type
 */
public class JacksonSerializationSchema<T> implements SerializationSchema<T> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(JacksonSerializationSchema.class);

    private transient ObjectMapper mapper;

    private ObjectMapper getMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper()
                    .registerModule(new JavaTimeModule())
                    .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        }
        return mapper;
    }

    @Override
    public byte[] serialize(T element) {
        try {
            return getMapper().writeValueAsBytes(element);
        } catch (Exception e) {
            LOG.error("Failed to serialize {}: {}", element, e.getMessage(), e);
            return new byte[0];
        }
    }
}
