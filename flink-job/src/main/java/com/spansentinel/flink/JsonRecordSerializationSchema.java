package com.spansentinel.flink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink {@link SerializationSchema} that converts records → JSON bytes for
 * publishing to the anomalies and alerts topics. Timestamps are written as
 * ISO-8601 strings.
 *
 * @param <T> record type
 */
public class JsonRecordSerializationSchema<T> implements SerializationSchema<T> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(JsonRecordSerializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(T record) {
        try {
            return objectMapper().writeValueAsBytes(record);
        } catch (Exception e) {
            LOG.error("Failed to serialize {}: {}", record, e.getMessage(), e);
            return new byte[0];
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        }
        return mapper;
    }
}
