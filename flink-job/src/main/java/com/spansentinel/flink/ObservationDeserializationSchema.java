package com.spansentinel.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes → {@link MetricObservation}.
 * <p>
 * Malformed messages, and messages without a rule name or a finite value, are logged
 * and dropped (returns {@code null}), ensuring that a single bad record does
 * not crash the entire pipeline.
 * </p>
 */
public class ObservationDeserializationSchema implements DeserializationSchema<MetricObservation> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ObservationDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public MetricObservation deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        MetricObservation observation;
        try {
            observation = objectMapper().readValue(message, MetricObservation.class);
        } catch (Exception e) {
            LOG.warn("Failed to deserialize observation – skipping: {}", e.getMessage());
            return null;
        }
        if (observation == null) {
            return null;
        }
        if (observation.getRuleName() == null || observation.getRuleName().isBlank()
                || observation.getValue() == null) {
            LOG.warn("Observation without rule name or value – skipping: {}", observation);
            return null;
        }
        if (!Double.isFinite(observation.getValue())) {
            LOG.warn("Observation with non-finite value – skipping: {}", observation);
            return null;
        }
        return observation;
    }

    @Override
    public boolean isEndOfStream(MetricObservation nextElement) {
        return false; // unbounded stream
    }

    @Override
    public TypeInformation<MetricObservation> getProducedType() {
        return TypeInformation.of(MetricObservation.class);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }
        return mapper;
    }
}
