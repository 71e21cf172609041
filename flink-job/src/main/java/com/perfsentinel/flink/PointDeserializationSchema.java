package com.perfsentinel.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.perfsentinel.core.model.PerformancePoint;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes →
 * {@link PerformancePoint}.
 * <p>
 * Malformed messages, points without a complete series identity and
 * non-finite values are logged and dropped (returns {@code null}).
 * </p>
 */
public class PointDeserializationSchema implements DeserializationSchema<PerformancePoint> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(PointDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public PerformancePoint deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        PerformancePoint point;
        try {
            point = objectMapper().readValue(message, PerformancePoint.class);
        } catch (IOException e) {
            LOG.warn("Failed to deserialize point – skipping: {}", e.getMessage());
            return null;
        }
        try {
            point.getIdentifier();
        } catch (IllegalArgumentException e) {
            LOG.warn("Point without a complete series identity – skipping: {}", e.getMessage());
            return null;
        }
        if (!Double.isFinite(point.getValue())) {
            LOG.warn("Point {} has a non-finite value – skipping", point);
            return null;
        }
        return point;
    }

    @Override
    public boolean isEndOfStream(PerformancePoint nextElement) {
        return false;
    }

    @Override
    public TypeInformation<PerformancePoint> getProducedType() {
        return TypeInformation.of(PerformancePoint.class);
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
