package com.perfsentinel.flink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.perfsentinel.core.model.SeriesAnalysis;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink {@link SerializationSchema} that converts {@link SeriesAnalysis} →
 * JSON bytes for the Kafka output topic.
 */
public class AnalysisSerializationSchema implements SerializationSchema<SeriesAnalysis> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AnalysisSerializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(SeriesAnalysis analysis) {
        try {
            return objectMapper().writeValueAsBytes(analysis);
        } catch (Exception e) {
            LOG.error("Failed to serialize analysis of [{}]: {}", analysis.getIdentifier(), e.getMessage(), e);
            return new byte[0];
        }
    }

    ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        }
        return mapper;
    }
}
