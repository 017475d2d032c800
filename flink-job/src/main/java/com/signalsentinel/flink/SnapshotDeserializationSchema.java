package com.signalsentinel.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.signalsentinel.core.model.MarketSnapshot;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes → {@link MarketSnapshot}.
 * <p>
 * Malformed messages, and snapshots without a positive epoch-millisecond
 * {@code timestamp}, are logged and dropped (returns {@code null}) so a
 * single bad record does not crash the pipeline.
 * </p>
 */
public class SnapshotDeserializationSchema implements DeserializationSchema<MarketSnapshot> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SnapshotDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public MarketSnapshot deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            MarketSnapshot snapshot = objectMapper().readValue(message, MarketSnapshot.class);
            if (snapshot == null || snapshot.getTimestamp().toEpochMilli() <= 0) {
                LOG.warn("Snapshot without timestamp – skipping");
                return null;
            }
            return snapshot;
        } catch (Exception e) {
            LOG.warn("Failed to deserialize snapshot – skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(MarketSnapshot nextElement) {
        return false; // unbounded stream
    }

    @Override
    public TypeInformation<MarketSnapshot> getProducedType() {
        return TypeInformation.of(MarketSnapshot.class);
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
