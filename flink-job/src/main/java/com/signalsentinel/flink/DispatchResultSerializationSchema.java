package com.signalsentinel.flink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.signalsentinel.core.dispatch.DispatchResult;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Writes one audit record per delivery attempt to the result topic: whether
 * the alert went out, its type and subject, the alert time (ISO-8601), and
 * either the channel outcome or the reason it was held back.
 * <p>
 * A result that cannot be encoded in full still produces a record carrying
 * its type, delivery flag and reason, so every attempt stays visible
 * downstream.
 */
public class DispatchResultSerializationSchema implements SerializationSchema<DispatchResult> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(DispatchResultSerializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(DispatchResult result) {
        try {
            return objectMapper().writeValueAsBytes(result);
        } catch (Exception e) {
            LOG.error("Could not encode {} result (dispatched={}); publishing summary record",
                    result.getAlertType(), result.isDispatched(), e);
            return summary(result, e);
        }
    }

    /** Minimal record for a result whose full encoding failed. */
    static byte[] summary(DispatchResult result, Exception cause) {
        ObjectNode node = new ObjectMapper().createObjectNode();
        node.put("dispatched", result.isDispatched());
        node.put("alertType", String.valueOf(result.getAlertType()));
        if (result.getReason() != null) {
            node.put("reason", result.getReason());
        }
        node.put("encodingError", cause.getClass().getSimpleName());
        return node.toString().getBytes(StandardCharsets.UTF_8);
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
