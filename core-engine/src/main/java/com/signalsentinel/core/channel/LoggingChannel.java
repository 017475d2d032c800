package com.signalsentinel.core.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Dry-run channel: writes the message to the log and reports success.
 *
 * <p>
 * Used when no real channel is configured so that the whole cycle,
 * including dispatch bookkeeping, can run in development.
 * </p>
 *
 * @since 1.0.0
 */
public class LoggingChannel implements AlertChannel {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingChannel.class);

    private final AtomicLong sequence = new AtomicLong();

    @Override
    public ChannelResult send(String text) {
        String messageId = "log-" + sequence.incrementAndGet();
        LOG.info("[Alert-{}]\n{}", messageId, text);
        return ChannelResult.delivered(messageId);
    }

    @Override
    public String name() {
        return "log";
    }
}
