package com.signalsentinel.core.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Chooses the {@link AlertChannel} implementation from the available
 * credentials.
 *
 * @since 1.0.0
 */
public final class AlertChannelFactory {

    private static final Logger LOG = LoggerFactory.getLogger(AlertChannelFactory.class);

    private AlertChannelFactory() {
        // utility class
    }

    /**
     * Create a Telegram channel when both credentials are present, a
     * {@link LoggingChannel} (dry run) otherwise.
     *
     * @param botToken       Telegram bot token, may be {@code null}
     * @param chatId         Telegram chat / channel id, may be {@code null}
     * @param requestTimeout request timeout for the Telegram channel
     * @return the channel to deliver through
     */
    public static AlertChannel create(String botToken, String chatId, Duration requestTimeout) {
        Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
        if (isBlank(botToken) || isBlank(chatId)) {
            LOG.warn("Telegram credentials not set – alerts will only be logged (dry run)");
            return new LoggingChannel();
        }
        LOG.info("Delivering alerts to Telegram chat {}", chatId);
        return new TelegramChannel(botToken, chatId, requestTimeout);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
