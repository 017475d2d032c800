package com.signalsentinel.core.channel;

/**
 * Delivery boundary for formatted alert messages.
 *
 * <p>
 * Implementations deliver plain text to a human-facing channel and report
 * the outcome as a {@link ChannelResult}. Transport problems (including
 * timeouts, which are the channel's own responsibility) are reported as
 * failed results rather than thrown.
 * </p>
 *
 * @since 1.0.0
 */
public interface AlertChannel {

    /**
     * Deliver a message. Blocks until the outcome is known.
     *
     * @param text message body
     * @return delivery outcome, never {@code null}
     */
    ChannelResult send(String text);

    /**
     * @return short channel name used in logs and health output
     */
    String name();
}
