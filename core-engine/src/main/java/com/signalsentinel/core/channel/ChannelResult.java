package com.signalsentinel.core.channel;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.Objects;

/**
 * Outcome of {@link AlertChannel#send(String)}.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ChannelResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final boolean success;
    private final String messageId;
    private final String errorReason;

    private ChannelResult(boolean success, String messageId, String errorReason) {
        this.success = success;
        this.messageId = messageId;
        this.errorReason = errorReason;
    }

    /**
     * @param messageId channel-assigned id, may be {@code null}
     */
    public static ChannelResult delivered(String messageId) {
        return new ChannelResult(true, messageId, null);
    }

    public static ChannelResult failed(String errorReason) {
        return new ChannelResult(false, null,
                errorReason != null && !errorReason.isBlank() ? errorReason : "Unknown channel error");
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * @return channel-assigned message id, or {@code null}
     */
    public String getMessageId() {
        return messageId;
    }

    /**
     * @return failure reason, {@code null} on success
     */
    public String getErrorReason() {
        return errorReason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ChannelResult that))
            return false;
        return success == that.success
                && Objects.equals(messageId, that.messageId)
                && Objects.equals(errorReason, that.errorReason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(success, messageId, errorReason);
    }

    @Override
    public String toString() {
        return success
                ? "ChannelResult{delivered, messageId=" + messageId + '}'
                : "ChannelResult{failed, reason='" + errorReason + "'}";
    }
}
