package com.signalsentinel.core.dispatch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.signalsentinel.core.channel.ChannelResult;
import com.signalsentinel.core.model.AlertType;
import com.signalsentinel.core.model.CandidateAlert;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of one attempted candidate.
 *
 * <p>
 * {@code dispatched == true} means the channel confirmed delivery. Otherwise
 * {@code reason} explains why nothing was sent: missing context, throttling,
 * delivery dedup or a failed send (in which case {@code channelResult} holds
 * the channel's answer). Results are meant for logging and are not persisted.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DispatchResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final boolean dispatched;
    private final AlertType alertType;
    private final String subjectId;
    private final Instant alertTime;
    private final String reason;
    private final ChannelResult channelResult;

    private DispatchResult(boolean dispatched, CandidateAlert alert, String reason, ChannelResult channelResult) {
        Objects.requireNonNull(alert, "alert must not be null");
        this.dispatched = dispatched;
        this.alertType = alert.getType();
        this.subjectId = alert.getSubjectId().orElse(null);
        this.alertTime = alert.getCreatedAt();
        this.reason = reason;
        this.channelResult = channelResult;
    }

    public static DispatchResult dispatched(CandidateAlert alert, ChannelResult channelResult) {
        return new DispatchResult(true, alert, null, channelResult);
    }

    public static DispatchResult rejected(CandidateAlert alert, String reason) {
        return new DispatchResult(false, alert, reason, null);
    }

    public static DispatchResult failed(CandidateAlert alert, String reason, ChannelResult channelResult) {
        return new DispatchResult(false, alert, reason, channelResult);
    }

    public boolean isDispatched() {
        return dispatched;
    }

    public AlertType getAlertType() {
        return alertType;
    }

    /**
     * @return the news id for news alerts, {@code null} otherwise
     */
    public String getSubjectId() {
        return subjectId;
    }

    /**
     * @return the cycle timestamp of the candidate
     */
    public Instant getAlertTime() {
        return alertTime;
    }

    /**
     * @return why nothing was sent, {@code null} when dispatched
     */
    public String getReason() {
        return reason;
    }

    /**
     * @return the channel's answer, {@code null} if the channel was not called
     */
    public ChannelResult getChannelResult() {
        return channelResult;
    }

    @Override
    public String toString() {
        return "DispatchResult{" +
                "dispatched=" + dispatched +
                ", alertType=" + alertType +
                (subjectId != null ? ", subjectId='" + subjectId + '\'' : "") +
                (reason != null ? ", reason='" + reason + '\'' : "") +
                (channelResult != null ? ", channelResult=" + channelResult : "") +
                '}';
    }
}
