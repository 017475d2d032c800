package com.signalsentinel.core.state;

import com.signalsentinel.core.model.AlertType;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Delivery history owned by the dispatcher.
 *
 * <p>
 * Tracks the last successful delivery per alert type, the last successful
 * delivery of any type, and every news id that was actually delivered. It is
 * deliberately separate from {@link EvaluationState}: a news item can be
 * generated as a candidate yet fail to be delivered, and stays deliverable
 * here until a send succeeds.
 * </p>
 *
 * <p>
 * Immutable. The delivered-news set only grows.
 * </p>
 *
 * @since 1.0.0
 */
public final class DispatchState implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final DispatchState INITIAL =
            new DispatchState(new EnumMap<>(AlertType.class), null, Set.of());

    private final Map<AlertType, Instant> lastSentByType;
    private final Instant lastSentAt;
    private final Set<String> deliveredNewsIds;

    private DispatchState(Map<AlertType, Instant> lastSentByType, Instant lastSentAt, Set<String> deliveredNewsIds) {
        EnumMap<AlertType, Instant> copy = new EnumMap<>(AlertType.class);
        copy.putAll(lastSentByType);
        this.lastSentByType = Collections.unmodifiableMap(copy);
        this.lastSentAt = lastSentAt;
        this.deliveredNewsIds = Collections.unmodifiableSet(new HashSet<>(deliveredNewsIds));
    }

    public static DispatchState initial() {
        return INITIAL;
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * Check the channel throttle for a type. Both the global window and the
     * per-type window must have elapsed.
     *
     * @param type     alert type about to be sent
     * @param now      cycle timestamp
     * @param cooldown throttle window
     * @return {@code true} if a message of this type may be sent now
     */
    public boolean canSend(AlertType type, Instant now, Duration cooldown) {
        if (lastSentAt != null && Duration.between(lastSentAt, now).compareTo(cooldown) < 0) {
            return false;
        }
        Instant lastOfType = lastSentByType.get(type);
        return lastOfType == null || Duration.between(lastOfType, now).compareTo(cooldown) >= 0;
    }

    public boolean isNewsDelivered(String newsId) {
        return deliveredNewsIds.contains(newsId);
    }

    // ---------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------

    /**
     * Record a successful delivery.
     *
     * @param type   delivered alert type
     * @param at     delivery time (cycle timestamp)
     * @param newsId delivered news id, or {@code null} for non-news alerts
     * @return the new state
     */
    public DispatchState recordDelivery(AlertType type, Instant at, String newsId) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(at, "at must not be null");

        Map<AlertType, Instant> sent = new EnumMap<>(AlertType.class);
        sent.putAll(lastSentByType);
        sent.put(type, at);

        Set<String> delivered = deliveredNewsIds;
        if (newsId != null) {
            delivered = new HashSet<>(deliveredNewsIds);
            delivered.add(newsId);
        }
        return new DispatchState(sent, at, delivered);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public Optional<Instant> getLastSent(AlertType type) {
        return Optional.ofNullable(lastSentByType.get(type));
    }

    public Optional<Instant> getLastSentAt() {
        return Optional.ofNullable(lastSentAt);
    }

    public Set<String> getDeliveredNewsIds() {
        return deliveredNewsIds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DispatchState that))
            return false;
        return lastSentByType.equals(that.lastSentByType)
                && Objects.equals(lastSentAt, that.lastSentAt)
                && deliveredNewsIds.equals(that.deliveredNewsIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lastSentByType, lastSentAt, deliveredNewsIds);
    }

    @Override
    public String toString() {
        return "DispatchState{" +
                "lastSentByType=" + lastSentByType +
                ", lastSentAt=" + lastSentAt +
                ", deliveredNewsIds=" + deliveredNewsIds.size() +
                '}';
    }
}
