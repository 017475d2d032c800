package com.signalsentinel.core.dispatch;

import com.signalsentinel.core.model.AlertType;
import com.signalsentinel.core.model.CandidateAlert;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mapping from alert identity to {@link AlertContext}.
 *
 * <p>
 * Market and whale alerts are identified by their type name; news alerts by
 * {@code news:<newsId>}, so each news item carries its own context.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertContexts {

    private static final String NEWS_PREFIX = "news:";

    private final Map<String, AlertContext> byKey;

    private AlertContexts(Map<String, AlertContext> byKey) {
        this.byKey = Collections.unmodifiableMap(new LinkedHashMap<>(byKey));
    }

    public static AlertContexts empty() {
        return new AlertContexts(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, AlertContext> byKey = new LinkedHashMap<>();

        public Builder market(MarketContext context) {
            byKey.put(AlertType.MARKET_STATE_ALERT.name(), Objects.requireNonNull(context));
            return this;
        }

        public Builder whale(WhaleContext context) {
            byKey.put(AlertType.WHALE_ACTIVITY_ALERT.name(), Objects.requireNonNull(context));
            return this;
        }

        public Builder news(NewsContext context) {
            byKey.put(NEWS_PREFIX + context.getNewsId(), context);
            return this;
        }

        public AlertContexts build() {
            return new AlertContexts(byKey);
        }
    }

    /**
     * Resolve the context for a candidate.
     *
     * @param alert candidate alert
     * @return the registered context, empty if none
     */
    public Optional<AlertContext> find(CandidateAlert alert) {
        return keyFor(alert).map(byKey::get);
    }

    /**
     * @return the identity key of a candidate; empty for a news alert that has
     *         no subject id
     */
    public static Optional<String> keyFor(CandidateAlert alert) {
        if (alert.getType() == AlertType.HIGH_IMPACT_NEWS_ALERT) {
            return alert.getSubjectId().map(id -> NEWS_PREFIX + id);
        }
        return Optional.of(alert.getType().name());
    }

    public int size() {
        return byKey.size();
    }

    @Override
    public String toString() {
        return "AlertContexts" + byKey.keySet();
    }
}
