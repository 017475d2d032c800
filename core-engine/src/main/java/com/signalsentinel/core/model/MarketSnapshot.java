package com.signalsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One evaluation cycle's worth of derived market-intelligence metrics.
 *
 * <p>
 * Snapshots are produced upstream (ingestion, clustering and scoring) and
 * arrive as JSON:
 * </p>
 *
 * <pre>
 * {
 *   "market":    { "score": 82, "bias": "bullish", "confidence": 72 },
 *   "news":      [ { "id": "...", "title": "...", "score": 8.7, "bias": "bullish", "confidence": 78 } ],
 *   "whale":     { "netFlow": 2265 },
 *   "timestamp": 1769472000000
 * }
 * </pre>
 *
 * <h3>Clock</h3>
 * <p>
 * {@link #getTimestamp()} is the authoritative clock for every cooldown and
 * throttle decision made while processing this snapshot. Timestamps are
 * expected to be non-decreasing across cycles.
 * </p>
 *
 * <h3>Missing sections</h3>
 * <p>
 * A missing {@code news} array becomes an empty list. Missing {@code market}
 * or {@code whale} sections are reported as empty optionals, and the rules
 * that depend on them skip the cycle.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class MarketSnapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    private final MarketReading market;
    private final List<NewsItem> news;
    private final WhaleFlow whale;
    private final Instant timestamp;

    @JsonCreator
    MarketSnapshot(@JsonProperty("market") MarketReading market,
            @JsonProperty("news") List<NewsItem> news,
            @JsonProperty("whale") WhaleFlow whale,
            @JsonProperty("timestamp") long timestampMillis) {
        this(market, news, whale, Instant.ofEpochMilli(timestampMillis));
    }

    private MarketSnapshot(MarketReading market, List<NewsItem> news, WhaleFlow whale, Instant timestamp) {
        this.market = market;
        this.news = news != null
                ? Collections.unmodifiableList(new ArrayList<>(news))
                : List.of();
        this.whale = whale;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder, mainly for callers that assemble snapshots in code.
     * {@code timestamp} is required.
     */
    public static class Builder {
        private MarketReading market;
        private final List<NewsItem> news = new ArrayList<>();
        private WhaleFlow whale;
        private Instant timestamp;

        public Builder market(double score, String bias, double confidence) {
            this.market = new MarketReading(score, bias, confidence);
            return this;
        }

        public Builder market(MarketReading market) {
            this.market = market;
            return this;
        }

        public Builder news(NewsItem item) {
            this.news.add(item);
            return this;
        }

        public Builder news(List<NewsItem> items) {
            this.news.addAll(items);
            return this;
        }

        public Builder whaleNetFlow(double netFlow) {
            this.whale = new WhaleFlow(netFlow);
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        /**
         * @return a new snapshot
         * @throws NullPointerException if no timestamp was set
         */
        public MarketSnapshot build() {
            return new MarketSnapshot(market, news, whale, timestamp);
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    @JsonIgnore
    public Optional<MarketReading> getMarket() {
        return Optional.ofNullable(market);
    }

    /**
     * @return unmodifiable list of news items in upstream order
     */
    public List<NewsItem> getNews() {
        return news;
    }

    @JsonIgnore
    public Optional<WhaleFlow> getWhale() {
        return Optional.ofNullable(whale);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MarketSnapshot that))
            return false;
        return Objects.equals(market, that.market)
                && Objects.equals(news, that.news)
                && Objects.equals(whale, that.whale)
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(market, news, whale, timestamp);
    }

    @Override
    public String toString() {
        return "MarketSnapshot{" +
                "market=" + market +
                ", news=" + news.size() + " item(s)" +
                ", whale=" + whale +
                ", timestamp=" + timestamp +
                '}';
    }
}
