package com.signalsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * A scored news item inside a {@link MarketSnapshot}.
 *
 * <p>
 * The {@code id} is a stable hash computed upstream (title + source +
 * publish time) and is the only key used for deduplication. The score uses a
 * {@code [0, 10]} scale; out-of-range values are tolerated here and clamped by
 * the rules that read them. {@code category} ({@code sentiment},
 * {@code macro}, {@code onchain}) is optional and only drives the caveat line
 * of the delivered message.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class NewsItem implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String title;
    private final double score;
    private final String bias;
    private final double confidence;
    private final String category;

    @JsonCreator
    public NewsItem(@JsonProperty("id") String id,
            @JsonProperty("title") String title,
            @JsonProperty("score") double score,
            @JsonProperty("bias") String bias,
            @JsonProperty("confidence") double confidence,
            @JsonProperty("category") String category) {
        this.id = id;
        this.title = title != null ? title : "";
        this.score = score;
        this.bias = bias != null ? bias : "neutral";
        this.confidence = confidence;
        this.category = category;
    }

    public NewsItem(String id, String title, double score, String bias, double confidence) {
        this(id, title, score, bias, confidence, null);
    }

    /**
     * @return the upstream identifier, or {@code null} if the producer omitted it
     */
    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public double getScore() {
        return score;
    }

    public String getBias() {
        return bias;
    }

    public double getConfidence() {
        return confidence;
    }

    /**
     * @return the category label, or {@code null} when not classified
     */
    public String getCategory() {
        return category;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NewsItem that))
            return false;
        return Double.compare(score, that.score) == 0
                && Double.compare(confidence, that.confidence) == 0
                && Objects.equals(id, that.id)
                && Objects.equals(title, that.title)
                && Objects.equals(bias, that.bias)
                && Objects.equals(category, that.category);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, title, score, bias, confidence, category);
    }

    @Override
    public String toString() {
        return "NewsItem{id='" + id + "', score=" + score + ", title='" + title + "'}";
    }
}
