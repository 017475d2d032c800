package com.signalsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Aggregate market score of one snapshot.
 *
 * <p>
 * The score is unbounded but conventionally lies in {@code [0, 100]}. The
 * bias is a free-form qualitative label ({@code bullish}, {@code bearish},
 * {@code neutral}) and the confidence a percentage.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class MarketReading implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double score;
    private final String bias;
    private final double confidence;

    @JsonCreator
    public MarketReading(@JsonProperty("score") double score,
            @JsonProperty("bias") String bias,
            @JsonProperty("confidence") double confidence) {
        this.score = score;
        this.bias = bias != null ? bias : "neutral";
        this.confidence = confidence;
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

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MarketReading that))
            return false;
        return Double.compare(score, that.score) == 0
                && Double.compare(confidence, that.confidence) == 0
                && Objects.equals(bias, that.bias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(score, bias, confidence);
    }

    @Override
    public String toString() {
        return "MarketReading{score=" + score + ", bias='" + bias + "', confidence=" + confidence + '}';
    }
}
