package com.signalsentinel.core.dispatch;

import com.signalsentinel.core.model.AlertType;

import java.util.Objects;

/**
 * Context for a {@link AlertType#MARKET_STATE_ALERT}.
 *
 * @since 1.0.0
 */
public final class MarketContext implements AlertContext {

    private final String asset;
    private final double score;
    private final String bias;
    private final double confidence;

    public MarketContext(String asset, double score, String bias, double confidence) {
        this.asset = Objects.requireNonNull(asset, "asset must not be null");
        this.score = score;
        this.bias = bias != null ? bias : "";
        this.confidence = confidence;
    }

    @Override
    public AlertType getAlertType() {
        return AlertType.MARKET_STATE_ALERT;
    }

    @Override
    public String getAsset() {
        return asset;
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
    public String toString() {
        return "MarketContext{asset='" + asset + "', score=" + score + ", bias='" + bias + "'}";
    }
}
