package com.signalsentinel.core.dispatch;

import com.signalsentinel.core.model.AlertType;

import java.util.Objects;

/**
 * Context for a {@link AlertType#WHALE_ACTIVITY_ALERT}.
 *
 * @since 1.0.0
 */
public final class WhaleContext implements AlertContext {

    private final String asset;
    private final double netFlow;

    public WhaleContext(String asset, double netFlow) {
        this.asset = Objects.requireNonNull(asset, "asset must not be null");
        this.netFlow = netFlow;
    }

    @Override
    public AlertType getAlertType() {
        return AlertType.WHALE_ACTIVITY_ALERT;
    }

    @Override
    public String getAsset() {
        return asset;
    }

    public double getNetFlow() {
        return netFlow;
    }

    @Override
    public String toString() {
        return "WhaleContext{asset='" + asset + "', netFlow=" + netFlow + '}';
    }
}
