package com.signalsentinel.core.state;

/**
 * Position of the market score relative to the configured threshold.
 *
 * @since 1.0.0
 */
public enum MarketBand {
    ABOVE,
    BELOW;

    /**
     * @return {@link #ABOVE} when {@code score >= threshold}, {@link #BELOW}
     *         otherwise
     */
    public static MarketBand of(double score, double threshold) {
        return score >= threshold ? ABOVE : BELOW;
    }
}
