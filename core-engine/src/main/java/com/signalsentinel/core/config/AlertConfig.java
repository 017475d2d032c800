package com.signalsentinel.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Thresholds and cooldown used by the rule evaluators.
 *
 * <p>
 * Expected YAML structure (under the {@code alerts} key of the engine
 * document):
 * </p>
 *
 * <pre>
 * alerts:
 *   marketScoreThreshold: 80
 *   highImpactNewsScore: 8.5
 *   whaleNetFlowThreshold: 2000
 *   cooldownMinutes: 30
 * </pre>
 *
 * <p>
 * All four values are <strong>required</strong>; the core assumes no
 * defaults. Call {@link #validate()} after construction / deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Market score at or above which the market is in the "above" band. */
    private Double marketScoreThreshold;

    /** Minimum news score (0..10 scale) for a high-impact news candidate. */
    private Double highImpactNewsScore;

    /** Minimum absolute change in whale net flow between two cycles. */
    private Double whaleNetFlowThreshold;

    /** Minimum time between two candidates of the same type, in minutes. */
    private Double cooldownMinutes;

    public AlertConfig() {
    }

    /**
     * Create and validate a configuration in one step.
     *
     * @throws IllegalStateException if any value is invalid
     */
    public static AlertConfig of(double marketScoreThreshold,
            double highImpactNewsScore,
            double whaleNetFlowThreshold,
            double cooldownMinutes) {
        AlertConfig config = new AlertConfig();
        config.setMarketScoreThreshold(marketScoreThreshold);
        config.setHighImpactNewsScore(highImpactNewsScore);
        config.setWhaleNetFlowThreshold(whaleNetFlowThreshold);
        config.setCooldownMinutes(cooldownMinutes);
        config.validate();
        return config;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that every value is present and within its legal range.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        requireFinite(errors, "marketScoreThreshold", marketScoreThreshold);
        if (requireFinite(errors, "highImpactNewsScore", highImpactNewsScore)
                && (highImpactNewsScore < 0 || highImpactNewsScore > 10)) {
            errors.add("'highImpactNewsScore' must be within [0, 10], got: " + highImpactNewsScore);
        }
        if (requireFinite(errors, "whaleNetFlowThreshold", whaleNetFlowThreshold)
                && whaleNetFlowThreshold < 0) {
            errors.add("'whaleNetFlowThreshold' must be >= 0, got: " + whaleNetFlowThreshold);
        }
        if (requireFinite(errors, "cooldownMinutes", cooldownMinutes) && cooldownMinutes < 0) {
            errors.add("'cooldownMinutes' must be >= 0, got: " + cooldownMinutes);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid AlertConfig: " + String.join("; ", errors));
        }
    }

    static boolean requireFinite(List<String> errors, String name, Double value) {
        if (value == null) {
            errors.add("'" + name + "' is required");
            return false;
        }
        if (!Double.isFinite(value)) {
            errors.add("'" + name + "' must be a finite number, got: " + value);
            return false;
        }
        return true;
    }

    /**
     * Convert fractional minutes to a whole-millisecond duration, never
     * negative.
     */
    static Duration minutesToDuration(double minutes) {
        return Duration.ofMillis(Math.max(0L, (long) Math.floor(minutes * 60_000d)));
    }

    // ---------------------------------------------------------------
    // Derived values
    // ---------------------------------------------------------------

    /**
     * @return the per-type cooldown window
     */
    public Duration cooldown() {
        return minutesToDuration(cooldownMinutes);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public Double getMarketScoreThreshold() {
        return marketScoreThreshold;
    }

    public void setMarketScoreThreshold(Double marketScoreThreshold) {
        this.marketScoreThreshold = marketScoreThreshold;
    }

    public Double getHighImpactNewsScore() {
        return highImpactNewsScore;
    }

    public void setHighImpactNewsScore(Double highImpactNewsScore) {
        this.highImpactNewsScore = highImpactNewsScore;
    }

    public Double getWhaleNetFlowThreshold() {
        return whaleNetFlowThreshold;
    }

    public void setWhaleNetFlowThreshold(Double whaleNetFlowThreshold) {
        this.whaleNetFlowThreshold = whaleNetFlowThreshold;
    }

    public Double getCooldownMinutes() {
        return cooldownMinutes;
    }

    public void setCooldownMinutes(Double cooldownMinutes) {
        this.cooldownMinutes = cooldownMinutes;
    }

    @Override
    public String toString() {
        return "AlertConfig{" +
                "marketScoreThreshold=" + marketScoreThreshold +
                ", highImpactNewsScore=" + highImpactNewsScore +
                ", whaleNetFlowThreshold=" + whaleNetFlowThreshold +
                ", cooldownMinutes=" + cooldownMinutes +
                '}';
    }
}
