package com.signalsentinel.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Channel-level throttle applied by the dispatcher.
 *
 * <pre>
 * dispatch:
 *   cooldownMinutes: 30
 * </pre>
 *
 * <p>
 * The same window is enforced globally (any message) and per alert type.
 * </p>
 *
 * @since 1.0.0
 */
public class DispatchConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private Double cooldownMinutes;

    public DispatchConfig() {
    }

    /**
     * @throws IllegalStateException if {@code cooldownMinutes} is invalid
     */
    public static DispatchConfig of(double cooldownMinutes) {
        DispatchConfig config = new DispatchConfig();
        config.setCooldownMinutes(cooldownMinutes);
        config.validate();
        return config;
    }

    /**
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (AlertConfig.requireFinite(errors, "cooldownMinutes", cooldownMinutes) && cooldownMinutes < 0) {
            errors.add("'cooldownMinutes' must be >= 0, got: " + cooldownMinutes);
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid DispatchConfig: " + String.join("; ", errors));
        }
    }

    public Duration cooldown() {
        return AlertConfig.minutesToDuration(cooldownMinutes);
    }

    public Double getCooldownMinutes() {
        return cooldownMinutes;
    }

    public void setCooldownMinutes(Double cooldownMinutes) {
        this.cooldownMinutes = cooldownMinutes;
    }

    @Override
    public String toString() {
        return "DispatchConfig{cooldownMinutes=" + cooldownMinutes + '}';
    }
}
