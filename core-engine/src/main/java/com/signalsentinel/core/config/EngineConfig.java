package com.signalsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the engine YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * alerts:
 *   marketScoreThreshold: 80
 *   highImpactNewsScore: 8.5
 *   whaleNetFlowThreshold: 2000
 *   cooldownMinutes: 30
 * dispatch:
 *   cooldownMinutes: 30
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading; both sections are required.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private AlertConfig alerts;
    private DispatchConfig dispatch;

    public EngineConfig() {
    }

    public EngineConfig(AlertConfig alerts, DispatchConfig dispatch) {
        this.alerts = alerts;
        this.dispatch = dispatch;
    }

    /**
     * Validate both sections, collecting every error into one exception.
     *
     * @throws IllegalStateException if any section is missing or invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (alerts == null) {
            errors.add("Section 'alerts' is required");
        } else {
            collect(errors, alerts::validate);
        }
        if (dispatch == null) {
            errors.add("Section 'dispatch' is required");
        } else {
            collect(errors, dispatch::validate);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Engine configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    private static void collect(List<String> errors, Runnable validation) {
        try {
            validation.run();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }
    }

    public AlertConfig getAlerts() {
        return alerts;
    }

    public void setAlerts(AlertConfig alerts) {
        this.alerts = alerts;
    }

    public DispatchConfig getDispatch() {
        return dispatch;
    }

    public void setDispatch(DispatchConfig dispatch) {
        this.dispatch = dispatch;
    }

    @Override
    public String toString() {
        return "EngineConfig{alerts=" + alerts + ", dispatch=" + dispatch + '}';
    }
}
