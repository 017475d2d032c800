package com.signalsentinel.core.dispatch;

import com.signalsentinel.core.model.AlertType;

/**
 * Formatting context for one candidate alert.
 *
 * <p>
 * Contexts are built by the caller from the same snapshot that produced the
 * candidates; the dispatcher never derives them itself.
 * </p>
 *
 * @since 1.0.0
 */
public interface AlertContext {

    /**
     * @return the alert type this context can format
     */
    AlertType getAlertType();

    /**
     * @return asset symbol shown in the message, e.g. {@code BTC}
     */
    String getAsset();
}
