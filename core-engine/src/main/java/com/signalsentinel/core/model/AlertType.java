package com.signalsentinel.core.model;

/**
 * The three fixed alert kinds produced by the rule evaluators.
 *
 * <p>
 * Constants are declared in dispatch priority order: when several candidates
 * compete for the single message of a cycle, a market-state alert wins over a
 * whale-activity alert, which wins over a high-impact-news alert.
 * </p>
 *
 * @since 1.0.0
 */
public enum AlertType {

    MARKET_STATE_ALERT,

    WHALE_ACTIVITY_ALERT,

    HIGH_IMPACT_NEWS_ALERT;

    /**
     * @return dispatch priority, lower is more important
     */
    public int dispatchPriority() {
        return ordinal();
    }
}
