/**
 * The three alert rules.
 *
 * <p>
 * Every rule implements {@link com.signalsentinel.core.rules.AlertRule} and
 * is a pure function of snapshot, configuration and
 * {@link com.signalsentinel.core.state.EvaluationState}:
 * </p>
 * <ul>
 * <li>{@link com.signalsentinel.core.rules.MarketStateRule} — edge-triggered
 * market score threshold crossing</li>
 * <li>{@link com.signalsentinel.core.rules.WhaleActivityRule} — net-flow delta
 * between consecutive cycles</li>
 * <li>{@link com.signalsentinel.core.rules.HighImpactNewsRule} — first unseen
 * news item above the impact threshold</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.signalsentinel.core.rules;
