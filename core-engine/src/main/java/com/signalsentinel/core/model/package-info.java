/**
 * Domain model classes for Signal Sentinel.
 *
 * <p>
 * This package contains the value types shared between the rule engine, the
 * dispatcher and the Flink job layer:
 * </p>
 * <ul>
 * <li>{@link com.signalsentinel.core.model.MarketSnapshot} — one cycle of
 * derived market metrics</li>
 * <li>{@link com.signalsentinel.core.model.CandidateAlert} — a potential
 * notification produced by a rule</li>
 * <li>{@link com.signalsentinel.core.model.AlertType} — the three alert kinds,
 * in dispatch priority order</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.signalsentinel.core.model;
