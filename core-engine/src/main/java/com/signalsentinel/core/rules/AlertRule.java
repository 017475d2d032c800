package com.signalsentinel.core.rules;

import com.signalsentinel.core.config.AlertConfig;
import com.signalsentinel.core.model.AlertType;
import com.signalsentinel.core.model.MarketSnapshot;
import com.signalsentinel.core.state.EvaluationState;

/**
 * Contract for the alert rule evaluators.
 *
 * <p>
 * A rule is a deterministic function of snapshot, configuration and
 * evaluation state. Implementations hold no mutable fields: everything they
 * remember travels in the returned {@link EvaluationState}. They use
 * {@link MarketSnapshot#getTimestamp()} as "now", perform no I/O and never
 * read the wall clock, so they can be driven with synthetic time.
 * </p>
 *
 * @since 1.0.0
 */
public interface AlertRule {

    /**
     * Evaluate one snapshot.
     *
     * @param snapshot current cycle's snapshot
     * @param config   thresholds and cooldown
     * @param state    state produced by the previous rule or cycle
     * @return candidates (possibly none) and the next state
     */
    RuleOutcome evaluate(MarketSnapshot snapshot, AlertConfig config, EvaluationState state);

    /**
     * @return the alert type this rule produces
     */
    AlertType getType();
}
