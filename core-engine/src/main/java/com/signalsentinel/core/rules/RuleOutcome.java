package com.signalsentinel.core.rules;

import com.signalsentinel.core.model.CandidateAlert;
import com.signalsentinel.core.state.EvaluationState;

import java.util.List;
import java.util.Objects;

/**
 * Result of one {@link AlertRule} evaluation.
 *
 * @since 1.0.0
 */
public final class RuleOutcome {

    private final List<CandidateAlert> alerts;
    private final EvaluationState nextState;

    private RuleOutcome(List<CandidateAlert> alerts, EvaluationState nextState) {
        this.alerts = List.copyOf(alerts);
        this.nextState = Objects.requireNonNull(nextState, "nextState must not be null");
    }

    public static RuleOutcome quiet(EvaluationState nextState) {
        return new RuleOutcome(List.of(), nextState);
    }

    public static RuleOutcome fired(CandidateAlert alert, EvaluationState nextState) {
        return new RuleOutcome(List.of(Objects.requireNonNull(alert, "alert must not be null")), nextState);
    }

    /**
     * @return unmodifiable list of candidates
     */
    public List<CandidateAlert> getAlerts() {
        return alerts;
    }

    public EvaluationState getNextState() {
        return nextState;
    }
}
