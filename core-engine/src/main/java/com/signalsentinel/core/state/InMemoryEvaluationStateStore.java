package com.signalsentinel.core.state;

import java.util.Objects;

/**
 * Process-local {@link EvaluationStateStore}. State is lost on restart.
 *
 * <p>
 * Not thread-safe; one instance belongs to one evaluator.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryEvaluationStateStore implements EvaluationStateStore {

    private EvaluationState state;

    public InMemoryEvaluationStateStore() {
        this(EvaluationState.initial());
    }

    public InMemoryEvaluationStateStore(EvaluationState initial) {
        this.state = Objects.requireNonNull(initial, "initial state must not be null");
    }

    @Override
    public EvaluationState get() {
        return state;
    }

    @Override
    public void set(EvaluationState next) {
        this.state = Objects.requireNonNull(next, "next state must not be null");
    }
}
