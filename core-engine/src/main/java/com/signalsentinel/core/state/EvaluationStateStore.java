package com.signalsentinel.core.state;

/**
 * Holder of the engine's {@link EvaluationState}.
 *
 * <p>
 * The engine performs exactly one {@link #get()} and one {@link #set} per
 * cycle. A durable, shared implementation must make that read-modify-write
 * atomic (for example a conditional write in a key-value store); the
 * in-memory implementation relies on the single-evaluator deployment model.
 * </p>
 *
 * @since 1.0.0
 */
public interface EvaluationStateStore {

    EvaluationState get();

    void set(EvaluationState next);
}
