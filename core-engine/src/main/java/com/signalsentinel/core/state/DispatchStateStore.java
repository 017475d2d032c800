package com.signalsentinel.core.state;

/**
 * Holder of the dispatcher's {@link DispatchState}.
 *
 * <p>
 * Same contract as {@link EvaluationStateStore}: the dispatcher writes only
 * after the channel has confirmed a delivery.
 * </p>
 *
 * @since 1.0.0
 */
public interface DispatchStateStore {

    DispatchState get();

    void set(DispatchState next);
}
