package com.signalsentinel.core.state;

import java.util.Objects;

/**
 * Process-local {@link DispatchStateStore}. Not thread-safe.
 *
 * @since 1.0.0
 */
public class InMemoryDispatchStateStore implements DispatchStateStore {

    private DispatchState state = DispatchState.initial();

    @Override
    public DispatchState get() {
        return state;
    }

    @Override
    public void set(DispatchState next) {
        this.state = Objects.requireNonNull(next, "next state must not be null");
    }
}
