package com.questrail.fidl.observability;

import com.questrail.fidl.server.DispatchState;

import java.time.Instant;

/**
 * Record representing a state transition of one server's dispatch engine.
 */
public record BindingStateTransitionEvent(
    Instant timestamp,
    String source,
    DispatchState oldState,
    DispatchState newState
) {
    /**
     * Whether this transition ends the engine.
     */
    public boolean isTermination() {
        return newState == DispatchState.TERMINATED && oldState != DispatchState.TERMINATED;
    }
}
