package com.questrail.fidl.observability;

/**
 * Main interface for receiving binding and dispatch observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface BindingObservabilitySink {
    /**
     * Called when a dispatch engine changes state.
     * @param event the transition event details
     */
    void onStateTransition(BindingStateTransitionEvent event);

    /**
     * Called for library loading and per-message protocol activity.
     * @param event the protocol event
     */
    void onProtocolEvent(BindingProtocolEvent event);

    /**
     * Called when a transport-level signal is observed (would-block, peer closed).
     * @param event the transport event
     */
    void onTransportEvent(BindingTransportEvent event);

    /**
     * Called when a fatal error terminates a server or a handler.
     * @param event the error event
     */
    void onError(BindingErrorEvent event);
}
