package com.questrail.fidl.observability;

/**
 * No-op implementation of BindingObservabilitySink.
 */
public final class NullObservabilitySink implements BindingObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(BindingStateTransitionEvent event) {}

    @Override
    public void onProtocolEvent(BindingProtocolEvent event) {}

    @Override
    public void onTransportEvent(BindingTransportEvent event) {}

    @Override
    public void onError(BindingErrorEvent event) {}
}
