package com.questrail.fidl.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of BindingObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jBindingObservabilitySink implements BindingObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jBindingObservabilitySink.class);

    @Override
    public void onStateTransition(BindingStateTransitionEvent event) {
        if (event.isTermination()) {
            log.info("{}: {} -> {}", event.source(), event.oldState(), event.newState());
        }
        else {
            log.trace("{}: {} -> {}", event.source(), event.oldState(), event.newState());
        }
    }

    @Override
    public void onProtocolEvent(BindingProtocolEvent event) {
        switch (event.kind()) {
            case LIBRARY_LOADED:
            case LIBRARY_MATERIALIZED:
            case SERVER_STARTED:
            case SERVER_STOPPED:
                log.debug("{}: {}", event.source(), event.kind());
                break;
            default:
                log.debug("{}: {} {} (ordinal={}, txid={})",
                    event.source(), event.kind(), event.method(), event.ordinal(), event.txid());
        }
    }

    @Override
    public void onTransportEvent(BindingTransportEvent event) {
        if (event.kind() == BindingTransportEvent.Kind.TRANSPORT_ERROR) {
            log.warn("{}: channel received error: {}", event.source(), event.detail());
        }
        else {
            log.debug("{}: {} {}", event.source(), event.kind(), event.detail() == null ? "" : event.detail());
        }
    }

    @Override
    public void onError(BindingErrorEvent event) {
        log.error("{}: {}", event.source(), event.message(), event.cause());
    }
}
