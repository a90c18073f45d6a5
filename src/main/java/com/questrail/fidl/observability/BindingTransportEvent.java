package com.questrail.fidl.observability;

import java.time.Instant;

/**
 * Record representing a transport signal seen by a server or client.
 */
public record BindingTransportEvent(
    Instant timestamp,
    String source,
    Kind kind,
    String detail
) {
    public enum Kind {
        /** A read found no message; the reader waits for readiness and retries. */
        WOULD_BLOCK,
        /** The peer closed its end; the reader ends cleanly. */
        PEER_CLOSED,
        /** The local end was closed. */
        CHANNEL_CLOSED,
        /** The transport reported a status other than the two signals above. */
        TRANSPORT_ERROR
    }
}
