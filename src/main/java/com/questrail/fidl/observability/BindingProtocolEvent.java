package com.questrail.fidl.observability;

import java.time.Instant;

/**
 * Record representing library loading or message-level protocol activity.
 *
 * @param source  the emitting component, e.g. {@code server:EchoServer:3} or a library name
 * @param method  the protocol method involved, or {@code null}
 * @param ordinal the method ordinal, or {@code 0}
 * @param txid    the transaction id, or {@code 0}
 */
public record BindingProtocolEvent(
    Instant timestamp,
    String source,
    Kind kind,
    String method,
    long ordinal,
    long txid
) {
    public enum Kind {
        LIBRARY_LOADED,
        LIBRARY_MATERIALIZED,
        SERVER_STARTED,
        REQUEST_RECEIVED,
        RESPONSE_SENT,
        EVENT_SENT,
        EVENT_RECEIVED,
        SERVER_STOPPED
    }

    public static BindingProtocolEvent of(Instant timestamp, String source, Kind kind) {
        return new BindingProtocolEvent(timestamp, source, kind, null, 0, 0);
    }
}
