package com.questrail.fidl.observability;

import java.time.Instant;

/**
 * Record representing a fatal error in the binding or dispatch stack.
 */
public record BindingErrorEvent(
    Instant timestamp,
    String source,
    String message,
    Throwable cause
) {
}
