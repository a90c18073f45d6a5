package com.questrail.fidl.protocol;

import java.util.Objects;
import java.util.Optional;

/**
 * Dispatch metadata for one method, keyed by ordinal in a role's method map.
 *
 * @param name               handler name (lowerCamelCase)
 * @param requestIdentifier  identifier of the inbound payload type; empty when
 *                           the method carries no payload
 * @param requiresResponse   the method declares a response with a payload
 * @param emptyResponse      the method declares a response without a payload
 * @param hasResult          the response payload is a result union
 * @param responseIdentifier raw identifier of the response payload type, or
 *                           {@code null}
 */
public record MethodInfo(
        String name,
        String requestIdentifier,
        boolean requiresResponse,
        boolean emptyResponse,
        boolean hasResult,
        String responseIdentifier
) {
    public MethodInfo {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(requestIdentifier, "requestIdentifier");
    }

    public boolean hasRequestPayload() {
        return !requestIdentifier.isEmpty();
    }

    public Optional<String> response() {
        return Optional.ofNullable(responseIdentifier);
    }
}
