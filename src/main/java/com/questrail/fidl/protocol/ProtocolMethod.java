package com.questrail.fidl.protocol;

import java.util.Objects;
import java.util.Optional;

/**
 * One method of a compiled protocol.
 *
 * <p>{@code responseIdentifier} is the raw identifier of the reply payload
 * type of a two-way method; {@code null} when there is none.</p>
 */
public record ProtocolMethod(
        String name,
        String rawName,
        long ordinal,
        Kind kind,
        boolean strict,
        boolean hasResult,
        MethodSignature signature,
        String responseIdentifier,
        Optional<String> documentation
) {
    public enum Kind {
        /** Request with a reply. */
        TWO_WAY,
        /** Request without a reply. */
        ONE_WAY,
        /** Server-initiated message. */
        EVENT
    }

    public ProtocolMethod {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(documentation, "documentation");
    }
}
