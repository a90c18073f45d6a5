package com.questrail.fidl.server;

import java.util.Objects;

/**
 * Returned by a handler of a method that declares an error type; it is sent
 * as the {@code err} variant of the method's result.
 *
 * @param error the error value, in plain or typed form
 */
public record DomainError(Object error) {
    public DomainError {
        Objects.requireNonNull(error, "error");
    }
}
