package com.questrail.fidl.decl;

/**
 * Raised by {@link UnionValue#unwrap()} when a result union holds neither a
 * response nor an error.
 */
public final class EmptyResultException extends RuntimeException
{
    private final String typeName;

    public EmptyResultException(String typeName) {
        super("Failed to unwrap " + typeName + " with no error or response.");
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }
}
