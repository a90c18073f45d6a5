package com.questrail.fidl.decl;

/**
 * Raised when a union value is built with anything other than zero or one
 * variant, or with a variant the union does not declare.
 */
public final class UnionConstructionException extends IllegalArgumentException
{
    public UnionConstructionException(String message) {
        super(message);
    }
}
