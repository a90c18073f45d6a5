package com.questrail.fidl.protocol;

/**
 * Raised when the arguments passed to a protocol callable do not match the
 * method's parameter shape.
 */
public final class CallShapeException extends IllegalArgumentException
{
    public CallShapeException(String message) {
        super(message);
    }
}
