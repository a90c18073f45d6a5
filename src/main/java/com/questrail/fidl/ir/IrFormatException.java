package com.questrail.fidl.ir;

/**
 * Raised when an IR document cannot be read or does not have the shape the
 * loader expects (unreadable file, malformed JSON, missing required key).
 */
public final class IrFormatException extends DefinitionException
{
    public IrFormatException(String message) {
        super(message);
    }

    public IrFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
