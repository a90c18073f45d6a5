package com.questrail.fidl.server;

/**
 * Framework-level errors a flexible method may answer with; sent as the
 * {@code framework_err} variant of the method's result.
 */
public enum FrameworkError
{
    UNKNOWN_METHOD(-2);

    private final int value;

    FrameworkError(int value) {
        this.value = value;
    }

    /**
     * @return the wire value
     */
    public int value() {
        return value;
    }
}
