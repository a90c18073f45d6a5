package com.questrail.fidl.transport;

/**
 * A channel operation failed for a reason other than would-block or
 * peer-closed. Carries the transport's status code.
 */
public final class TransportException extends RuntimeException
{
    private final int status;

    public TransportException(int status, String message) {
        super(message + " (status " + status + ")");
        this.status = status;
    }

    public TransportException(int status, String message, Throwable cause) {
        super(message + " (status " + status + ")", cause);
        this.status = status;
    }

    public int status() {
        return status;
    }
}
