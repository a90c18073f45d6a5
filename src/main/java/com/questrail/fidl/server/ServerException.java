package com.questrail.fidl.server;

/**
 * A fatal dispatch fault: a handler broke its method's contract, or the
 * peer sent a message the protocol does not define. The channel is closed
 * before this is raised.
 */
public final class ServerException extends RuntimeException
{
    public ServerException(String message) {
        super(message);
    }

    public ServerException(String message, Throwable cause) {
        super(message, cause);
    }
}
