package com.questrail.fidl.client;

/**
 * A call or event could not be completed: the peer closed the channel while
 * a reply was outstanding, or sent a message the protocol does not define.
 */
public final class ClientException extends RuntimeException
{
    public ClientException(String message) {
        super(message);
    }
}
