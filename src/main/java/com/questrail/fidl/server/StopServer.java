package com.questrail.fidl.server;

/**
 * Thrown by a server handler to end the dispatch loop cleanly. The channel
 * is closed and the loop reports that no more requests will be handled.
 */
public class StopServer extends RuntimeException
{
    public StopServer() {
        super("Server stop requested", null, false, false);
    }

    public StopServer(String message) {
        super(message, null, false, false);
    }
}
