package com.questrail.fidl.client;

/**
 * Thrown by an event handler method to end its event loop cleanly.
 */
public class StopEventHandler extends RuntimeException
{
    public StopEventHandler() {
        super("Event handler stop requested", null, false, false);
    }
}
