package com.questrail.fidl.transport;

import com.questrail.fidl.codec.EncodedMessage;

/**
 * Channel
 * -----------------------------------------------------------------------------
 * Minimal port for a message-oriented, bidirectional channel endpoint.
 *
 * <p>Reads never block. A read with nothing queued returns
 * {@link ChannelReadResult.WouldBlock}; callers wait on a {@link HandleWaker}
 * and read again.</p>
 *
 * <p>The owner of a {@code Channel} (a server, client or event handler) is
 * responsible for closing it.</p>
 */
public interface Channel
{
    /**
     * Reads the next queued message, if any.
     *
     * @throws TransportException on any failure other than would-block or peer-closed
     */
    ChannelReadResult read();

    /**
     * Writes one message.
     *
     * @throws TransportException if the message cannot be written
     */
    void write(EncodedMessage message);

    /**
     * Closes this end. Idempotent.
     */
    void close();

    boolean isClosed();

    /**
     * @return an identifier for diagnostics, e.g. the raw handle value
     */
    long id();
}
