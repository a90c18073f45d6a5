/**
 * Channel Transport Port
 * =============================================================================
 *
 * <p>Ports to the channel transport and its readiness notification. The
 * binding runtime never owns a socket or a kernel object directly; it reads
 * and writes whole messages through {@link com.questrail.fidl.transport.Channel}
 * and suspends on {@link com.questrail.fidl.transport.HandleWaker} when no
 * message is ready.</p>
 *
 * <h2>Read outcomes</h2>
 * A read yields exactly one of:
 * <ul>
 *   <li>a message (bytes plus transferred handles)</li>
 *   <li>would-block: nothing is queued; retry after readiness</li>
 *   <li>peer closed: no more messages will ever arrive</li>
 * </ul>
 * Any other transport failure is a {@link com.questrail.fidl.transport.TransportException}.
 *
 * <p>Implementations are provided by the embedding process; tests use an
 * in-memory fake.</p>
 */
package com.questrail.fidl.transport;
