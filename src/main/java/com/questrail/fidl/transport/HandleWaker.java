package com.questrail.fidl.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Readiness notification for channels.
 *
 * <p>A channel is registered once by its owner before the first read and
 * unregistered when the owner is done with it. {@link #awaitReady(Channel)}
 * returns a future that completes when the channel becomes readable (or is
 * closed by the peer). Spurious completions are allowed; callers always
 * re-read.</p>
 */
public interface HandleWaker
{
    void register(Channel channel);

    void unregister(Channel channel);

    /**
     * @return a future completed by the next readiness notification for the channel
     */
    CompletableFuture<Void> awaitReady(Channel channel);
}
