package com.questrail.fidl.server;

/**
 * A bound implementation of one protocol method.
 *
 * <p>The request is the typed payload, or {@code null} for a method without
 * one. The result may be the response value (typed or plain), {@code null},
 * a {@link DomainError}, a {@link FrameworkError}, or a
 * {@link java.util.concurrent.CompletionStage} of any of these.</p>
 */
@FunctionalInterface
public interface MethodHandler
{
    Object handle(Object request) throws Exception;
}
