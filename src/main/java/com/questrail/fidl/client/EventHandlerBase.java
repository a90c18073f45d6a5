package com.questrail.fidl.client;

import com.questrail.fidl.codec.MessageHeader;
import com.questrail.fidl.observability.BindingErrorEvent;
import com.questrail.fidl.observability.BindingProtocolEvent;
import com.questrail.fidl.protocol.MethodInfo;
import com.questrail.fidl.protocol.ProtocolRole;
import com.questrail.fidl.runtime.BindingContext;
import com.questrail.fidl.server.DispatchLoop;
import com.questrail.fidl.server.HandlerTable;
import com.questrail.fidl.server.MethodHandler;
import com.questrail.fidl.transport.ChannelReadResult;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * EventHandlerBase
 * =============================================================================
 * Receives the events a server sends on a client's channel and routes them to
 * handler methods.
 *
 * <p>Handlers are found the same way as on a server: one registered with
 * {@link #bind(String, MethodHandler)}, or failing that a public method named
 * after the event.
 * The loop ends when the peer closes the channel or a handler throws
 * {@link StopEventHandler}; any other failure ends it exceptionally.</p>
 */
public abstract class EventHandlerBase
{
    private final ProtocolRole role;
    private final ClientBase client;
    private final BindingContext context;
    private final HandlerTable handlers;
    private final AtomicBoolean terminated = new AtomicBoolean();

    protected EventHandlerBase(ProtocolRole role, ClientBase client, BindingContext context)
    {
        this.role = Objects.requireNonNull(role, "role");
        this.client = Objects.requireNonNull(client, "client");
        this.context = Objects.requireNonNull(context, "context");
        if (role.kind() != ProtocolRole.Kind.EVENT_HANDLER) {
            throw new IllegalArgumentException(role + " is not an event handler role");
        }
        this.handlers = new HandlerTable(this, EventHandlerBase.class);
    }

    /**
     * @throws IllegalArgumentException if the protocol has no such event
     */
    public final EventHandlerBase bind(String event, MethodHandler handler)
    {
        if (!role.handlers().containsKey(event)) {
            throw new IllegalArgumentException(role.name() + " has no event '" + event + "'");
        }
        handlers.bind(event, handler);
        return this;
    }

    public final ProtocolRole role()
    {
        return role;
    }

    public final boolean isTerminated()
    {
        return terminated.get();
    }

    public final CompletableFuture<Void> serve()
    {
        return DispatchLoop.run(this::handleNextEvent);
    }

    /**
     * Handles one event.
     *
     * @return {@code true} if an event was handled, {@code false} once the loop has ended
     */
    public final CompletableFuture<Boolean> handleNextEvent()
    {
        if (terminated.get()) {
            return CompletableFuture.completedFuture(false);
        }
        CompletableFuture<Boolean> step;
        try {
            step = client.nextEvent().thenCompose(this::dispatch);
        }
        catch (RuntimeException e) {
            step = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<Boolean> outcome = new CompletableFuture<>();
        step.whenComplete((more, error) -> {
            if (error == null) {
                outcome.complete(more);
                return;
            }
            Throwable cause = DispatchLoop.unwrap(error);
            terminated.set(true);
            if (cause instanceof StopEventHandler) {
                outcome.complete(false);
                return;
            }
            context.sink().onError(new BindingErrorEvent(Instant.now(), toString(),
                    "event handling error: " + cause.getMessage(), cause));
            outcome.completeExceptionally(cause);
        });
        return outcome;
    }

    private CompletableFuture<Boolean> dispatch(ChannelReadResult.Message message)
    {
        if (message == null) {
            terminated.set(true);
            return CompletableFuture.completedFuture(false);
        }
        MessageHeader header = MessageHeader.parse(message.bytes());
        MethodInfo info = role.methodMap().get(header.ordinal());
        if (info == null) {
            throw new ClientException(this + " received unknown event ordinal "
                    + Long.toUnsignedString(header.ordinal()));
        }
        Object decoded = context.codec().decodeMessage(message.bytes(), message.handles());
        Object payload = info.hasRequestPayload()
                ? context.values().construct(info.requestIdentifier(), decoded)
                : null;
        context.sink().onProtocolEvent(new BindingProtocolEvent(Instant.now(), toString(),
                BindingProtocolEvent.Kind.EVENT_RECEIVED, info.name(), header.ordinal(), 0));

        Object result;
        try {
            result = handlers.resolve(info.name()).handle(payload);
        }
        catch (RuntimeException e) {
            throw e;
        }
        catch (Exception e) {
            throw new CompletionException(e);
        }
        if (result instanceof CompletionStage) {
            return ((CompletionStage<?>) result).toCompletableFuture().thenApply(ignored -> true);
        }
        return CompletableFuture.completedFuture(true);
    }

    @Override
    public String toString()
    {
        return "event_handler:" + getClass().getSimpleName();
    }
}
