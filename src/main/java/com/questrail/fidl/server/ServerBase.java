package com.questrail.fidl.server;

import com.questrail.fidl.codec.EncodedMessage;
import com.questrail.fidl.codec.MessageHeader;
import com.questrail.fidl.decl.DeclaredValue;
import com.questrail.fidl.decl.UnionType;
import com.questrail.fidl.decl.UnionValue;
import com.questrail.fidl.ir.Identifiers;
import com.questrail.fidl.observability.BindingErrorEvent;
import com.questrail.fidl.observability.BindingProtocolEvent;
import com.questrail.fidl.observability.BindingStateTransitionEvent;
import com.questrail.fidl.observability.BindingTransportEvent;
import com.questrail.fidl.protocol.MethodInfo;
import com.questrail.fidl.protocol.ProtocolMethod;
import com.questrail.fidl.protocol.ProtocolRole;
import com.questrail.fidl.runtime.BindingContext;
import com.questrail.fidl.transport.Channel;
import com.questrail.fidl.transport.ChannelReadResult;
import com.questrail.fidl.transport.TransportException;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * ServerBase
 * =============================================================================
 * Base class of protocol servers: drives one channel's request/response
 * exchange.
 *
 * <h2>Implementing methods</h2>
 * Methods are implemented by registering a {@link MethodHandler} with
 * {@link #bind(String, MethodHandler)}, usually from the subclass constructor:
 * <pre>
 *   bind("say", request -&gt; reply((RecordValue) request));
 * </pre>
 * A method with no bound handler falls back to a public method of the
 * subclass named after it (lowerCamelCase, e.g. {@code say} for {@code Say})
 * that takes the typed request, or nothing for a method without payload.
 * Unimplemented methods fail with {@link UnsupportedOperationException} when
 * dispatched.
 *
 * <h2>Dispatch cycle</h2>
 * <pre>
 *   IDLE → READING      read the channel; on would-block wait for readiness
 *                       and read again; on peer-closed terminate cleanly
 *        → DISPATCHING  decode, invoke the handler, await it if it returns
 *                       a CompletionStage, check the result against the
 *                       method's contract, write the response
 *        → IDLE
 * </pre>
 * Exactly one request is in flight at a time: the next read is issued only
 * after the previous response has been written.
 *
 * <h2>Termination</h2>
 * <ul>
 *   <li>peer closed, or a handler throws {@link StopServer}: the channel is
 *       closed and the step reports {@code false}</li>
 *   <li>any other failure: the channel is closed, the error is reported to
 *       the observability sink and the step completes exceptionally</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * {@link #handleNextRequest()} must not be called again before the previous
 * step has completed; {@link #serve()} guarantees this.
 */
public abstract class ServerBase
{
    private static final AtomicLong NEXT_ID = new AtomicLong();

    private final ProtocolRole role;
    private final Channel channel;
    private final BindingContext context;
    private final HandlerTable handlers;
    private final long id;
    private final AtomicReference<DispatchState> state = new AtomicReference<>(DispatchState.IDLE);

    protected ServerBase(ProtocolRole role, Channel channel, BindingContext context)
    {
        this.role = Objects.requireNonNull(role, "role");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.context = Objects.requireNonNull(context, "context");
        if (role.kind() != ProtocolRole.Kind.SERVER) {
            throw new IllegalArgumentException(role + " is not a server role");
        }
        this.id = NEXT_ID.getAndIncrement();
        this.handlers = new HandlerTable(this, ServerBase.class);
    }

    /**
     * Registers the implementation of a method. A bound handler takes
     * precedence over a same-named public method of the subclass.
     *
     * @throws IllegalArgumentException if the protocol has no such request method
     */
    public final ServerBase bind(String method, MethodHandler handler)
    {
        if (!role.handlers().containsKey(method)) {
            throw new IllegalArgumentException(role.name() + " has no method '" + method + "'");
        }
        handlers.bind(method, handler);
        return this;
    }

    public final ProtocolRole role()
    {
        return role;
    }

    public final long id()
    {
        return id;
    }

    public final DispatchState state()
    {
        return state.get();
    }

    /**
     * Registers the channel for readiness notification and handles requests
     * until the loop ends.
     *
     * @return completes normally on a clean end, exceptionally on a fatal error
     */
    public final CompletableFuture<Void> serve()
    {
        context.waker().register(channel);
        context.sink().onProtocolEvent(BindingProtocolEvent.of(
                Instant.now(), toString(), BindingProtocolEvent.Kind.SERVER_STARTED));
        return DispatchLoop.run(this::handleNextRequest);
    }

    /**
     * Handles one request.
     *
     * @return {@code true} if a request was handled, {@code false} once the
     *         loop has ended; completes exceptionally on a fatal error, after
     *         the channel has been closed
     */
    public final CompletableFuture<Boolean> handleNextRequest()
    {
        if (state.get() == DispatchState.TERMINATED) {
            return CompletableFuture.completedFuture(false);
        }
        CompletableFuture<Boolean> step;
        try {
            step = readMessage().thenCompose(this::dispatch);
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
            if (cause instanceof StopServer) {
                terminate();
                outcome.complete(false);
                return;
            }
            if (cause instanceof TransportException) {
                context.sink().onTransportEvent(new BindingTransportEvent(Instant.now(), toString(),
                        BindingTransportEvent.Kind.TRANSPORT_ERROR, cause.getMessage()));
            }
            terminate();
            context.sink().onError(new BindingErrorEvent(Instant.now(), toString(),
                    "request handling error: " + cause.getMessage(), cause));
            outcome.completeExceptionally(cause);
        });
        return outcome;
    }

    /**
     * Sends an event to the client.
     *
     * @param arguments event payload members, by name
     * @throws IllegalArgumentException if the protocol has no such event or
     *         the arguments do not fit its payload
     */
    public final void sendEvent(String name, Map<String, ?> arguments)
    {
        ProtocolMethod event = role.callable(name)
                .orElseThrow(() -> new IllegalArgumentException(role.name() + " has no event '" + name + "'"));
        Object payload = event.signature().bind(arguments, context.values());
        channel.write(context.codec().encodeMessage(event.ordinal(), payload, role.library(), 0,
                payload == null ? null : event.signature().payloadIdentifier()));
        context.sink().onProtocolEvent(new BindingProtocolEvent(Instant.now(), toString(),
                BindingProtocolEvent.Kind.EVENT_SENT, name, event.ordinal(), 0));
    }

    public final void sendEvent(String name)
    {
        sendEvent(name, Map.of());
    }

    private CompletableFuture<ChannelReadResult.Message> readMessage()
    {
        transition(DispatchState.READING);
        ChannelReadResult result = channel.read();
        if (result instanceof ChannelReadResult.Message) {
            return CompletableFuture.completedFuture((ChannelReadResult.Message) result);
        }
        if (result instanceof ChannelReadResult.PeerClosed) {
            context.sink().onTransportEvent(new BindingTransportEvent(Instant.now(), toString(),
                    BindingTransportEvent.Kind.PEER_CLOSED, "shutting down"));
            return CompletableFuture.completedFuture(null);
        }
        context.sink().onTransportEvent(new BindingTransportEvent(Instant.now(), toString(),
                BindingTransportEvent.Kind.WOULD_BLOCK, null));
        return context.waker().awaitReady(channel).thenCompose(ready -> readMessage());
    }

    private CompletableFuture<Boolean> dispatch(ChannelReadResult.Message message)
    {
        if (message == null) {
            terminate();
            return CompletableFuture.completedFuture(false);
        }
        MessageHeader header = MessageHeader.parse(message.bytes());
        MethodInfo info = role.methodMap().get(header.ordinal());
        if (info == null) {
            throw new ServerException(this + " received unknown method ordinal "
                    + Long.toUnsignedString(header.ordinal()));
        }
        Object decoded = context.codec().decodeMessage(message.bytes(), message.handles());
        Object request = info.hasRequestPayload()
                ? context.values().construct(info.requestIdentifier(), decoded)
                : null;

        transition(DispatchState.DISPATCHING);
        context.sink().onProtocolEvent(new BindingProtocolEvent(Instant.now(), toString(),
                BindingProtocolEvent.Kind.REQUEST_RECEIVED, info.name(), header.ordinal(), header.txid()));

        Object result = invoke(info, request);
        if (result instanceof CompletionStage) {
            return ((CompletionStage<?>) result).toCompletableFuture()
                    .thenApply(awaited -> respond(header, info, awaited));
        }
        return CompletableFuture.completedFuture(respond(header, info, result));
    }

    private Object invoke(MethodInfo info, Object request)
    {
        MethodHandler handler = handlers.resolve(info.name());
        try {
            return handler.handle(request);
        }
        catch (RuntimeException e) {
            throw e;
        }
        catch (Exception e) {
            throw new CompletionException(e);
        }
    }

    private boolean respond(MessageHeader header, MethodInfo info, Object result)
    {
        if (result != null && !info.requiresResponse()) {
            throw new ServerException(this + " method " + info.name()
                    + " received a response but is one-way method");
        }
        if (result == null && info.requiresResponse() && !info.emptyResponse()) {
            throw new ServerException(this + " method " + info.name()
                    + " returned null when a response was expected");
        }

        Object response = info.hasResult() && result != null ? wrapResult(result) : result;
        if (response != null) {
            DeclaredValue typed = typedResponse(info, response);
            write(header, info, typed, typed.type().rawQualifiedName());
        }
        else if (info.emptyResponse()) {
            write(header, info, null, null);
        }
        transition(DispatchState.IDLE);
        return true;
    }

    private static Object wrapResult(Object result)
    {
        if (result instanceof UnionValue) {
            return result;
        }
        if (result instanceof DomainError) {
            return Map.of(UnionType.ERR, ((DomainError) result).error());
        }
        if (result instanceof FrameworkError) {
            return Map.of(UnionType.FRAMEWORK_ERR, ((FrameworkError) result).value());
        }
        return Map.of(UnionType.RESPONSE, result);
    }

    private DeclaredValue typedResponse(MethodInfo info, Object response)
    {
        Object typed;
        try {
            typed = context.values().construct(info.responseIdentifier(), response);
        }
        catch (IllegalArgumentException e) {
            throw new ServerException(this + " method " + info.name()
                    + " returned an invalid response: " + e.getMessage(), e);
        }
        String expected = Identifiers.normalize(info.responseIdentifier());
        if (!(typed instanceof DeclaredValue) || !((DeclaredValue) typed).type().qualifiedName().equals(expected)) {
            throw new ServerException(this + " method " + info.name() + " returned " + typed
                    + " but the response type is " + expected);
        }
        return (DeclaredValue) typed;
    }

    private void write(MessageHeader header, MethodInfo info, Object payload, String typeName)
    {
        EncodedMessage encoded = context.codec().encodeMessage(
                header.ordinal(), payload, role.library(), header.txid(), typeName);
        channel.write(encoded);
        context.sink().onProtocolEvent(new BindingProtocolEvent(Instant.now(), toString(),
                BindingProtocolEvent.Kind.RESPONSE_SENT, info.name(), header.ordinal(), header.txid()));
    }

    private void transition(DispatchState next)
    {
        DispatchState previous = state.get();
        if (previous == next || previous == DispatchState.TERMINATED) {
            return;
        }
        if (state.compareAndSet(previous, next)) {
            context.sink().onStateTransition(
                    new BindingStateTransitionEvent(Instant.now(), toString(), previous, next));
        }
    }

    private void terminate()
    {
        DispatchState previous = state.getAndSet(DispatchState.TERMINATED);
        if (previous == DispatchState.TERMINATED) {
            return;
        }
        context.sink().onStateTransition(
                new BindingStateTransitionEvent(Instant.now(), toString(), previous, DispatchState.TERMINATED));
        channel.close();
        context.waker().unregister(channel);
        context.sink().onTransportEvent(new BindingTransportEvent(Instant.now(), toString(),
                BindingTransportEvent.Kind.CHANNEL_CLOSED, null));
        context.sink().onProtocolEvent(BindingProtocolEvent.of(
                Instant.now(), toString(), BindingProtocolEvent.Kind.SERVER_STOPPED));
    }

    @Override
    public String toString()
    {
        return "server:" + getClass().getSimpleName() + ":" + id;
    }
}
