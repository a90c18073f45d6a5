package com.questrail.fidl.client;

import com.questrail.fidl.codec.MessageHeader;
import com.questrail.fidl.observability.BindingTransportEvent;
import com.questrail.fidl.protocol.ProtocolMethod;
import com.questrail.fidl.protocol.ProtocolRole;
import com.questrail.fidl.runtime.BindingContext;
import com.questrail.fidl.transport.Channel;
import com.questrail.fidl.transport.ChannelReadResult;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ClientBase
 * =============================================================================
 * Sends requests over one channel and matches replies to them.
 *
 * <h2>Transaction ids</h2>
 * Every two-way call is given a fresh non-zero 32-bit transaction id.
 * One-way requests use id {@code 0}. A reader that receives a reply meant
 * for another outstanding call stages it for that call; a message with id
 * {@code 0} is an event and is queued for {@link #nextEvent()}.
 *
 * <h2>Calls</h2>
 * {@link #call(String, Map)} takes the method's parameters by name (see
 * {@link com.questrail.fidl.protocol.MethodSignature}) and completes with the
 * typed reply, or {@code null} for one-way and empty-reply methods.
 */
public class ClientBase implements AutoCloseable
{
    private static final long TXID_MASK = 0xFFFF_FFFFL;

    private final ProtocolRole role;
    private final Channel channel;
    private final BindingContext context;
    private final AtomicLong nextTxid = new AtomicLong(1);
    private final Map<Long, ChannelReadResult.Message> replies = new ConcurrentHashMap<>();
    private final Queue<ChannelReadResult.Message> events = new ConcurrentLinkedQueue<>();
    private final Object readLock = new Object();

    public ClientBase(ProtocolRole role, Channel channel, BindingContext context)
    {
        this.role = Objects.requireNonNull(role, "role");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.context = Objects.requireNonNull(context, "context");
        if (role.kind() != ProtocolRole.Kind.CLIENT) {
            throw new IllegalArgumentException(role + " is not a client role");
        }
        context.waker().register(channel);
    }

    public final ProtocolRole role()
    {
        return role;
    }

    /**
     * Invokes a protocol method.
     *
     * @param method    method name (lowerCamelCase)
     * @param arguments request payload members, by name
     * @throws IllegalArgumentException if the protocol has no such method or
     *         the arguments do not fit its parameters
     */
    public final CompletableFuture<Object> call(String method, Map<String, ?> arguments)
    {
        ProtocolMethod callable = role.callable(method)
                .orElseThrow(() -> new IllegalArgumentException(role.name() + " has no method '" + method + "'"));
        Object payload = callable.signature().bind(arguments, context.values());
        String typeName = payload == null ? null : callable.signature().payloadIdentifier();

        if (callable.kind() == ProtocolMethod.Kind.ONE_WAY) {
            channel.write(context.codec().encodeMessage(callable.ordinal(), payload, role.library(), 0, typeName));
            return CompletableFuture.completedFuture(null);
        }
        long txid = allocateTxid();
        channel.write(context.codec().encodeMessage(callable.ordinal(), payload, role.library(), txid, typeName));
        return readReply(txid).thenApply(reply -> decodeReply(callable, reply));
    }

    public final CompletableFuture<Object> call(String method)
    {
        return call(method, Map.of());
    }

    /**
     * Waits for the next event sent by the server.
     *
     * @return the raw event message, or {@code null} once the peer has closed
     */
    public final CompletableFuture<ChannelReadResult.Message> nextEvent()
    {
        ChannelReadResult.Message queued = events.poll();
        if (queued != null) {
            return CompletableFuture.completedFuture(queued);
        }
        ChannelReadResult result;
        synchronized (readLock) {
            while (true) {
                queued = events.poll();
                if (queued != null) {
                    return CompletableFuture.completedFuture(queued);
                }
                result = channel.read();
                if (!(result instanceof ChannelReadResult.Message)) {
                    break;
                }
                ChannelReadResult.Message message = (ChannelReadResult.Message) result;
                long txid = MessageHeader.parseTxid(message.bytes());
                if (txid == 0) {
                    return CompletableFuture.completedFuture(message);
                }
                replies.put(txid, message);
            }
        }
        if (result instanceof ChannelReadResult.PeerClosed) {
            peerClosed();
            return CompletableFuture.completedFuture(null);
        }
        return context.waker().awaitReady(channel).thenCompose(ready -> nextEvent());
    }

    @Override
    public void close()
    {
        channel.close();
        context.waker().unregister(channel);
    }

    private long allocateTxid()
    {
        while (true) {
            long txid = nextTxid.getAndIncrement() & TXID_MASK;
            if (txid != 0) {
                return txid;
            }
        }
    }

    private CompletableFuture<ChannelReadResult.Message> readReply(long txid)
    {
        ChannelReadResult result;
        synchronized (readLock) {
            while (true) {
                ChannelReadResult.Message staged = replies.remove(txid);
                if (staged != null) {
                    return CompletableFuture.completedFuture(staged);
                }
                result = channel.read();
                if (!(result instanceof ChannelReadResult.Message)) {
                    break;
                }
                ChannelReadResult.Message message = (ChannelReadResult.Message) result;
                long received = MessageHeader.parseTxid(message.bytes());
                if (received == txid) {
                    return CompletableFuture.completedFuture(message);
                }
                if (received == 0) {
                    events.add(message);
                }
                else {
                    replies.put(received, message);
                }
            }
        }
        if (result instanceof ChannelReadResult.PeerClosed) {
            peerClosed();
            return CompletableFuture.failedFuture(new ClientException(this + " peer closed while awaiting reply to txid "
                    + txid));
        }
        return context.waker().awaitReady(channel).thenCompose(ready -> readReply(txid));
    }

    private Object decodeReply(ProtocolMethod method, ChannelReadResult.Message reply)
    {
        long ordinal = MessageHeader.parseOrdinal(reply.bytes());
        if (ordinal != method.ordinal()) {
            throw new ClientException(this + " received ordinal " + Long.toUnsignedString(ordinal)
                    + " in reply to " + method.name());
        }
        Object decoded = context.codec().decodeMessage(reply.bytes(), reply.handles());
        if (method.responseIdentifier() == null) {
            return null;
        }
        return context.values().construct(method.responseIdentifier(), decoded);
    }

    private void peerClosed()
    {
        context.sink().onTransportEvent(new BindingTransportEvent(Instant.now(), toString(),
                BindingTransportEvent.Kind.PEER_CLOSED, null));
    }

    @Override
    public String toString()
    {
        return "client:" + role.name();
    }
}
