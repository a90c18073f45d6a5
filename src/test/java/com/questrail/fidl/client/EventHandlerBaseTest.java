package com.questrail.fidl.client;

import com.questrail.fidl.codec.JsonTestCodec;
import com.questrail.fidl.decl.RecordValue;
import com.questrail.fidl.ir.IrFixtures;
import com.questrail.fidl.library.LibraryRegistry;
import com.questrail.fidl.observability.BindingProtocolEvent;
import com.questrail.fidl.observability.RecordingObservabilitySink;
import com.questrail.fidl.protocol.ProtocolRole;
import com.questrail.fidl.protocol.ProtocolType;
import com.questrail.fidl.runtime.BindingContext;
import com.questrail.fidl.server.ServerBase;
import com.questrail.fidl.transport.FakeChannel;
import com.questrail.fidl.transport.ManualHandleWaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class EventHandlerBaseTest
{
    private static final long ON_HELLO = 8806320011417141248L;
    private static final long ON_OVERFLOW = 2871103948123345920L;
    private static final long ON_RESET = 1733304858771202048L;

    private RecordingObservabilitySink sink;
    private ManualHandleWaker waker;
    private JsonTestCodec codec;
    private LibraryRegistry libraries;
    private BindingContext context;
    private ProtocolType echo;
    private FakeChannel channel;
    private ClientBase client;

    @BeforeEach
    void setUp() {
        sink = new RecordingObservabilitySink();
        waker = new ManualHandleWaker();
        codec = new JsonTestCodec();
        libraries = new LibraryRegistry(IrFixtures.registry());
        context = BindingContext.of(codec, waker, libraries, sink);
        echo = libraries.namespace("x").protocol("Echo");
        channel = new FakeChannel(waker);
        client = new ClientBase(echo.client(), channel, context);
    }

    @Test
    void serveDispatchesEventsUntilThePeerCloses() {
        HelloHandler handler = new HelloHandler(echo.eventHandler(), client, context);
        channel.inject(codec.request(0, ON_HELLO, Map.of("greeting", "one")));
        channel.inject(codec.request(0, ON_HELLO, Map.of("greeting", "two")));
        channel.closePeer();

        CompletableFuture<Void> done = handler.serve();

        assertTrue(done.isDone());
        assertNull(done.join());
        assertEquals(List.of("one", "two"), handler.greetings);
        assertTrue(handler.isTerminated());
        assertEquals(2, sink.getProtocolEventKinds().stream()
                .filter(k -> k == BindingProtocolEvent.Kind.EVENT_RECEIVED).count());
    }

    @Test
    void waitsForTheNextEvent() {
        HelloHandler handler = new HelloHandler(echo.eventHandler(), client, context);

        CompletableFuture<Boolean> step = handler.handleNextEvent();
        assertFalse(step.isDone());

        channel.inject(codec.request(0, ON_HELLO, Map.of("greeting", "late")));

        assertTrue(step.join());
        assertEquals(List.of("late"), handler.greetings);
    }

    @Test
    void eventsSentByAServerReachTheHandler() {
        FakeChannel[] ends = FakeChannel.pair(waker);
        ServerBase server = new ServerBase(echo.server(), ends[1], context) {};
        ClientBase paired = new ClientBase(echo.client(), ends[0], context);
        HelloHandler handler = new HelloHandler(echo.eventHandler(), paired, context);

        server.sendEvent("onHello", Map.of("greeting", "from server"));

        assertTrue(handler.handleNextEvent().join());
        assertEquals(List.of("from server"), handler.greetings);
    }

    @Test
    void eventsWithAndWithoutPayload() {
        ProtocolType calculator = libraries.namespace("test.calc").protocol("Calculator");
        ClientBase calc = new ClientBase(calculator.client(), channel, context);
        List<Object> overflows = new ArrayList<>();
        AtomicInteger resets = new AtomicInteger();
        EventHandlerBase handler = new EventHandlerBase(calculator.eventHandler(), calc, context) {};
        handler.bind("onOverflow", event -> overflows.add(((RecordValue) event).get("value")));
        handler.bind("onReset", event -> {
            assertNull(event);
            return resets.incrementAndGet();
        });
        channel.inject(codec.request(0, ON_OVERFLOW, Map.of("value", 99)));
        channel.inject(codec.request(0, ON_RESET, null));

        assertTrue(handler.handleNextEvent().join());
        assertTrue(handler.handleNextEvent().join());

        assertEquals(List.of(99L), overflows);
        assertEquals(1, resets.get());
    }

    @Test
    void stopEventHandlerEndsTheLoopQuietly() {
        EventHandlerBase handler = new EventHandlerBase(echo.eventHandler(), client, context) {};
        handler.bind("onHello", event -> {
            throw new StopEventHandler();
        });
        channel.inject(codec.request(0, ON_HELLO, Map.of("greeting", "bye")));

        assertFalse(handler.handleNextEvent().join());

        assertTrue(handler.isTerminated());
        assertTrue(sink.getErrors().isEmpty());
        assertFalse(handler.handleNextEvent().join());
    }

    @Test
    void unknownEventOrdinalIsFatal() {
        HelloHandler handler = new HelloHandler(echo.eventHandler(), client, context);
        channel.inject(codec.request(0, 12345L, null));

        CompletionException e = assertThrows(CompletionException.class, () -> handler.handleNextEvent().join());

        assertTrue(e.getCause() instanceof ClientException);
        assertTrue(e.getCause().getMessage().contains("unknown event ordinal 12345"));
        assertEquals(1, sink.getErrors().size());
        assertTrue(handler.isTerminated());
    }

    @Test
    void unimplementedEventFails() {
        EventHandlerBase handler = new EventHandlerBase(echo.eventHandler(), client, context) {};
        channel.inject(codec.request(0, ON_HELLO, Map.of("greeting", "x")));

        CompletionException e = assertThrows(CompletionException.class, () -> handler.handleNextEvent().join());

        assertTrue(e.getCause() instanceof UnsupportedOperationException);
    }

    @Test
    void bindRejectsRequests() {
        HelloHandler handler = new HelloHandler(echo.eventHandler(), client, context);

        assertThrows(IllegalArgumentException.class, () -> handler.bind("say", event -> null));
    }

    @Test
    void requiresAnEventHandlerRole() {
        assertThrows(IllegalArgumentException.class, () -> new HelloHandler(echo.client(), client, context));
    }

    // ---------------------------------------------------------------------
    // Test handlers
    // ---------------------------------------------------------------------

    static final class HelloHandler extends EventHandlerBase
    {
        final List<String> greetings = new ArrayList<>();

        HelloHandler(ProtocolRole role, ClientBase client, BindingContext context) {
            super(role, client, context);
        }

        public void onHello(RecordValue event) {
            greetings.add((String) event.get("greeting"));
        }
    }
}
