package com.questrail.fidl.runtime;

import com.questrail.fidl.codec.FidlCodec;
import com.questrail.fidl.config.IrPathConfig;
import com.questrail.fidl.decl.CompiledDeclaration;
import com.questrail.fidl.ir.DefinitionException;
import com.questrail.fidl.ir.IrRegistry;
import com.questrail.fidl.library.LibraryNamespace;
import com.questrail.fidl.library.LibraryRegistry;
import com.questrail.fidl.observability.BindingObservabilitySink;
import com.questrail.fidl.observability.NullObservabilitySink;
import com.questrail.fidl.protocol.ProtocolType;
import com.questrail.fidl.transport.HandleWaker;

import java.util.Objects;

/**
 * BindingRuntime
 * =============================================================================
 * Composition root for the bindings.
 *
 * <p>Wires the IR cache, the library registry and the shared
 * {@link BindingContext} from a codec and a handle waker supplied by the
 * host. Everything the runtime builds is safe to share between servers and
 * clients on different channels.</p>
 *
 * <pre>{@code
 * BindingRuntime runtime = BindingRuntime.builder()
 *         .withCodec(codec)
 *         .withHandleWaker(waker)
 *         .withObservabilitySink(new Slf4jBindingObservabilitySink())
 *         .build();
 * ProtocolType echo = runtime.protocol("fuchsia.examples/Echo");
 * }</pre>
 */
public final class BindingRuntime
{
    private final IrRegistry irRegistry;
    private final LibraryRegistry libraries;
    private final BindingContext context;

    private BindingRuntime(IrRegistry irRegistry, LibraryRegistry libraries, BindingContext context)
    {
        this.irRegistry = irRegistry;
        this.libraries = libraries;
        this.context = context;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Materializes (once) and returns a library's namespace.
     */
    public LibraryNamespace library(String name)
    {
        return libraries.namespace(name);
    }

    /**
     * @param identifier fully-qualified protocol identifier, e.g. {@code fuchsia.io/Directory}
     * @throws DefinitionException if the identifier does not name a protocol
     */
    public ProtocolType protocol(String identifier)
    {
        CompiledDeclaration declaration = libraries.lookup(identifier);
        if (!(declaration instanceof ProtocolType)) {
            throw new DefinitionException(identifier + " is not a protocol: " + declaration);
        }
        return (ProtocolType) declaration;
    }

    public BindingContext context()
    {
        return context;
    }

    public IrRegistry irRegistry()
    {
        return irRegistry;
    }

    public LibraryRegistry libraries()
    {
        return libraries;
    }

    public static final class Builder {
        private IrPathConfig irPaths;
        private FidlCodec codec;
        private HandleWaker waker;
        private BindingObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        private Builder() {
        }

        public Builder withIrPaths(IrPathConfig irPaths) {
            this.irPaths = irPaths;
            return this;
        }

        public Builder withCodec(FidlCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder withHandleWaker(HandleWaker waker) {
            this.waker = waker;
            return this;
        }

        public Builder withObservabilitySink(BindingObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public BindingRuntime build() {
            Objects.requireNonNull(codec, "codec");
            Objects.requireNonNull(waker, "waker");

            IrPathConfig paths = irPaths != null ? irPaths : IrPathConfig.fromEnvironment();
            BindingObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

            IrRegistry irRegistry = new IrRegistry(paths, sink);
            LibraryRegistry libraries = new LibraryRegistry(irRegistry, sink);
            return new BindingRuntime(irRegistry, libraries, BindingContext.of(codec, waker, libraries, sink));
        }
    }
}
