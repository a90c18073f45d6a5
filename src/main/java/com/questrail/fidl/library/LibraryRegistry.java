package com.questrail.fidl.library;

import com.questrail.fidl.decl.CompiledDeclaration;
import com.questrail.fidl.decl.DeclarationCompiler;
import com.questrail.fidl.decl.TypeLookup;
import com.questrail.fidl.ir.DeclarationKind;
import com.questrail.fidl.ir.DefinitionException;
import com.questrail.fidl.ir.Identifiers;
import com.questrail.fidl.ir.IrLibrary;
import com.questrail.fidl.ir.IrNode;
import com.questrail.fidl.ir.IrRegistry;
import com.questrail.fidl.observability.BindingObservabilitySink;
import com.questrail.fidl.observability.BindingProtocolEvent;
import com.questrail.fidl.observability.NullObservabilitySink;
import com.questrail.fidl.protocol.ProtocolCompiler;
import com.questrail.fidl.types.TypeResolver;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * LibraryRegistry
 * =============================================================================
 * Materializes libraries into {@link LibraryNamespace}s and resolves
 * identifiers to compiled declarations.
 *
 * <h2>Export order</h2>
 * Declarations are compiled kind by kind in {@link DeclarationKind} order
 * (bits, resources, enums, structs, tables, unions, consts, aliases,
 * protocols), and within a kind in the IR's {@code declaration_order}.
 *
 * <h2>Re-entrancy</h2>
 * A namespace is registered before it is populated. A lookup that reaches a
 * library whose materialization is in progress on the same thread returns
 * what has been exported so far, compiling the requested declaration ahead
 * of its turn if it has not been reached yet. Names already exported are
 * skipped when their turn comes.
 *
 * <h2>Thread Safety</h2>
 * Materialization is serialized on the registry. Sealed namespaces are read
 * without locking.
 */
public final class LibraryRegistry implements TypeLookup
{
    private final IrRegistry irRegistry;
    private final DeclarationCompiler declarations;
    private final ProtocolCompiler protocols;
    private final BindingObservabilitySink observabilitySink;

    private final Map<String, LibraryNamespace> namespaces = new ConcurrentHashMap<>();

    public LibraryRegistry(IrRegistry irRegistry, BindingObservabilitySink observabilitySink)
    {
        this.irRegistry = Objects.requireNonNull(irRegistry, "irRegistry");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        TypeResolver resolver = new TypeResolver(irRegistry);
        this.declarations = new DeclarationCompiler(resolver, this);
        this.protocols = new ProtocolCompiler(resolver);
    }

    public LibraryRegistry(IrRegistry irRegistry)
    {
        this(irRegistry, null);
    }

    public IrRegistry irRegistry()
    {
        return irRegistry;
    }

    /**
     * Returns the namespace of a library, materializing it on first use.
     * Repeated calls return the same instance.
     *
     * @throws DefinitionException if the library cannot be loaded or compiled
     */
    public LibraryNamespace namespace(String library)
    {
        LibraryNamespace existing = namespaces.get(library);
        if (existing != null && existing.isSealed()) {
            return existing;
        }
        synchronized (this) {
            existing = namespaces.get(library);
            if (existing != null) {
                return existing;
            }
            IrLibrary ir = irRegistry.load(library);
            LibraryNamespace namespace = new LibraryNamespace(library,
                    ir.documentation().orElse("FIDL library " + library));
            namespaces.put(library, namespace);
            try {
                materialize(namespace, ir);
            }
            catch (RuntimeException e) {
                namespaces.remove(library);
                throw e;
            }
            namespace.seal();
            observabilitySink.onProtocolEvent(BindingProtocolEvent.of(
                    Instant.now(), library, BindingProtocolEvent.Kind.LIBRARY_MATERIALIZED));
            return namespace;
        }
    }

    /**
     * @return whether the library has been fully materialized
     */
    public boolean isMaterialized(String library)
    {
        LibraryNamespace namespace = namespaces.get(library);
        return namespace != null && namespace.isSealed();
    }

    @Override
    public CompiledDeclaration lookup(String identifier)
    {
        LibraryNamespace namespace = namespace(Identifiers.libraryOf(identifier));
        String member = Identifiers.memberOf(identifier);
        Optional<CompiledDeclaration> exported = namespace.find(member);
        if (exported.isPresent()) {
            return exported.get();
        }
        if (namespace.isSealed()) {
            throw new DefinitionException("Library " + namespace.library() + " does not declare " + identifier);
        }
        synchronized (this) {
            return compileAhead(namespace, identifier);
        }
    }

    private void materialize(LibraryNamespace namespace, IrLibrary ir)
    {
        for (DeclarationKind kind : DeclarationKind.values()) {
            for (IrNode declaration : ir.sortedDeclarations(kind)) {
                if (!namespace.contains(Identifiers.memberOf(declaration.rawName()))) {
                    namespace.export(compile(kind, declaration, ir));
                }
            }
        }
    }

    private CompiledDeclaration compileAhead(LibraryNamespace namespace, String identifier)
    {
        IrLibrary ir = irRegistry.load(namespace.library());
        String normalized = Identifiers.normalize(identifier);
        for (DeclarationKind kind : DeclarationKind.values()) {
            for (IrNode declaration : ir.sortedDeclarations(kind)) {
                if (Identifiers.normalize(declaration.rawName()).equals(normalized)) {
                    CompiledDeclaration compiled = compile(kind, declaration, ir);
                    namespace.export(compiled);
                    return compiled;
                }
            }
        }
        throw new DefinitionException("Library " + namespace.library() + " does not declare " + identifier);
    }

    private CompiledDeclaration compile(DeclarationKind kind, IrNode declaration, IrLibrary ir)
    {
        if (kind == DeclarationKind.PROTOCOL) {
            return protocols.compile(declaration, ir);
        }
        return declarations.compile(kind, declaration, ir);
    }
}
