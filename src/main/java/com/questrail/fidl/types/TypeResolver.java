package com.questrail.fidl.types;

import com.questrail.fidl.ir.DeclarationKind;
import com.questrail.fidl.ir.DefinitionException;
import com.questrail.fidl.ir.Identifiers;
import com.questrail.fidl.ir.IrLibrary;
import com.questrail.fidl.ir.IrNode;
import com.questrail.fidl.ir.IrRegistry;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * TypeResolver
 * -----------------------------------------------------------------------------
 * Converts IR type references into {@link TypeDescriptor}s.
 *
 * <h2>Identifier resolution</h2>
 * An identifier is first looked up in the declaration table of the library
 * that contains the reference. If it is not declared there, the library named
 * by the identifier's prefix ({@code foo.bar} in {@code foo.bar/Baz}) is
 * loaded through the {@link IrRegistry} and consulted, and so on. A library is
 * never consulted twice, so the search always terminates; an identifier that
 * no reachable library declares is a {@link DefinitionException}.
 *
 * <h2>Nullability</h2>
 * Applied last, uniformly, for every kind.
 */
public final class TypeResolver
{
    private final IrRegistry irRegistry;

    public TypeResolver(IrRegistry irRegistry)
    {
        this.irRegistry = Objects.requireNonNull(irRegistry, "irRegistry");
    }

    public IrRegistry irRegistry()
    {
        return irRegistry;
    }

    /**
     * Resolves a type reference found inside {@code containing}.
     *
     * @throws DefinitionException for unknown type kinds or unresolvable identifiers
     */
    public TypeDescriptor resolve(IrNode typeRef, IrLibrary containing)
    {
        String kind = typeRef.string("kind_v2");
        TypeDescriptor resolved;
        switch (kind) {
            case "primitive":
                resolved = new TypeDescriptor.Primitive(PrimitiveSubtype.fromIrName(typeRef.string("subtype")), false);
                break;
            case "string":
                resolved = new TypeDescriptor.StringType(false);
                break;
            case "vector":
                resolved = new TypeDescriptor.Vector(resolve(typeRef.get("element_type"), containing), false);
                break;
            case "array":
                resolved = new TypeDescriptor.Array(
                        resolve(typeRef.get("element_type"), containing),
                        (int) typeRef.longValue("element_count"),
                        false);
                break;
            case "handle":
                resolved = new TypeDescriptor.Handle(typeRef.optionalString("subtype").orElse("handle"), false);
                break;
            case "identifier": {
                String raw = typeRef.rawIdentifier();
                resolved = new TypeDescriptor.Identifier(raw, resolveDeclaration(raw, containing).kind(), false);
                break;
            }
            case "endpoint":
                resolved = new TypeDescriptor.Endpoint(endpointRole(typeRef, containing), typeRef.string("protocol"), false);
                break;
            case "internal":
                resolved = new TypeDescriptor.Internal(typeRef.string("subtype"), false);
                break;
            default:
                throw new DefinitionException("As yet unsupported type in library "
                        + containing.libraryName() + ": " + kind);
        }
        return typeRef.flag("nullable") ? resolved.asNullable() : resolved;
    }

    /**
     * Follows an identifier to the library that declares it.
     *
     * @param rawIdentifier identifier as spelled in the IR
     * @throws DefinitionException if no reachable library declares the identifier,
     *         or if it is declared with a kind this compiler cannot materialize
     */
    public ResolvedDeclaration resolveDeclaration(String rawIdentifier, IrLibrary containing)
    {
        Set<String> consulted = new LinkedHashSet<>();
        IrLibrary library = containing;
        consulted.add(library.libraryName());

        Optional<String> kindName = library.declarationKind(rawIdentifier);
        while (kindName.isEmpty()) {
            String target = Identifiers.libraryOf(rawIdentifier);
            if (!consulted.add(target)) {
                throw new DefinitionException("Unresolved kind for " + rawIdentifier
                        + " referenced from library " + containing.libraryName()
                        + " (searched " + consulted + ")");
            }
            library = irRegistry.load(target);
            kindName = library.declarationKind(rawIdentifier);
        }

        String spelled = kindName.get();
        DeclarationKind kind = DeclarationKind.fromIrName(spelled)
                .orElseThrow(() -> new DefinitionException("Unsupported declaration kind '" + spelled
                        + "' for " + rawIdentifier + " in library " + containing.libraryName()));
        IrLibrary owner = library;
        IrNode declaration = owner.declaration(kind, rawIdentifier)
                .orElseThrow(() -> new DefinitionException("Library " + owner.libraryName()
                        + " lists " + rawIdentifier + " as " + spelled + " but does not declare it"));
        return new ResolvedDeclaration(kind, declaration, owner);
    }

    private static TypeDescriptor.Endpoint.Role endpointRole(IrNode typeRef, IrLibrary containing)
    {
        String role = typeRef.string("role");
        switch (role) {
            case "client":
                return TypeDescriptor.Endpoint.Role.CLIENT;
            case "server":
                return TypeDescriptor.Endpoint.Role.SERVER;
            default:
                throw new DefinitionException("As yet unsupported endpoint role in library "
                        + containing.libraryName() + ": " + role);
        }
    }
}
