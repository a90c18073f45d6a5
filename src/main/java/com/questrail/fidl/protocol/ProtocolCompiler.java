package com.questrail.fidl.protocol;

import com.questrail.fidl.ir.DeclarationKind;
import com.questrail.fidl.ir.DefinitionException;
import com.questrail.fidl.ir.Identifiers;
import com.questrail.fidl.ir.IrLibrary;
import com.questrail.fidl.ir.IrMethod;
import com.questrail.fidl.ir.IrNode;
import com.questrail.fidl.types.ResolvedDeclaration;
import com.questrail.fidl.types.TypeResolver;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ProtocolCompiler
 * =============================================================================
 * Compiles a protocol declaration into its client, server and event-handler
 * roles.
 *
 * <h2>Method routing</h2>
 * <ul>
 *   <li>A method without a request is an <em>event</em>: the server sends it,
 *       the event handler receives it. Its payload is the IR's response
 *       payload.</li>
 *   <li>A method with a request is sent by the client and handled by the
 *       server. It is two-way when it declares a response, one-way
 *       otherwise.</li>
 * </ul>
 *
 * <h2>Invariants</h2>
 * Ordinals are non-zero and pairwise distinct within a protocol; a violation
 * is a {@link DefinitionException}.
 */
public final class ProtocolCompiler
{
    private final TypeResolver resolver;

    public ProtocolCompiler(TypeResolver resolver)
    {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public ProtocolType compile(IrNode declaration, IrLibrary owner)
    {
        String protocol = declaration.name();
        String member = Identifiers.memberOf(protocol);

        List<ProtocolMethod> methods = new ArrayList<>();
        List<ProtocolMethod> requests = new ArrayList<>();
        List<ProtocolMethod> events = new ArrayList<>();
        Map<Long, MethodInfo> serverMap = new LinkedHashMap<>();
        Map<Long, MethodInfo> eventMap = new LinkedHashMap<>();
        Map<Long, String> seen = new LinkedHashMap<>();

        for (IrNode node : declaration.list("methods")) {
            IrMethod method = new IrMethod(node);
            long ordinal = method.ordinal();
            if (ordinal == 0) {
                throw new DefinitionException("Method " + method.rawName() + " of protocol " + protocol
                        + " has ordinal 0");
            }
            String previous = seen.putIfAbsent(ordinal, method.rawName());
            if (previous != null) {
                throw new DefinitionException("Duplicate ordinal " + Long.toUnsignedString(ordinal)
                        + " in protocol " + protocol + ": " + previous + " and " + method.rawName());
            }

            String name = Identifiers.methodName(method.rawName());
            if (!method.hasRequest()) {
                ProtocolMethod event = new ProtocolMethod(name, method.rawName(), ordinal,
                        ProtocolMethod.Kind.EVENT, method.strict(), false,
                        signature(name, method.responsePayload(), owner), null, method.documentation());
                methods.add(event);
                events.add(event);
                eventMap.put(ordinal, new MethodInfo(name,
                        method.responsePayloadRawIdentifier().orElse(""), false, false, false, null));
                continue;
            }

            boolean twoWay = method.hasResponse();
            ProtocolMethod request = new ProtocolMethod(name, method.rawName(), ordinal,
                    twoWay ? ProtocolMethod.Kind.TWO_WAY : ProtocolMethod.Kind.ONE_WAY,
                    method.strict(), method.hasResult(),
                    signature(name, method.requestPayload(), owner),
                    twoWay ? method.responsePayloadRawIdentifier().orElse(null) : null,
                    method.documentation());
            methods.add(request);
            requests.add(request);

            boolean responsePayload = method.responsePayload().isPresent();
            serverMap.put(ordinal, new MethodInfo(name,
                    method.requestPayloadIdentifier().orElse(""),
                    method.hasResponse() && responsePayload,
                    method.hasResponse() && !responsePayload,
                    method.hasResult(),
                    method.responsePayloadRawIdentifier().orElse(null)));
        }

        String library = owner.libraryName();
        ProtocolRole client = new ProtocolRole(ProtocolRole.Kind.CLIENT, member + "Client",
                protocol, library, requests, List.of(), Map.of());
        ProtocolRole server = new ProtocolRole(ProtocolRole.Kind.SERVER, member + "Server",
                protocol, library, events, requests, serverMap);
        ProtocolRole eventHandler = new ProtocolRole(ProtocolRole.Kind.EVENT_HANDLER, member + "EventHandler",
                protocol, library, List.of(), events, eventMap);
        return new ProtocolType(declaration.rawName(), declaration.documentation(), methods,
                client, server, eventHandler);
    }

    private MethodSignature signature(String method, Optional<IrNode> payload, IrLibrary owner)
    {
        if (payload.isEmpty()) {
            return MethodSignature.none(method);
        }
        IrNode type = payload.get();
        String typeKind = type.string("kind_v2");
        if (!"identifier".equals(typeKind)) {
            throw new DefinitionException("Unrecognized method parameter kind in library "
                    + owner.libraryName() + ": " + typeKind);
        }
        String raw = type.rawIdentifier();
        ResolvedDeclaration resolved = resolver.resolveDeclaration(raw, owner);

        MethodSignature.Shape shape;
        MethodSignature.ParameterKind parameterKind;
        if (resolved.kind() == DeclarationKind.STRUCT) {
            shape = MethodSignature.Shape.STRUCT;
            parameterKind = MethodSignature.ParameterKind.REQUIRED;
        }
        else if (resolved.kind() == DeclarationKind.TABLE) {
            shape = MethodSignature.Shape.TABLE;
            parameterKind = MethodSignature.ParameterKind.OPTIONAL;
        }
        else if (resolved.kind() == DeclarationKind.UNION) {
            shape = MethodSignature.Shape.UNION;
            parameterKind = MethodSignature.ParameterKind.VARIANT;
        }
        else {
            throw new DefinitionException("Unrecognized method parameter kind for " + method
                    + " in library " + owner.libraryName() + ": " + resolved.kind().irName());
        }

        List<MethodSignature.Parameter> parameters = new ArrayList<>();
        for (IrNode member : resolved.declaration().list("members")) {
            if (member.flag("reserved") || !member.has("type")) {
                continue;
            }
            parameters.add(new MethodSignature.Parameter(
                    Identifiers.memberName(member.rawName()),
                    parameterKind,
                    resolver.resolve(member.get("type"), resolved.owner())));
        }
        return new MethodSignature(method, shape, raw, parameters);
    }
}
