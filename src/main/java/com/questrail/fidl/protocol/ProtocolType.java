package com.questrail.fidl.protocol;

import com.questrail.fidl.decl.AbstractDeclaration;
import com.questrail.fidl.ir.DeclarationKind;
import com.questrail.fidl.ir.Identifiers;

import java.util.List;
import java.util.Optional;

/**
 * A compiled protocol: its methods and its three roles.
 */
public final class ProtocolType extends AbstractDeclaration
{
    private final List<ProtocolMethod> methods;
    private final ProtocolRole client;
    private final ProtocolRole server;
    private final ProtocolRole eventHandler;

    ProtocolType(String rawQualifiedName, Optional<String> documentation, List<ProtocolMethod> methods,
                 ProtocolRole client, ProtocolRole server, ProtocolRole eventHandler) {
        super(DeclarationKind.PROTOCOL, rawQualifiedName, documentation);
        this.methods = List.copyOf(methods);
        this.client = client;
        this.server = server;
        this.eventHandler = eventHandler;
    }

    public List<ProtocolMethod> methods() {
        return methods;
    }

    public Optional<ProtocolMethod> method(String name) {
        return methods.stream().filter(m -> m.name().equals(name)).findFirst();
    }

    public ProtocolRole client() {
        return client;
    }

    public ProtocolRole server() {
        return server;
    }

    public ProtocolRole eventHandler() {
        return eventHandler;
    }

    /**
     * Discovery marker, e.g. {@code fuchsia.io.Directory}.
     */
    public String marker() {
        return Identifiers.marker(rawQualifiedName());
    }
}
