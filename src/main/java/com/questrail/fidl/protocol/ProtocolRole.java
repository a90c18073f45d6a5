package com.questrail.fidl.protocol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ProtocolRole
 * -----------------------------------------------------------------------------
 * One side of a protocol: the client, the server or the event handler.
 *
 * <ul>
 *   <li><b>callables</b>: methods this role sends (client: requests;
 *       server: events)</li>
 *   <li><b>handlers</b>: methods this role receives and must implement
 *       (server: requests; event handler: events)</li>
 *   <li><b>method map</b>: ordinal to {@link MethodInfo} for every handler</li>
 * </ul>
 *
 * <p>Built once per protocol and shared by every instance bound to it.</p>
 */
public final class ProtocolRole
{
    public enum Kind { CLIENT, SERVER, EVENT_HANDLER }

    private final Kind kind;
    private final String name;
    private final String protocol;
    private final String library;
    private final Map<String, ProtocolMethod> callables;
    private final Map<String, ProtocolMethod> handlers;
    private final Map<Long, MethodInfo> methodMap;

    ProtocolRole(Kind kind, String name, String protocol, String library,
                 List<ProtocolMethod> callables, List<ProtocolMethod> handlers,
                 Map<Long, MethodInfo> methodMap) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = Objects.requireNonNull(name, "name");
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.library = Objects.requireNonNull(library, "library");
        this.callables = index(callables);
        this.handlers = index(handlers);
        this.methodMap = Collections.unmodifiableMap(new LinkedHashMap<>(methodMap));
    }

    private static Map<String, ProtocolMethod> index(List<ProtocolMethod> methods) {
        Map<String, ProtocolMethod> byName = new LinkedHashMap<>();
        methods.forEach(m -> byName.put(m.name(), m));
        return Collections.unmodifiableMap(byName);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return e.g. {@code EchoServer}
     */
    public String name() {
        return name;
    }

    /**
     * @return qualified name of the protocol, e.g. {@code x/Echo}
     */
    public String protocol() {
        return protocol;
    }

    public String library() {
        return library;
    }

    public Map<String, ProtocolMethod> callables() {
        return callables;
    }

    public Optional<ProtocolMethod> callable(String name) {
        return Optional.ofNullable(callables.get(name));
    }

    public Map<String, ProtocolMethod> handlers() {
        return handlers;
    }

    public Map<Long, MethodInfo> methodMap() {
        return methodMap;
    }

    @Override
    public String toString() {
        return name + "(" + protocol + ")";
    }
}
