package com.questrail.fidl.server;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * HandlerTable
 * -----------------------------------------------------------------------------
 * Finds the implementation of a protocol method on a server or event-handler
 * instance.
 *
 * <h2>Resolution order</h2>
 * <ol>
 *   <li>a handler registered with {@link #bind(String, MethodHandler)}</li>
 *   <li>a public method of the instance with the handler's name taking zero
 *       or one parameter, declared by a subclass of the base class</li>
 * </ol>
 * A method that resolves to neither is not implemented; dispatching it
 * raises {@link UnsupportedOperationException}.
 *
 * <p>Binding is the primary way to implement a method. The reflective lookup
 * lets a subclass declare plain methods instead; its result is cached, and a
 * later {@link #bind(String, MethodHandler)} replaces it.</p>
 */
public final class HandlerTable
{
    private final Object target;
    private final Class<?> base;
    private final Map<String, MethodHandler> handlers = new ConcurrentHashMap<>();

    public HandlerTable(Object target, Class<?> base) {
        this.target = Objects.requireNonNull(target, "target");
        this.base = Objects.requireNonNull(base, "base");
    }

    public void bind(String name, MethodHandler handler) {
        handlers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(handler, "handler"));
    }

    /**
     * @throws UnsupportedOperationException if nothing implements the method
     */
    public MethodHandler resolve(String name) {
        MethodHandler handler = handlers.get(name);
        if (handler != null) {
            return handler;
        }
        handler = reflect(name);
        if (handler == null) {
            throw new UnsupportedOperationException("Method " + name + " not implemented");
        }
        MethodHandler raced = handlers.putIfAbsent(name, handler);
        return raced != null ? raced : handler;
    }

    public boolean isImplemented(String name) {
        return handlers.containsKey(name) || reflect(name) != null;
    }

    private MethodHandler reflect(String name) {
        Method best = null;
        for (Method method : target.getClass().getMethods()) {
            if (!method.getName().equals(name)
                    || method.getParameterCount() > 1
                    || method.getDeclaringClass().isAssignableFrom(base)) {
                continue;
            }
            if (best == null || method.getParameterCount() > best.getParameterCount()) {
                best = method;
            }
        }
        if (best == null) {
            return null;
        }
        Method method = best;
        method.trySetAccessible();
        return request -> invoke(method, request);
    }

    private Object invoke(Method method, Object request) throws Exception {
        try {
            return method.getParameterCount() == 0 ? method.invoke(target) : method.invoke(target, request);
        }
        catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }
}
