package com.questrail.fidl.protocol;

import com.questrail.fidl.codec.ValueConstructor;
import com.questrail.fidl.types.TypeDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * MethodSignature
 * -----------------------------------------------------------------------------
 * Parameter shape of a protocol callable, derived from the kind of its
 * payload:
 *
 * <ul>
 *   <li>struct payload: one required parameter per member</li>
 *   <li>table payload: one optional parameter per member (absent by default)</li>
 *   <li>union payload: one parameter per variant, exactly one of which is passed</li>
 *   <li>no payload: no parameters</li>
 * </ul>
 *
 * <p>Arguments are passed by name. {@link #bind(Map, ValueConstructor)} checks
 * them against the shape and builds the payload value.</p>
 */
public record MethodSignature(
        String method,
        Shape shape,
        String payloadIdentifier,
        List<Parameter> parameters
) {
    public enum Shape { STRUCT, TABLE, UNION, NONE }

    public enum ParameterKind { REQUIRED, OPTIONAL, VARIANT }

    public record Parameter(String name, ParameterKind kind, TypeDescriptor type) {
    }

    public MethodSignature {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(shape, "shape");
        parameters = List.copyOf(parameters);
    }

    public static MethodSignature none(String method) {
        return new MethodSignature(method, Shape.NONE, null, List.of());
    }

    public List<String> parameterNames() {
        List<String> names = new ArrayList<>();
        parameters.forEach(p -> names.add(p.name()));
        return names;
    }

    /**
     * Checks named arguments against this signature and builds the payload.
     *
     * @return the typed payload, or {@code null} for a method without payload
     * @throws CallShapeException if the arguments do not fit the shape
     */
    public Object bind(Map<String, ?> arguments, ValueConstructor values) {
        List<String> names = parameterNames();
        for (String argument : arguments.keySet()) {
            if (!names.contains(argument)) {
                throw new CallShapeException(method + "() got an unexpected argument '" + argument
                        + "'; parameters are " + names);
            }
        }
        switch (shape) {
            case NONE:
                return null;
            case STRUCT:
                for (Parameter parameter : parameters) {
                    if (!arguments.containsKey(parameter.name())) {
                        throw new CallShapeException(method + "() missing required argument '"
                                + parameter.name() + "'");
                    }
                }
                break;
            case UNION:
                if (arguments.size() != 1) {
                    throw new CallShapeException(method + "() takes exactly one of " + names
                            + ", got " + arguments.keySet());
                }
                break;
            default:
                break;
        }
        return values.construct(payloadIdentifier, arguments);
    }
}
