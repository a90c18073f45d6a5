package com.questrail.fidl.decl;

import com.questrail.fidl.ir.DeclarationKind;
import com.questrail.fidl.types.TypeDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One member of a struct, table or union.
 *
 * @param name          member name as exposed to Java code (snake_case, never a Java keyword)
 * @param rawName       member name as spelled in the IR
 * @param ordinal       table/union ordinal; {@code 0} for struct members
 * @param type          resolved member type
 * @param documentation doc attribute, if any
 */
public record MemberSpec(
        String name,
        String rawName,
        long ordinal,
        TypeDescriptor type,
        Optional<String> documentation
) {
    private static final Set<DeclarationKind> VALUE_KINDS = EnumSet.of(
            DeclarationKind.STRUCT, DeclarationKind.TABLE, DeclarationKind.UNION,
            DeclarationKind.ENUM, DeclarationKind.BITS);

    public MemberSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(rawName, "rawName");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(documentation, "documentation");
    }

    /**
     * Value a struct member holds in a default-constructed struct: the zero
     * value for non-nullable primitives, otherwise {@code null}.
     */
    public Object zeroValue() {
        if (type instanceof TypeDescriptor.Primitive && !type.nullable()) {
            return ((TypeDescriptor.Primitive) type).subtype().zeroValue();
        }
        return null;
    }

    /**
     * Checks a value supplied for this member and converts numeric values to
     * the primitive's Java representation. Vector and array elements are
     * checked the same way, and lists are stored as unmodifiable copies.
     *
     * <p>{@code null} is passed through; whether the member may hold it is
     * decided by the declaring type.</p>
     *
     * @param owner qualified name of the declaring type, for diagnostics
     * @throws IllegalArgumentException if the value cannot belong to this member
     */
    public Object accept(Object value, String owner) {
        if (value == null) {
            return null;
        }
        return check(type, value, owner + "." + name);
    }

    private static Object check(TypeDescriptor type, Object value, String path) {
        if (value == null) {
            if (!type.nullable()) {
                throw new IllegalArgumentException(path + ": null for non-nullable " + type);
            }
            return null;
        }
        if (type instanceof TypeDescriptor.Primitive) {
            try {
                return ((TypeDescriptor.Primitive) type).subtype().coerce(value);
            }
            catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(path + ": " + e.getMessage(), e);
            }
        }
        if (type instanceof TypeDescriptor.StringType && !(value instanceof String)) {
            throw new IllegalArgumentException(path + ": expected string, got "
                    + value.getClass().getSimpleName());
        }
        if (type instanceof TypeDescriptor.Vector) {
            return checkElements(((TypeDescriptor.Vector) type).element(), value, path);
        }
        if (type instanceof TypeDescriptor.Array) {
            TypeDescriptor.Array array = (TypeDescriptor.Array) type;
            if (value instanceof List && ((List<?>) value).size() != array.count()) {
                throw new IllegalArgumentException(path + ": expected " + array.count()
                        + " elements, got " + ((List<?>) value).size());
            }
            return checkElements(array.element(), value, path);
        }
        if (type instanceof TypeDescriptor.Identifier && value instanceof DeclaredValue) {
            TypeDescriptor.Identifier identifier = (TypeDescriptor.Identifier) type;
            DeclaredType actual = ((DeclaredValue) value).type();
            if (VALUE_KINDS.contains(identifier.kind()) && !actual.qualifiedName().equals(identifier.identifier())) {
                throw new IllegalArgumentException(path + ": expected "
                        + identifier.identifier() + ", got " + actual.qualifiedName());
            }
        }
        return value;
    }

    private static List<Object> checkElements(TypeDescriptor element, Object value, String path) {
        if (!(value instanceof List)) {
            throw new IllegalArgumentException(path + ": expected a list, got "
                    + value.getClass().getSimpleName());
        }
        List<?> items = (List<?>) value;
        List<Object> checked = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            checked.add(check(element, items.get(i), path + "[" + i + "]"));
        }
        return Collections.unmodifiableList(checked);
    }
}
