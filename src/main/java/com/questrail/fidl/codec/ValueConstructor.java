package com.questrail.fidl.codec;

import com.questrail.fidl.decl.AliasType;
import com.questrail.fidl.decl.BitsType;
import com.questrail.fidl.decl.BitsValue;
import com.questrail.fidl.decl.DeclaredType;
import com.questrail.fidl.decl.DeclaredValue;
import com.questrail.fidl.decl.EnumType;
import com.questrail.fidl.decl.EnumValue;
import com.questrail.fidl.decl.MemberSpec;
import com.questrail.fidl.decl.RecordType;
import com.questrail.fidl.decl.RecordValue;
import com.questrail.fidl.decl.ResourceType;
import com.questrail.fidl.decl.TypeLookup;
import com.questrail.fidl.decl.UnionType;
import com.questrail.fidl.decl.UnionValue;
import com.questrail.fidl.ir.DeclarationKind;
import com.questrail.fidl.types.TypeDescriptor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * ValueConstructor
 * -----------------------------------------------------------------------------
 * Converts between the plain form produced and consumed by a
 * {@link FidlCodec} and typed declaration values.
 *
 * <h2>Plain form</h2>
 * <ul>
 *   <li>struct / table: {@code Map<String, Object>} keyed by member name
 *       (the IR spelling is accepted too)</li>
 *   <li>union: a map with at most one non-null entry</li>
 *   <li>enum / bits: any {@link Number}</li>
 *   <li>vector / array: {@link List}</li>
 * </ul>
 *
 * <p>Values that are already typed pass through unchanged, so handler results
 * may freely mix typed values and maps.</p>
 */
public final class ValueConstructor
{
    private final TypeLookup lookup;

    public ValueConstructor(TypeLookup lookup) {
        this.lookup = Objects.requireNonNull(lookup, "lookup");
    }

    /**
     * Builds a typed value of the named declaration.
     *
     * @param identifier raw or normalized fully-qualified identifier
     * @param decoded    value in plain form; {@code null} yields {@code null}
     * @throws IllegalArgumentException if the value does not fit the declaration
     */
    public Object construct(String identifier, Object decoded) {
        if (decoded == null) {
            return null;
        }
        return convert(lookup.type(identifier), decoded);
    }

    private Object convert(DeclaredType type, Object decoded) {
        if (decoded instanceof DeclaredValue) {
            return decoded;
        }
        if (type instanceof RecordType) {
            RecordType record = (RecordType) type;
            Map<?, ?> plain = asMap(type, decoded);
            Map<String, Object> fields = new LinkedHashMap<>();
            for (MemberSpec member : record.members()) {
                if (plain.containsKey(member.name())) {
                    fields.put(member.name(), convertMember(record, member, plain.get(member.name())));
                }
                else if (plain.containsKey(member.rawName())) {
                    fields.put(member.name(), convertMember(record, member, plain.get(member.rawName())));
                }
            }
            return record.create(fields);
        }
        if (type instanceof UnionType) {
            UnionType union = (UnionType) type;
            for (Map.Entry<?, ?> entry : asMap(type, decoded).entrySet()) {
                if (entry.getValue() == null) {
                    continue;
                }
                MemberSpec variant = union.variants().stream()
                        .filter(v -> v.name().equals(entry.getKey()) || v.rawName().equals(entry.getKey()))
                        .findFirst()
                        .orElseThrow(() -> new IllegalArgumentException(union.qualifiedName()
                                + " has no variant '" + entry.getKey() + "'"));
                return union.variant(variant.name(), convert(variant.type(), entry.getValue()));
            }
            return union.empty();
        }
        if (type instanceof EnumType) {
            return ((EnumType) type).valueOf(asNumber(type, decoded).longValue());
        }
        if (type instanceof BitsType) {
            return ((BitsType) type).valueOf(asNumber(type, decoded).longValue());
        }
        if (type instanceof AliasType) {
            return convert(((AliasType) type).target(), decoded);
        }
        if (type instanceof ResourceType) {
            return asNumber(type, decoded).longValue();
        }
        throw new IllegalArgumentException("Cannot construct values of " + type);
    }

    private Object convertMember(RecordType record, MemberSpec member, Object decoded) {
        try {
            return convert(member.type(), decoded);
        }
        catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(record.qualifiedName() + "." + member.name() + ": " + e.getMessage(), e);
        }
    }

    private Object convert(TypeDescriptor type, Object decoded) {
        if (decoded == null) {
            return null;
        }
        if (type instanceof TypeDescriptor.Primitive) {
            return ((TypeDescriptor.Primitive) type).subtype().coerce(decoded);
        }
        if (type instanceof TypeDescriptor.Vector) {
            return convertElements(((TypeDescriptor.Vector) type).element(), decoded);
        }
        if (type instanceof TypeDescriptor.Array) {
            return convertElements(((TypeDescriptor.Array) type).element(), decoded);
        }
        if (type instanceof TypeDescriptor.Identifier) {
            TypeDescriptor.Identifier identifier = (TypeDescriptor.Identifier) type;
            if (identifier.kind() == DeclarationKind.PROTOCOL) {
                return decoded;
            }
            return convert(lookup.type(identifier.rawIdentifier()), decoded);
        }
        return decoded;
    }

    private List<Object> convertElements(TypeDescriptor element, Object decoded) {
        if (!(decoded instanceof List)) {
            throw new IllegalArgumentException("Expected a list, got " + decoded.getClass().getSimpleName());
        }
        List<Object> converted = new ArrayList<>();
        for (Object item : (List<?>) decoded) {
            converted.add(convert(element, item));
        }
        return converted;
    }

    private static Map<?, ?> asMap(DeclaredType type, Object decoded) {
        if (!(decoded instanceof Map)) {
            throw new IllegalArgumentException("Expected a map for " + type.qualifiedName()
                    + ", got " + decoded.getClass().getSimpleName());
        }
        return (Map<?, ?>) decoded;
    }

    private static Number asNumber(DeclaredType type, Object decoded) {
        if (!(decoded instanceof Number)) {
            throw new IllegalArgumentException("Expected a number for " + type.qualifiedName()
                    + ", got " + decoded.getClass().getSimpleName());
        }
        return (Number) decoded;
    }

    /**
     * Inverse of {@link #construct(String, Object)}: reduces typed values to
     * plain form. Absent table members reduce to {@code null} entries and the
     * empty union to an empty map.
     */
    public static Object toPlain(Object value) {
        if (value instanceof RecordValue) {
            Map<String, Object> plain = new LinkedHashMap<>();
            ((RecordValue) value).fields().forEach((name, field) -> plain.put(name, toPlain(field)));
            return plain;
        }
        if (value instanceof UnionValue) {
            UnionValue union = (UnionValue) value;
            Map<String, Object> plain = new LinkedHashMap<>();
            union.variant().ifPresent(variant -> plain.put(variant, toPlain(union.value())));
            return plain;
        }
        if (value instanceof EnumValue) {
            return ((EnumValue) value).value();
        }
        if (value instanceof BitsValue) {
            return ((BitsValue) value).bits();
        }
        if (value instanceof List) {
            List<Object> plain = new ArrayList<>();
            for (Object item : (List<?>) value) {
                plain.add(toPlain(item));
            }
            return plain;
        }
        if (value instanceof Map) {
            Map<Object, Object> plain = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> plain.put(k, toPlain(v)));
            return plain;
        }
        return value;
    }
}
