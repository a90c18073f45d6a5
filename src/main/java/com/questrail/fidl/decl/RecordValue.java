package com.questrail.fidl.decl;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * An immutable struct or table value.
 */
public final class RecordValue implements DeclaredValue
{
    private final RecordType type;
    private final Map<String, Object> fields;

    RecordValue(RecordType type, Map<String, Object> fields) {
        this.type = type;
        this.fields = Collections.unmodifiableMap(fields);
    }

    @Override
    public RecordType type() {
        return type;
    }

    /**
     * @return the member's value; {@code null} for an absent table member
     * @throws IllegalArgumentException if the type declares no such member
     */
    public Object get(String name) {
        if (!fields.containsKey(name)) {
            throw new IllegalArgumentException(type.qualifiedName() + " has no member '" + name + "'");
        }
        return fields.get(name);
    }

    public boolean has(String name) {
        return get(name) != null;
    }

    /**
     * @return a copy of this value with one member replaced
     */
    public RecordValue with(String name, Object value) {
        return type.with(this, name, value);
    }

    /**
     * @return every member, in declaration order
     */
    public Map<String, Object> fields() {
        return fields;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RecordValue)) {
            return false;
        }
        RecordValue other = (RecordValue) o;
        return type == other.type && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type.qualifiedName(), fields);
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", type.name() + "(", ")");
        fields.forEach((name, value) -> joiner.add(name + "=" + value));
        return joiner.toString();
    }
}
