package com.questrail.fidl.decl;

import java.util.Objects;

/**
 * One value of an {@link EnumType}.
 */
public final class EnumValue implements DeclaredValue
{
    private final EnumType type;
    private final String name;
    private final long value;

    EnumValue(EnumType type, String name, long value) {
        this.type = type;
        this.name = name;
        this.value = value;
    }

    @Override
    public EnumType type() {
        return type;
    }

    /**
     * @return the member name, or {@code null} for an unknown value of a flexible enum
     */
    public String name() {
        return name;
    }

    public long value() {
        return value;
    }

    public boolean isUnknown() {
        return name == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EnumValue)) {
            return false;
        }
        EnumValue other = (EnumValue) o;
        return type == other.type && value == other.value;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type.qualifiedName(), value);
    }

    @Override
    public String toString() {
        return type.name() + "." + (name == null ? "UNKNOWN(" + value + ")" : name);
    }
}
