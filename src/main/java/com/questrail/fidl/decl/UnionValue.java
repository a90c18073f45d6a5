package com.questrail.fidl.decl;

import java.util.Objects;
import java.util.Optional;

/**
 * An immutable union value: one variant, or none.
 */
public final class UnionValue implements DeclaredValue
{
    private final UnionType type;
    private final String variant;
    private final Object value;

    UnionValue(UnionType type, String variant, Object value) {
        this.type = type;
        this.variant = variant;
        this.value = value;
    }

    @Override
    public UnionType type() {
        return type;
    }

    /**
     * @return the name of the variant that is set, or empty for the empty union
     */
    public Optional<String> variant() {
        return Optional.ofNullable(variant);
    }

    /**
     * @return the value of the variant that is set, or {@code null}
     */
    public Object value() {
        return value;
    }

    public boolean isEmpty() {
        return variant == null;
    }

    /**
     * @return the variant's value if it is the one that is set, otherwise {@code null}
     * @throws IllegalArgumentException if the union declares no such variant
     */
    public Object get(String name) {
        if (type.variant(name).isEmpty()) {
            throw new IllegalArgumentException(type.qualifiedName() + " has no variant '" + name + "'");
        }
        return name.equals(variant) ? value : null;
    }

    /**
     * Returns the response held by a result union.
     *
     * @throws ResultErrorException if a {@code framework_err} or {@code err} variant is set
     * @throws EmptyResultException if neither an error nor a response is set
     * @throws IllegalStateException if the union is not a result union
     */
    public Object unwrap() {
        if (!type.isResult()) {
            throw new IllegalStateException(type.rawQualifiedName() + " is not a result union");
        }
        if (UnionType.FRAMEWORK_ERR.equals(variant)) {
            throw new ResultErrorException(type.rawQualifiedName(), variant, value);
        }
        if (UnionType.ERR.equals(variant)) {
            throw new ResultErrorException(type.rawQualifiedName(), variant, value);
        }
        if (UnionType.RESPONSE.equals(variant)) {
            return value;
        }
        throw new EmptyResultException(type.rawQualifiedName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UnionValue)) {
            return false;
        }
        UnionValue other = (UnionValue) o;
        return type == other.type && Objects.equals(variant, other.variant) && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type.qualifiedName(), variant, value);
    }

    @Override
    public String toString() {
        return type.name() + "(" + (variant == null ? "None" : variant + "=" + value) + ")";
    }
}
