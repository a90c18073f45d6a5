package com.questrail.fidl.decl;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A combination of flags of a {@link BitsType}.
 */
public final class BitsValue implements DeclaredValue
{
    private final BitsType type;
    private final long bits;

    BitsValue(BitsType type, long bits) {
        this.type = type;
        this.bits = bits;
    }

    @Override
    public BitsType type() {
        return type;
    }

    public long bits() {
        return bits;
    }

    /**
     * @throws IllegalArgumentException if the type declares no such flag
     */
    public boolean has(String name) {
        Long bit = type.members().get(name);
        if (bit == null) {
            throw new IllegalArgumentException(type.qualifiedName() + " has no member '" + name + "'");
        }
        return bit != 0 && (bits & bit) == bit;
    }

    public BitsValue or(BitsValue other) {
        if (other.type != type) {
            throw new IllegalArgumentException("Cannot combine " + type.qualifiedName()
                    + " with " + other.type.qualifiedName());
        }
        return type.valueOf(bits | other.bits);
    }

    /**
     * @return bits set on a flexible value that no declared flag covers
     */
    public long unknownBits() {
        return bits & ~type.mask();
    }

    /**
     * @return names of the declared flags that are set
     */
    public List<String> names() {
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, Long> member : type.members().entrySet()) {
            long bit = member.getValue();
            if (bit != 0 && (bits & bit) == bit) {
                names.add(member.getKey());
            }
        }
        return names;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BitsValue)) {
            return false;
        }
        BitsValue other = (BitsValue) o;
        return type == other.type && bits == other.bits;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type.qualifiedName(), bits);
    }

    @Override
    public String toString() {
        return type.name() + names() + (unknownBits() != 0 ? "+0x" + Long.toHexString(unknownBits()) : "");
    }
}
