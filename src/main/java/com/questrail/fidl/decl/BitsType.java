package com.questrail.fidl.decl;

import com.questrail.fidl.ir.DeclarationKind;
import com.questrail.fidl.types.PrimitiveSubtype;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * BitsType
 * -----------------------------------------------------------------------------
 * A compiled bits declaration: named flags that combine by bitwise or.
 *
 * <p>The default value is "no flags set". A bits declaration without members
 * is given a single {@value EnumType#EMPTY_MEMBER} member with value
 * {@code 0}. Strict bits reject values with bits outside {@link #mask()}.</p>
 */
public final class BitsType extends AbstractDeclaration implements DeclaredType
{
    private final PrimitiveSubtype subtype;
    private final boolean strict;
    private final Map<String, Long> members;
    private final long mask;
    private final BitsValue none;

    public BitsType(String rawQualifiedName, Optional<String> documentation, PrimitiveSubtype subtype,
                    Map<String, Long> members, boolean strict) {
        super(DeclarationKind.BITS, rawQualifiedName, documentation);
        this.subtype = subtype;
        this.strict = strict;
        Map<String, Long> declared = new LinkedHashMap<>(members);
        if (declared.isEmpty()) {
            declared.put(EnumType.EMPTY_MEMBER, 0L);
        }
        this.members = Collections.unmodifiableMap(declared);
        long combined = 0;
        for (long bit : declared.values()) {
            combined |= bit;
        }
        this.mask = combined;
        this.none = new BitsValue(this, 0);
    }

    public PrimitiveSubtype subtype() {
        return subtype;
    }

    public boolean isStrict() {
        return strict;
    }

    public Map<String, Long> members() {
        return members;
    }

    /**
     * @return the union of every declared flag
     */
    public long mask() {
        return mask;
    }

    /**
     * @throws IllegalArgumentException if a strict type is given unknown bits
     */
    public BitsValue valueOf(long bits) {
        if (strict && (bits & ~mask) != 0) {
            throw new IllegalArgumentException("0x" + Long.toHexString(bits)
                    + " has bits outside strict bits " + qualifiedName()
                    + " (mask 0x" + Long.toHexString(mask) + ")");
        }
        return bits == 0 ? none : new BitsValue(this, bits);
    }

    /**
     * @throws IllegalArgumentException if a name is not a declared flag
     */
    public BitsValue of(String... names) {
        long bits = 0;
        for (String name : names) {
            Long bit = members.get(name);
            if (bit == null) {
                throw new IllegalArgumentException(qualifiedName() + " has no member '" + name + "'");
            }
            bits |= bit;
        }
        return valueOf(bits);
    }

    @Override
    public BitsValue makeDefault() {
        return none;
    }
}
