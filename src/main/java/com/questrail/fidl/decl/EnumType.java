package com.questrail.fidl.decl;

import com.questrail.fidl.ir.DeclarationKind;
import com.questrail.fidl.types.PrimitiveSubtype;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * EnumType
 * -----------------------------------------------------------------------------
 * A compiled enum: a closed set of named integer values.
 *
 * <p>Decoding needs a zero value to fall back on. An enum with no
 * zero-valued member is given a synthetic {@value #EMPTY_MEMBER} member
 * with value {@code 0}.</p>
 *
 * <p>A flexible enum accepts values outside its member set; they come back
 * as values whose {@link EnumValue#isUnknown()} is {@code true}. A strict
 * enum rejects them.</p>
 */
public final class EnumType extends AbstractDeclaration implements DeclaredType
{
    public static final String EMPTY_MEMBER = "EMPTY__";

    private final PrimitiveSubtype subtype;
    private final boolean strict;
    private final Map<String, EnumValue> byName;
    private final Map<Long, EnumValue> byValue;

    public EnumType(String rawQualifiedName, Optional<String> documentation, PrimitiveSubtype subtype,
                    Map<String, Long> members, boolean strict) {
        super(DeclarationKind.ENUM, rawQualifiedName, documentation);
        this.subtype = subtype;
        this.strict = strict;

        Map<String, Long> declared = new LinkedHashMap<>(members);
        if (!declared.containsValue(0L)) {
            declared.put(EMPTY_MEMBER, 0L);
        }
        Map<String, EnumValue> names = new LinkedHashMap<>();
        Map<Long, EnumValue> values = new LinkedHashMap<>();
        declared.forEach((name, value) -> {
            EnumValue member = new EnumValue(this, name, value);
            names.put(name, member);
            values.putIfAbsent(value, member);
        });
        this.byName = Collections.unmodifiableMap(names);
        this.byValue = Collections.unmodifiableMap(values);
    }

    public PrimitiveSubtype subtype() {
        return subtype;
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * @return member name to value, including a synthesized zero member
     */
    public Map<String, Long> members() {
        Map<String, Long> members = new LinkedHashMap<>();
        byName.forEach((name, value) -> members.put(name, value.value()));
        return Collections.unmodifiableMap(members);
    }

    /**
     * @throws IllegalArgumentException if the enum has no such member
     */
    public EnumValue member(String name) {
        EnumValue value = byName.get(name);
        if (value == null) {
            throw new IllegalArgumentException(qualifiedName() + " has no member '" + name + "'");
        }
        return value;
    }

    /**
     * @throws IllegalArgumentException for an unknown value of a strict enum
     */
    public EnumValue valueOf(long value) {
        EnumValue member = byValue.get(value);
        if (member != null) {
            return member;
        }
        if (strict) {
            throw new IllegalArgumentException(value + " is not a member of strict enum " + qualifiedName());
        }
        return new EnumValue(this, null, value);
    }

    @Override
    public EnumValue makeDefault() {
        return byValue.get(0L);
    }
}
