package com.questrail.fidl.decl;

import com.questrail.fidl.ir.DeclarationKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * UnionType
 * -----------------------------------------------------------------------------
 * A compiled union. A value holds at most one variant; the variant-less value
 * is the default.
 *
 * <h2>Result unions</h2>
 * A union flagged {@code is_result} by the IR has the variants
 * {@code response}, {@code err} (when the method declares an error type) and
 * {@code framework_err} (when the method is flexible). Its values support
 * {@link UnionValue#unwrap()}.
 */
public final class UnionType extends AbstractDeclaration implements EncodableType
{
    public static final String RESPONSE = "response";
    public static final String ERR = "err";
    public static final String FRAMEWORK_ERR = "framework_err";

    private final List<MemberSpec> variants;
    private final Map<String, MemberSpec> variantsByName;
    private final boolean result;
    private final boolean strict;
    private final UnionValue empty;

    public UnionType(String rawQualifiedName, Optional<String> documentation, List<MemberSpec> variants,
                     boolean result, boolean strict) {
        super(DeclarationKind.UNION, rawQualifiedName, documentation);
        this.variants = List.copyOf(variants);
        Map<String, MemberSpec> byName = new LinkedHashMap<>();
        for (MemberSpec variant : this.variants) {
            byName.put(variant.name(), variant);
        }
        this.variantsByName = Collections.unmodifiableMap(byName);
        this.result = result;
        this.strict = strict;
        this.empty = new UnionValue(this, null, null);
    }

    public List<MemberSpec> variants() {
        return variants;
    }

    public Optional<MemberSpec> variant(String name) {
        return Optional.ofNullable(variantsByName.get(name));
    }

    public boolean isResult() {
        return result;
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * Builds a value from at most one {@code variant -> value} entry. An
     * empty map yields the empty union.
     *
     * @throws UnionConstructionException for more than one entry or an
     *         unknown variant
     */
    public UnionValue create(Map<String, ?> values) {
        if (values.isEmpty()) {
            return empty;
        }
        if (values.size() > 1) {
            throw new UnionConstructionException(qualifiedName()
                    + " takes exactly one variant, got " + values.keySet());
        }
        Map.Entry<String, ?> entry = values.entrySet().iterator().next();
        return variant(entry.getKey(), entry.getValue());
    }

    /**
     * Builds a value holding one variant.
     *
     * @throws UnionConstructionException for an unknown variant or a
     *         {@code null} value
     */
    public UnionValue variant(String name, Object value) {
        MemberSpec variant = variantsByName.get(name);
        if (variant == null) {
            throw new UnionConstructionException(qualifiedName() + " has no variant '" + name + "'");
        }
        if (value == null) {
            throw new UnionConstructionException("Variant '" + name + "' of " + qualifiedName()
                    + " cannot be set to null");
        }
        return new UnionValue(this, name, variant.accept(value, qualifiedName()));
    }

    public UnionValue empty() {
        return empty;
    }

    @Override
    public UnionValue makeDefault() {
        return empty;
    }
}
