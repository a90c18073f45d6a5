package com.questrail.fidl.decl;

import com.questrail.fidl.ir.DeclarationKind;
import com.questrail.fidl.types.TypeDescriptor;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A compiled alias. Values of an alias are values of its target type; the
 * alias keeps its own name and documentation for diagnostics.
 */
public final class AliasType extends AbstractDeclaration implements DeclaredType
{
    private final TypeDescriptor target;
    private final TypeLookup lookup;

    public AliasType(String rawQualifiedName, Optional<String> documentation, TypeDescriptor target,
                     TypeLookup lookup) {
        super(DeclarationKind.ALIAS, rawQualifiedName, documentation);
        this.target = Objects.requireNonNull(target, "target");
        this.lookup = Objects.requireNonNull(lookup, "lookup");
    }

    public TypeDescriptor target() {
        return target;
    }

    /**
     * Member set of an aliased enum or bits declaration; empty for any other
     * target.
     */
    public Map<String, Long> members() {
        DeclaredType aliased = aliasedDeclaration().orElse(null);
        if (aliased instanceof EnumType) {
            return ((EnumType) aliased).members();
        }
        if (aliased instanceof BitsType) {
            return ((BitsType) aliased).members();
        }
        if (aliased instanceof AliasType) {
            return ((AliasType) aliased).members();
        }
        return Map.of();
    }

    /**
     * @return the compiled declaration the alias refers to, when the target is an identifier
     */
    public Optional<DeclaredType> aliasedDeclaration() {
        if (target instanceof TypeDescriptor.Identifier) {
            return Optional.of(lookup.type(((TypeDescriptor.Identifier) target).rawIdentifier()));
        }
        return Optional.empty();
    }

    @Override
    public Object makeDefault() {
        if (target.nullable()) {
            return null;
        }
        if (target instanceof TypeDescriptor.Primitive) {
            return ((TypeDescriptor.Primitive) target).subtype().zeroValue();
        }
        if (target instanceof TypeDescriptor.StringType) {
            return "";
        }
        if (target instanceof TypeDescriptor.Vector || target instanceof TypeDescriptor.Array) {
            return List.of();
        }
        return aliasedDeclaration().map(DeclaredType::makeDefault).orElse(null);
    }
}
