package com.questrail.fidl.decl;

import com.questrail.fidl.ir.DeclarationKind;
import com.questrail.fidl.types.TypeDescriptor;

import java.util.Objects;
import java.util.Optional;

/**
 * A compiled constant: a name and its converted value.
 *
 * <p>Primitive constants hold the primitive's Java representation, string
 * constants a {@link String}, and enum or bits constants an
 * {@link EnumValue} or {@link BitsValue}.</p>
 */
public final class ConstDeclaration extends AbstractDeclaration
{
    private final TypeDescriptor type;
    private final Object value;

    public ConstDeclaration(String rawQualifiedName, Optional<String> documentation, TypeDescriptor type,
                            Object value) {
        super(DeclarationKind.CONST, rawQualifiedName, documentation);
        this.type = Objects.requireNonNull(type, "type");
        this.value = Objects.requireNonNull(value, "value");
    }

    public TypeDescriptor type() {
        return type;
    }

    public Object value() {
        return value;
    }

    @Override
    public String toString() {
        return "const " + qualifiedName() + " = " + value;
    }
}
