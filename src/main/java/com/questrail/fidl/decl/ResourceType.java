package com.questrail.fidl.decl;

import com.questrail.fidl.ir.DeclarationKind;

import java.util.Optional;

/**
 * A compiled {@code experimental_resource} declaration. Resource values are
 * carried as their raw handle value; the default is {@code 0}.
 */
public final class ResourceType extends AbstractDeclaration implements DeclaredType
{
    public ResourceType(String rawQualifiedName, Optional<String> documentation) {
        super(DeclarationKind.EXPERIMENTAL_RESOURCE, rawQualifiedName, documentation);
    }

    @Override
    public Long makeDefault() {
        return 0L;
    }
}
