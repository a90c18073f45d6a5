package com.questrail.fidl.decl;

import com.questrail.fidl.ir.DeclarationKind;

import java.util.List;
import java.util.Optional;

/**
 * A compiled struct: every member is present in every value.
 */
public final class StructType extends RecordType
{
    public StructType(String rawQualifiedName, Optional<String> documentation, List<MemberSpec> members) {
        super(DeclarationKind.STRUCT, rawQualifiedName, documentation, members);
    }

    @Override
    protected Object omitted(MemberSpec member) {
        throw new IllegalArgumentException("Missing member '" + member.name() + "' for struct " + qualifiedName());
    }

    @Override
    protected Object defaultValue(MemberSpec member) {
        return member.zeroValue();
    }

    @Override
    protected boolean allowsNull(MemberSpec member) {
        return member.type().nullable();
    }
}
