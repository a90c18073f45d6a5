package com.questrail.fidl.decl;

import com.questrail.fidl.ir.DeclarationKind;

import java.util.List;
import java.util.Optional;

/**
 * A compiled table: every member is optional, and absent members read as
 * {@code null}.
 */
public final class TableType extends RecordType
{
    public TableType(String rawQualifiedName, Optional<String> documentation, List<MemberSpec> members) {
        super(DeclarationKind.TABLE, rawQualifiedName, documentation, members);
    }

    @Override
    protected Object omitted(MemberSpec member) {
        return null;
    }

    @Override
    protected Object defaultValue(MemberSpec member) {
        return null;
    }

    @Override
    protected boolean allowsNull(MemberSpec member) {
        return true;
    }
}
