package com.questrail.fidl.decl;

/**
 * A compiled declaration that describes a set of values: structs, tables,
 * unions, enums, bits, aliases and resources.
 */
public interface DeclaredType extends CompiledDeclaration
{
    /**
     * @return the well-defined default value of this type
     */
    Object makeDefault();
}
