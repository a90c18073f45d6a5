package com.questrail.fidl.decl;

import com.questrail.fidl.ir.DefinitionException;

/**
 * Resolves a fully-qualified identifier to its compiled declaration.
 *
 * <p>Implementations load and materialize the owning library on demand.
 * Raw and normalized spellings of the identifier are both accepted.</p>
 */
@FunctionalInterface
public interface TypeLookup
{
    /**
     * @throws DefinitionException if no library declares the identifier
     */
    CompiledDeclaration lookup(String identifier);

    /**
     * @throws DefinitionException if the identifier does not name a type
     */
    default DeclaredType type(String identifier) {
        CompiledDeclaration declaration = lookup(identifier);
        if (!(declaration instanceof DeclaredType)) {
            throw new DefinitionException(identifier + " is a " + declaration.kind().irName()
                    + " declaration, not a type");
        }
        return (DeclaredType) declaration;
    }
}
