package com.questrail.fidl.decl;

import com.questrail.fidl.ir.DeclarationKind;

import java.util.Optional;

/**
 * A declaration of a FIDL library after compilation.
 */
public interface CompiledDeclaration
{
    DeclarationKind kind();

    /**
     * @return the library member name, e.g. {@code Point} or {@code EchoSayResult}
     */
    String name();

    /**
     * @return the normalized fully-qualified name, e.g. {@code x/EchoSayResult}
     */
    String qualifiedName();

    /**
     * @return the fully-qualified name as spelled in the IR, e.g. {@code x/Echo_Say_Result}
     */
    String rawQualifiedName();

    /**
     * @return the declaring library, e.g. {@code x}
     */
    String library();

    Optional<String> documentation();
}
