package com.questrail.fidl.types;

import com.questrail.fidl.ir.DeclarationKind;
import com.questrail.fidl.ir.IrLibrary;
import com.questrail.fidl.ir.IrNode;

/**
 * The outcome of following an identifier to its declaration: the kind, the
 * declaration's IR node, and the library that declares it.
 */
public record ResolvedDeclaration(
        DeclarationKind kind,
        IrNode declaration,
        IrLibrary owner
) {
}
