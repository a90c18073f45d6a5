package com.questrail.fidl.ir;

import java.util.Arrays;
import java.util.Optional;

/**
 * Declaration kinds the binding compiler knows how to materialize.
 *
 * <p>The constant order is the export order used when a library is
 * materialized: every kind may reference kinds that precede it.</p>
 */
public enum DeclarationKind
{
    BITS("bits"),
    EXPERIMENTAL_RESOURCE("experimental_resource"),
    ENUM("enum"),
    STRUCT("struct"),
    TABLE("table"),
    UNION("union"),
    CONST("const"),
    ALIAS("alias"),
    PROTOCOL("protocol");

    private final String irName;

    DeclarationKind(String irName) {
        this.irName = irName;
    }

    /**
     * @return the kind's spelling in the IR (e.g. {@code "struct"})
     */
    public String irName() {
        return irName;
    }

    /**
     * @return the key of the declaration list for this kind, e.g. {@code struct_declarations}
     */
    public String declarationListKey() {
        return irName + "_declarations";
    }

    public static Optional<DeclarationKind> fromIrName(String irName) {
        return Arrays.stream(values())
                .filter(k -> k.irName.equals(irName))
                .findFirst();
    }
}
