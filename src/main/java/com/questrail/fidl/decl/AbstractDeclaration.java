package com.questrail.fidl.decl;

import com.questrail.fidl.ir.DeclarationKind;
import com.questrail.fidl.ir.Identifiers;

import java.util.Objects;
import java.util.Optional;

/**
 * Identity shared by every compiled declaration. Two declarations are the
 * same declaration only if they are the same object.
 */
public abstract class AbstractDeclaration implements CompiledDeclaration
{
    private final DeclarationKind kind;
    private final String rawQualifiedName;
    private final String qualifiedName;
    private final String documentation;

    protected AbstractDeclaration(DeclarationKind kind, String rawQualifiedName, Optional<String> documentation) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.rawQualifiedName = Objects.requireNonNull(rawQualifiedName, "rawQualifiedName");
        this.qualifiedName = Identifiers.normalize(rawQualifiedName);
        this.documentation = documentation.orElse(null);
    }

    @Override
    public final DeclarationKind kind() {
        return kind;
    }

    @Override
    public final String name() {
        return Identifiers.memberOf(rawQualifiedName);
    }

    @Override
    public final String qualifiedName() {
        return qualifiedName;
    }

    @Override
    public final String rawQualifiedName() {
        return rawQualifiedName;
    }

    @Override
    public final String library() {
        return Identifiers.libraryOf(rawQualifiedName);
    }

    @Override
    public final Optional<String> documentation() {
        return Optional.ofNullable(documentation);
    }

    @Override
    public String toString() {
        return kind.irName() + " " + qualifiedName;
    }
}
