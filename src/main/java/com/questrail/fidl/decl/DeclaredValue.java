package com.questrail.fidl.decl;

/**
 * A value built by a compiled declaration.
 */
public interface DeclaredValue
{
    DeclaredType type();
}
