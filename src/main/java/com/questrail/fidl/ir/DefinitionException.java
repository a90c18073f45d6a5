package com.questrail.fidl.ir;

/**
 * Indicates that an IR document describes something the binding compiler
 * cannot turn into a usable declaration.
 *
 * This typically reflects:
 * <ul>
 *   <li>An identifier that is declared in no reachable library</li>
 *   <li>A declaration or type shape the compiler does not recognize</li>
 *   <li>A protocol whose method ordinals collide or are zero</li>
 *   <li>A result union whose variants are not {@code response/err/framework_err}</li>
 * </ul>
 *
 * Definition errors are raised while compiling or materializing a library and
 * are never retried: they point at a defect in the IR or in its producer.
 */
public class DefinitionException extends RuntimeException
{
    public DefinitionException(String message) {
        super(message);
    }

    public DefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
