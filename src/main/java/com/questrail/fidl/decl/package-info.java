/**
 * Compiled Declarations
 * =============================================================================
 *
 * <p>Runtime representation of the declarations of a FIDL library. Each
 * declaration is compiled once into a descriptor object ({@link
 * com.questrail.fidl.decl.StructType}, {@link com.questrail.fidl.decl.UnionType},
 * ...) which acts as the factory and validator for its values ({@link
 * com.questrail.fidl.decl.RecordValue}, {@link com.questrail.fidl.decl.UnionValue},
 * ...). No classes are generated.</p>
 *
 * <h2>References between declarations</h2>
 * Member types are kept as {@link com.questrail.fidl.types.TypeDescriptor}s
 * and resolved by name through a {@link com.questrail.fidl.decl.TypeLookup}
 * when a value is built. Compiling a declaration therefore never requires the
 * declarations it references to be compiled first.
 *
 * <h2>Immutability</h2>
 * Compiled declarations and their values are immutable and may be shared
 * freely between threads.
 */
package com.questrail.fidl.decl;
