package com.questrail.fidl.types;

import com.questrail.fidl.ir.DeclarationKind;
import com.questrail.fidl.ir.Identifiers;

import java.util.Objects;

/**
 * TypeDescriptor
 * -----------------------------------------------------------------------------
 * A resolved type reference: the type of a struct/table field, a union
 * variant, a vector element, a constant.
 *
 * <p>Identifier references record the <em>kind</em> of the referenced
 * declaration and its raw identifier, never the compiled declaration itself.
 * The compiled type is looked up by name at use time, which is what makes
 * forward and recursive references safe.</p>
 *
 * <p>Every descriptor carries a nullability flag; {@link #asNullable()} is
 * applied last by the resolver regardless of kind.</p>
 */
public sealed interface TypeDescriptor
        permits TypeDescriptor.Primitive, TypeDescriptor.StringType, TypeDescriptor.Vector,
                TypeDescriptor.Array, TypeDescriptor.Handle, TypeDescriptor.Identifier,
                TypeDescriptor.Endpoint, TypeDescriptor.Internal
{
    boolean nullable();

    TypeDescriptor asNullable();

    /** Primitive value: bool, integers, floats. */
    record Primitive(PrimitiveSubtype subtype, boolean nullable) implements TypeDescriptor {
        public Primitive {
            Objects.requireNonNull(subtype, "subtype");
        }

        @Override
        public Primitive asNullable() {
            return new Primitive(subtype, true);
        }

        @Override
        public String toString() {
            return subtype.irName() + (nullable ? "?" : "");
        }
    }

    /** UTF-8 string. */
    record StringType(boolean nullable) implements TypeDescriptor {
        @Override
        public StringType asNullable() {
            return new StringType(true);
        }

        @Override
        public String toString() {
            return "string" + (nullable ? "?" : "");
        }
    }

    /** Variable-length sequence. */
    record Vector(TypeDescriptor element, boolean nullable) implements TypeDescriptor {
        public Vector {
            Objects.requireNonNull(element, "element");
        }

        @Override
        public Vector asNullable() {
            return new Vector(element, true);
        }

        @Override
        public String toString() {
            return "vector<" + element + ">" + (nullable ? "?" : "");
        }
    }

    /** Fixed-length sequence. */
    record Array(TypeDescriptor element, int count, boolean nullable) implements TypeDescriptor {
        public Array {
            Objects.requireNonNull(element, "element");
        }

        @Override
        public Array asNullable() {
            return new Array(element, count, true);
        }

        @Override
        public String toString() {
            return "array<" + element + ", " + count + ">" + (nullable ? "?" : "");
        }
    }

    /** Kernel handle, carried as its raw value. */
    record Handle(String subtype, boolean nullable) implements TypeDescriptor {
        @Override
        public Handle asNullable() {
            return new Handle(subtype, true);
        }

        @Override
        public String toString() {
            return "zx." + subtype + (nullable ? "?" : "");
        }
    }

    /** Reference to a named declaration, possibly in another library. */
    record Identifier(String rawIdentifier, DeclarationKind kind, boolean nullable) implements TypeDescriptor {
        public Identifier {
            Objects.requireNonNull(rawIdentifier, "rawIdentifier");
            Objects.requireNonNull(kind, "kind");
        }

        public String identifier() {
            return Identifiers.normalize(rawIdentifier);
        }

        @Override
        public Identifier asNullable() {
            return new Identifier(rawIdentifier, kind, true);
        }

        @Override
        public String toString() {
            return identifier() + (nullable ? "?" : "");
        }
    }

    /** Client or server end of a channel bound to a protocol. */
    record Endpoint(Role role, String protocol, boolean nullable) implements TypeDescriptor {
        public enum Role { CLIENT, SERVER }

        public Endpoint {
            Objects.requireNonNull(role, "role");
            Objects.requireNonNull(protocol, "protocol");
        }

        @Override
        public Endpoint asNullable() {
            return new Endpoint(role, protocol, true);
        }

        @Override
        public String toString() {
            return (role == Role.CLIENT ? "client_end:" : "server_end:") + protocol + (nullable ? "?" : "");
        }
    }

    /** Compiler-internal type, e.g. {@code framework_error}. */
    record Internal(String subtype, boolean nullable) implements TypeDescriptor {
        public static final String FRAMEWORK_ERROR = "framework_error";

        @Override
        public Internal asNullable() {
            return new Internal(subtype, true);
        }

        @Override
        public String toString() {
            return "internal:" + subtype;
        }
    }
}
