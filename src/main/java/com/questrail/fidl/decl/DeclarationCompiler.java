package com.questrail.fidl.decl;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.fidl.ir.DeclarationKind;
import com.questrail.fidl.ir.DefinitionException;
import com.questrail.fidl.ir.Identifiers;
import com.questrail.fidl.ir.IrLibrary;
import com.questrail.fidl.ir.IrNode;
import com.questrail.fidl.types.PrimitiveSubtype;
import com.questrail.fidl.types.ResolvedDeclaration;
import com.questrail.fidl.types.TypeDescriptor;
import com.questrail.fidl.types.TypeResolver;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * DeclarationCompiler
 * =============================================================================
 * Compiles the non-protocol declarations of an IR document.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>One compile function per declaration kind</li>
 *   <li>Member names are converted to snake_case and kept clear of Java
 *       keywords (see {@link Identifiers#memberName(String)})</li>
 *   <li>Result unions are checked for their well-known variant set</li>
 *   <li>Any shape not understood here fails at compile time with a
 *       {@link DefinitionException}</li>
 * </ul>
 *
 * <h2>What it does NOT do</h2>
 * <ul>
 *   <li>No caching; the library registry owns compiled declarations</li>
 *   <li>No protocols; see {@code ProtocolCompiler}</li>
 * </ul>
 */
public final class DeclarationCompiler
{
    private static final Set<String> RESULT_VARIANTS =
            Set.of(UnionType.RESPONSE, UnionType.ERR, UnionType.FRAMEWORK_ERR);

    private final TypeResolver resolver;
    private final TypeLookup lookup;

    public DeclarationCompiler(TypeResolver resolver, TypeLookup lookup)
    {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.lookup = Objects.requireNonNull(lookup, "lookup");
    }

    /**
     * Compiles a declaration of any kind except {@link DeclarationKind#PROTOCOL}.
     */
    public CompiledDeclaration compile(DeclarationKind kind, IrNode declaration, IrLibrary owner)
    {
        switch (kind) {
            case BITS:
                return compileBits(declaration, owner);
            case EXPERIMENTAL_RESOURCE:
                return compileResource(declaration, owner);
            case ENUM:
                return compileEnum(declaration, owner);
            case STRUCT:
                return compileStruct(declaration, owner);
            case TABLE:
                return compileTable(declaration, owner);
            case UNION:
                return compileUnion(declaration, owner);
            case CONST:
                return compileConst(declaration, owner);
            case ALIAS:
                return compileAlias(declaration, owner);
            default:
                throw new DefinitionException("As yet unsupported declaration kind in library "
                        + owner.libraryName() + ": " + kind.irName());
        }
    }

    public StructType compileStruct(IrNode declaration, IrLibrary owner)
    {
        return new StructType(declaration.rawName(), declaration.documentation(), members(declaration, owner, false));
    }

    public TableType compileTable(IrNode declaration, IrLibrary owner)
    {
        return new TableType(declaration.rawName(), declaration.documentation(), members(declaration, owner, true));
    }

    public UnionType compileUnion(IrNode declaration, IrLibrary owner)
    {
        List<MemberSpec> variants = members(declaration, owner, true);
        boolean result = declaration.flag("is_result");
        if (result) {
            List<String> names = new ArrayList<>();
            variants.forEach(v -> names.add(v.name()));
            if (!RESULT_VARIANTS.containsAll(names) || !names.contains(UnionType.RESPONSE)) {
                throw new DefinitionException("Result union " + declaration.name() + " in library "
                        + owner.libraryName() + " must have a response variant and only "
                        + RESULT_VARIANTS + ", found " + names);
            }
        }
        return new UnionType(declaration.rawName(), declaration.documentation(), variants,
                result, declaration.flag("strict"));
    }

    public EnumType compileEnum(IrNode declaration, IrLibrary owner)
    {
        return new EnumType(declaration.rawName(), declaration.documentation(),
                underlyingType(declaration), memberValues(declaration, owner), declaration.flag("strict"));
    }

    public BitsType compileBits(IrNode declaration, IrLibrary owner)
    {
        return new BitsType(declaration.rawName(), declaration.documentation(),
                underlyingType(declaration), memberValues(declaration, owner), declaration.flag("strict"));
    }

    public ResourceType compileResource(IrNode declaration, IrLibrary owner)
    {
        return new ResourceType(declaration.rawName(), declaration.documentation());
    }

    public AliasType compileAlias(IrNode declaration, IrLibrary owner)
    {
        TypeDescriptor target;
        if (declaration.has("partial_type_ctor")) {
            target = fromPartialConstructor(declaration.get("partial_type_ctor"), owner);
        }
        else if (declaration.has("type")) {
            target = resolver.resolve(declaration.get("type"), owner);
        }
        else {
            throw new DefinitionException("Alias " + declaration.name() + " in library "
                    + owner.libraryName() + " has no target type");
        }
        return new AliasType(declaration.rawName(), declaration.documentation(), target, lookup);
    }

    public ConstDeclaration compileConst(IrNode declaration, IrLibrary owner)
    {
        IrNode typeRef = declaration.get("type");
        String literal = declaration.get("value").string("value");
        TypeDescriptor type = resolver.resolve(typeRef, owner);
        return new ConstDeclaration(declaration.rawName(), declaration.documentation(), type,
                constantValue(type, literal, owner));
    }

    private Object constantValue(TypeDescriptor type, String literal, IrLibrary owner)
    {
        if (type instanceof TypeDescriptor.Primitive) {
            return ((TypeDescriptor.Primitive) type).subtype().fromLiteral(literal);
        }
        if (type instanceof TypeDescriptor.StringType) {
            return literal;
        }
        if (type instanceof TypeDescriptor.Identifier) {
            DeclaredType target = lookup.type(((TypeDescriptor.Identifier) type).rawIdentifier());
            if (target instanceof EnumType) {
                return ((EnumType) target).valueOf(parseUnsigned(literal));
            }
            if (target instanceof BitsType) {
                return ((BitsType) target).valueOf(parseUnsigned(literal));
            }
            if (target instanceof AliasType) {
                return constantValue(((AliasType) target).target(), literal, owner);
            }
            throw new DefinitionException("As yet unsupported identifier type in library "
                    + owner.libraryName() + ": " + target.kind().irName());
        }
        throw new DefinitionException("As yet unsupported type in library "
                + owner.libraryName() + ": " + type);
    }

    private List<MemberSpec> members(IrNode declaration, IrLibrary owner, boolean ordinals)
    {
        List<MemberSpec> members = new ArrayList<>();
        for (IrNode member : declaration.list("members")) {
            // Reserved table and union slots carry no type.
            if (member.flag("reserved") || !member.has("type")) {
                continue;
            }
            members.add(new MemberSpec(
                    Identifiers.memberName(member.rawName()),
                    member.rawName(),
                    ordinals && member.has("ordinal") ? member.longValue("ordinal") : 0L,
                    resolver.resolve(member.get("type"), owner),
                    member.documentation()));
        }
        return members;
    }

    private static Map<String, Long> memberValues(IrNode declaration, IrLibrary owner)
    {
        Map<String, Long> members = new LinkedHashMap<>();
        for (IrNode member : declaration.list("members")) {
            String literal = member.get("value").string("value");
            try {
                members.put(member.rawName(), parseUnsigned(literal));
            }
            catch (NumberFormatException e) {
                throw new DefinitionException("Member " + member.rawName() + " of " + declaration.name()
                        + " in library " + owner.libraryName() + " has non-integer value " + literal, e);
            }
        }
        return members;
    }

    private static PrimitiveSubtype underlyingType(IrNode declaration)
    {
        // Enums spell the subtype directly, bits wrap it in a type reference.
        JsonNode type = declaration.get("type").json();
        String subtype = type.isTextual() ? type.asText() : declaration.get("type").string("subtype");
        PrimitiveSubtype primitive = PrimitiveSubtype.fromIrName(subtype);
        if (!primitive.isInteger()) {
            throw new DefinitionException(declaration.name() + " has non-integer underlying type " + subtype);
        }
        return primitive;
    }

    private TypeDescriptor fromPartialConstructor(IrNode ctor, IrLibrary owner)
    {
        String name = ctor.string("name");
        TypeDescriptor type;
        if (PrimitiveSubtype.find(name).isPresent()) {
            type = new TypeDescriptor.Primitive(PrimitiveSubtype.fromIrName(name), false);
        }
        else if ("string".equals(name)) {
            type = new TypeDescriptor.StringType(false);
        }
        else if ("vector".equals(name) || "array".equals(name)) {
            List<IrNode> args = ctor.list("args");
            if (args.isEmpty()) {
                throw new DefinitionException("Alias of " + name + " in library " + owner.libraryName()
                        + " does not name an element type");
            }
            type = new TypeDescriptor.Vector(fromPartialConstructor(args.get(0), owner), false);
        }
        else {
            ResolvedDeclaration resolved = resolver.resolveDeclaration(name, owner);
            type = new TypeDescriptor.Identifier(name, resolved.kind(), false);
        }
        return ctor.flag("nullable") ? type.asNullable() : type;
    }

    static long parseUnsigned(String literal)
    {
        return new BigInteger(literal.strip()).longValue();
    }
}
