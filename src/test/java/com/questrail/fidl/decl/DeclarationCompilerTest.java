package com.questrail.fidl.decl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.fidl.codec.EncodedMessage;
import com.questrail.fidl.codec.JsonTestCodec;
import com.questrail.fidl.ir.DeclarationKind;
import com.questrail.fidl.ir.DefinitionException;
import com.questrail.fidl.ir.IrFixtures;
import com.questrail.fidl.ir.IrNode;
import com.questrail.fidl.ir.IrRegistry;
import com.questrail.fidl.library.LibraryNamespace;
import com.questrail.fidl.library.LibraryRegistry;
import com.questrail.fidl.types.TypeDescriptor;
import com.questrail.fidl.types.TypeResolver;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class DeclarationCompilerTest
{
    private IrRegistry irRegistry;
    private LibraryRegistry libraries;
    private LibraryNamespace types;

    @BeforeEach
    void setUp() {
        irRegistry = IrFixtures.registry();
        libraries = new LibraryRegistry(irRegistry);
        types = libraries.namespace("test.types");
    }

    private Map<String, Object> holderFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", 5L);
        fields.put("label", "five");
        fields.put("max_size", 512);
        fields.put("class_", true);
        fields.put("color", types.enumType("Color").member("RED"));
        fields.put("perms", types.bits("Perms").of("READ"));
        fields.put("tags", List.of("a", "b"));
        fields.put("corners", List.of(1, 2, 3, 4));
        fields.put("options", null);
        fields.put("shape", null);
        fields.put("peer", null);
        fields.put("vmo", null);
        return fields;
    }

    // ---------------------------------------------------------------------
    // Structs and tables
    // ---------------------------------------------------------------------

    @Test
    void structMembersAreSnakeCaseAndAvoidKeywords() {
        StructType holder = types.struct("Holder");

        assertTrue(holder.member("max_size").isPresent());
        assertTrue(holder.member("class_").isPresent());
        assertEquals("MaxSize", holder.member("max_size").orElseThrow().rawName());
        assertEquals(12, holder.members().size());
    }

    @Test
    void structRequiresEveryMember() {
        StructType holder = types.struct("Holder");
        Map<String, Object> fields = holderFields();
        fields.remove("label");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> holder.create(fields));
        assertEquals("Missing member 'label' for struct test.types/Holder", e.getMessage());
    }

    @Test
    void structRejectsUnknownMembers() {
        StructType holder = types.struct("Holder");
        Map<String, Object> fields = holderFields();
        fields.put("bogus", 1);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> holder.create(fields));
        assertTrue(e.getMessage().contains("bogus"));
    }

    @Test
    void structValuesExposeMembers() {
        RecordValue value = types.struct("Holder").create(holderFields());

        assertEquals(5L, value.get("id"));
        assertEquals("five", value.get("label"));
        assertEquals(types.enumType("Color").member("RED"), value.get("color"));
        assertFalse(value.has("options"));
        assertThrows(IllegalArgumentException.class, () -> value.get("nope"));

        RecordValue renamed = value.with("label", "six");
        assertEquals("six", renamed.get("label"));
        assertEquals("five", value.get("label"));
        assertNotEquals(value, renamed);
    }

    @Test
    void memberOfWrongDeclaredTypeIsRejected() {
        StructType holder = types.struct("Holder");
        Map<String, Object> fields = holderFields();
        fields.put("color", types.bits("Perms").of("WRITE"));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> holder.create(fields));
        assertTrue(e.getMessage().contains("test.types/Color"), e.getMessage());
    }

    @Test
    void integerMembersMustBeIntegralAndInRange() {
        StructType point = libraries.namespace("x").struct("Point");

        IllegalArgumentException tooWide = assertThrows(IllegalArgumentException.class,
                () -> point.create(Map.of("x", 5_000_000_000L, "y", 2)));
        assertTrue(tooWide.getMessage().startsWith("x/Point.x: "), tooWide.getMessage());

        IllegalArgumentException fraction = assertThrows(IllegalArgumentException.class,
                () -> point.create(Map.of("x", 1, "y", 2.9d)));
        assertTrue(fraction.getMessage().startsWith("x/Point.y: "), fraction.getMessage());

        RecordValue value = point.create(Map.of("x", 3.0d, "y", -7L));
        assertEquals(3, value.get("x"));
        assertEquals(-7, value.get("y"));
    }

    @Test
    void unsignedMembersRejectNegativeValues() {
        StructType holder = types.struct("Holder");
        Map<String, Object> fields = holderFields();
        fields.put("max_size", -1);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> holder.create(fields));
        assertTrue(e.getMessage().startsWith("test.types/Holder.max_size: "), e.getMessage());
        assertThrows(IllegalArgumentException.class,
                () -> holder.create(holderFields()).with("max_size", 65536));
    }

    @Test
    void sequenceElementsAreChecked() {
        StructType holder = types.struct("Holder");

        Map<String, Object> badCorner = holderFields();
        badCorner.put("corners", List.of("x", 2, 3, 4));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> holder.create(badCorner));
        assertTrue(e.getMessage().startsWith("test.types/Holder.corners[0]: "), e.getMessage());

        Map<String, Object> wideCorner = holderFields();
        wideCorner.put("corners", List.of(1, 2, 3, 128));
        assertThrows(IllegalArgumentException.class, () -> holder.create(wideCorner));

        Map<String, Object> badTags = holderFields();
        badTags.put("tags", List.of(1, 2));
        e = assertThrows(IllegalArgumentException.class, () -> holder.create(badTags));
        assertTrue(e.getMessage().startsWith("test.types/Holder.tags[0]: "), e.getMessage());

        List<Object> nullTag = new ArrayList<>();
        nullTag.add(null);
        Map<String, Object> withNullTag = holderFields();
        withNullTag.put("tags", nullTag);
        assertThrows(IllegalArgumentException.class, () -> holder.create(withNullTag));

        Map<String, Object> notAList = holderFields();
        notAList.put("tags", "a");
        assertThrows(IllegalArgumentException.class, () -> holder.create(notAList));
    }

    @Test
    void arraysMustHaveTheirDeclaredCount() {
        StructType holder = types.struct("Holder");
        Map<String, Object> fields = holderFields();
        fields.put("corners", List.of(1, 2, 3));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> holder.create(fields));
        assertEquals("test.types/Holder.corners: expected 4 elements, got 3", e.getMessage());
    }

    @Test
    void storedListsDoNotTrackTheCallersList() {
        List<Object> tags = new ArrayList<>(List.of("a", "b"));
        Map<String, Object> fields = holderFields();
        fields.put("tags", tags);
        RecordValue value = types.struct("Holder").create(fields);

        tags.add("c");

        assertEquals(List.of("a", "b"), value.get("tags"));
        assertThrows(UnsupportedOperationException.class, () -> ((List<Object>) value.get("tags")).add("d"));
    }

    @Test
    void nonNullableStructMembersRejectNull() {
        StructType holder = types.struct("Holder");
        Map<String, Object> fields = holderFields();
        fields.put("tags", null);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> holder.create(fields));
        assertTrue(e.getMessage().startsWith("test.types/Holder.tags: null"), e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> holder.create(holderFields()).with("id", null));
        assertNull(holder.create(holderFields()).with("label", null).get("label"));
    }

    @Test
    void tableMembersMayBeSetToNull() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("name", null);

        assertFalse(types.table("Options").create(fields).has("name"));
    }

    @Test
    void structDefaultHasEveryMemberPresent() {
        StructType holder = types.struct("Holder");
        RecordValue defaults = holder.makeDefault();

        assertEquals(holder.members().size(), defaults.fields().size());
        for (MemberSpec member : holder.members()) {
            assertTrue(defaults.fields().containsKey(member.name()), member.name());
        }
        assertEquals(0L, defaults.get("id"));
        assertEquals(0, defaults.get("max_size"));
        assertEquals(false, defaults.get("class_"));
        assertNull(defaults.get("label"));
    }

    @Test
    void tableDefaultHasEveryMemberAbsent() {
        TableType options = types.table("Options");
        RecordValue defaults = options.makeDefault();

        assertEquals(List.of("verbose", "name"), List.copyOf(defaults.fields().keySet()));
        defaults.fields().values().forEach(Assertions::assertNull);
        assertEquals(3L, options.member("name").orElseThrow().ordinal());
    }

    @Test
    void tableMembersMayBeOmitted() {
        RecordValue options = types.table("Options").create(Map.of("name", "quiet"));

        assertEquals("quiet", options.get("name"));
        assertFalse(options.has("verbose"));
    }

    @Test
    void encodeHookUsesTheRawQualifiedName() {
        JsonTestCodec codec = new JsonTestCodec();
        TableType options = types.table("Options");

        EncodedMessage encoded = options.encode(options.create(Map.of("verbose", true)), codec);

        assertTrue(encoded.bytes().length > 0);
        JsonTestCodec.Encoded call = codec.encoded().get(0);
        assertEquals("test.types", call.library());
        assertEquals("test.types/Options", call.typeName());
    }

    // ---------------------------------------------------------------------
    // Unions
    // ---------------------------------------------------------------------

    @Test
    void unionHoldsExactlyOneVariant() {
        UnionType shape = types.union("Shape");

        UnionValue circle = shape.create(Map.of("circle", 2.5));
        assertEquals(Optional.of("circle"), circle.variant());
        assertEquals(2.5, circle.get("circle"));
        assertNull(circle.get("square"));

        Map<String, Object> both = new HashMap<>();
        both.put("circle", 1.0);
        both.put("square", 2);
        UnionConstructionException e = assertThrows(UnionConstructionException.class, () -> shape.create(both));
        assertTrue(e.getMessage().contains("test.types/Shape"));
    }

    @Test
    void unionWithoutArgumentsIsEmpty() {
        UnionType shape = types.union("Shape");

        assertTrue(shape.create(Map.of()).isEmpty());
        assertSame(shape.empty(), shape.makeDefault());
        assertEquals("Shape(None)", shape.empty().toString());
    }

    @Test
    void unionRejectsUnknownAndNullVariants() {
        UnionType shape = types.union("Shape");

        assertThrows(UnionConstructionException.class, () -> shape.variant("triangle", 3));
        assertThrows(UnionConstructionException.class, () -> shape.variant("circle", null));
    }

    @Test
    void resultUnionUnwrapsResponse() {
        UnionType result = types.union("LookupResult");
        RecordValue holder = types.struct("Holder").create(holderFields());

        assertTrue(result.isResult());
        assertSame(holder, result.variant("response", holder).unwrap());
    }

    @Test
    void resultUnionErrorNamesTypeAndPayload() {
        UnionType result = types.union("LookupResult");

        ResultErrorException e = assertThrows(ResultErrorException.class,
                () -> result.variant("err", 7).unwrap());

        assertEquals("test.types/Lookup_Result error 7", e.getMessage());
        assertEquals(7L, e.error());
        assertFalse(e.isFrameworkError());
    }

    @Test
    void resultUnionFrameworkErrorIsReportedFirst() {
        UnionType result = types.union("LookupResult");

        ResultErrorException e = assertThrows(ResultErrorException.class,
                () -> result.variant("framework_err", -2).unwrap());

        assertTrue(e.isFrameworkError());
        assertEquals("test.types/Lookup_Result framework error -2", e.getMessage());
    }

    @Test
    void emptyResultUnionHasNoErrorOrResponse() {
        UnionType result = types.union("LookupResult");

        EmptyResultException e = assertThrows(EmptyResultException.class, () -> result.empty().unwrap());
        assertEquals("Failed to unwrap test.types/Lookup_Result with no error or response.", e.getMessage());
    }

    @Test
    void ordinaryUnionCannotBeUnwrapped() {
        UnionType shape = types.union("Shape");

        assertThrows(IllegalStateException.class, () -> shape.variant("square", 4).unwrap());
    }

    @Test
    void resultUnionWithForeignVariantIsRejected() throws Exception {
        DeclarationCompiler compiler = new DeclarationCompiler(new TypeResolver(irRegistry), libraries);
        IrNode bad = new IrNode(null, new ObjectMapper().readTree(
                "{\"name\": \"test.types/Bad_Result\", \"is_result\": true, \"strict\": true, \"members\": ["
                        + "{\"ordinal\": 1, \"name\": \"response\", \"type\": {\"kind_v2\": \"string\", \"nullable\": false}},"
                        + "{\"ordinal\": 2, \"name\": \"oops\", \"type\": {\"kind_v2\": \"string\", \"nullable\": false}}]}"));

        DefinitionException e = assertThrows(DefinitionException.class,
                () -> compiler.compileUnion(bad, irRegistry.load("test.types")));
        assertTrue(e.getMessage().contains("oops"), e.getMessage());
    }

    @Test
    void protocolsAreNotDeclarationCompilerInput() {
        DeclarationCompiler compiler = new DeclarationCompiler(new TypeResolver(irRegistry), libraries);
        IrNode echo = irRegistry.load("x").declaration(DeclarationKind.PROTOCOL, "x/Echo").orElseThrow();

        assertThrows(DefinitionException.class,
                () -> compiler.compile(DeclarationKind.PROTOCOL, echo, irRegistry.load("x")));
    }

    // ---------------------------------------------------------------------
    // Enums and bits
    // ---------------------------------------------------------------------

    @Test
    void enumWithoutZeroMemberGetsSyntheticOne() {
        EnumType color = types.enumType("Color");

        assertEquals(Map.of("RED", 1L, "GREEN", 2L, EnumType.EMPTY_MEMBER, 0L), color.members());
        assertEquals(EnumType.EMPTY_MEMBER, color.makeDefault().name());
        assertEquals(Optional.of("Primary colors."), color.documentation());
    }

    @Test
    void enumWithZeroMemberKeepsItsOwn() {
        EnumType mode = types.enumType("Mode");

        assertFalse(mode.members().containsKey(EnumType.EMPTY_MEMBER));
        assertEquals("OFF", mode.makeDefault().name());
    }

    @Test
    void strictEnumRejectsUnknownValues() {
        assertThrows(IllegalArgumentException.class, () -> types.enumType("Color").valueOf(9));
        assertSame(types.enumType("Color").member("GREEN"), types.enumType("Color").valueOf(2));
    }

    @Test
    void flexibleEnumKeepsUnknownValues() {
        EnumValue unknown = types.enumType("Mode").valueOf(9);

        assertTrue(unknown.isUnknown());
        assertEquals(9L, unknown.value());
    }

    @Test
    void bitsCombineFlags() {
        BitsType perms = types.bits("Perms");
        BitsValue both = perms.of("READ").or(perms.of("WRITE"));

        assertEquals(3L, both.bits());
        assertTrue(both.has("WRITE"));
        assertEquals(List.of("READ", "WRITE"), both.names());
        assertEquals(0L, perms.makeDefault().bits());
    }

    @Test
    void strictBitsRejectUnknownBits() {
        assertThrows(IllegalArgumentException.class, () -> types.bits("Perms").valueOf(4));
        assertEquals(2L, types.bits("Features").valueOf(3).unknownBits());
    }

    @Test
    void bitsWithoutMembersGetSyntheticZero() {
        assertEquals(Map.of(EnumType.EMPTY_MEMBER, 0L), types.bits("Nothing").members());
    }

    // ---------------------------------------------------------------------
    // Constants, aliases, resources
    // ---------------------------------------------------------------------

    @Test
    void constantsAreConverted() {
        assertEquals(42, types.constant("MAX").value());
        assertEquals("hello", types.constant("GREETING").value());
        assertSame(types.enumType("Color").member("GREEN"), types.constant("DEFAULT_COLOR").value());
        assertEquals(types.bits("Perms").of("READ", "WRITE"), types.constant("ALL_PERMS").value());
    }

    @Test
    void aliasOfEnumExposesItsMembers() {
        AliasType alias = types.alias("ColorAlias");

        assertEquals(types.enumType("Color").members(), alias.members());
        assertSame(types.enumType("Color"), alias.aliasedDeclaration().orElseThrow());
        assertEquals("test.types/ColorAlias", alias.qualifiedName());
    }

    @Test
    void aliasDefaultsFollowTheTarget() {
        assertEquals(0L, types.alias("Count").makeDefault());
        assertEquals(List.of(), types.alias("Names").makeDefault());
        assertNull(types.alias("MaybeName").makeDefault());
        assertEquals(new TypeDescriptor.Vector(new TypeDescriptor.StringType(false), false),
                types.alias("Names").target());
        assertTrue(types.alias("Count").members().isEmpty());
    }

    @Test
    void resourceDefaultsToZero() {
        CompiledDeclaration handle = types.get("Handle");

        assertEquals(DeclarationKind.EXPERIMENTAL_RESOURCE, handle.kind());
        assertEquals(0L, ((DeclaredType) handle).makeDefault());
    }
}
