package com.questrail.fidl.codec;

import com.questrail.fidl.decl.BitsValue;
import com.questrail.fidl.decl.EnumValue;
import com.questrail.fidl.decl.RecordValue;
import com.questrail.fidl.decl.UnionValue;
import com.questrail.fidl.ir.IrFixtures;
import com.questrail.fidl.library.LibraryNamespace;
import com.questrail.fidl.library.LibraryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class ValueConstructorTest
{
    private LibraryNamespace types;
    private ValueConstructor values;

    @BeforeEach
    void setUp() {
        LibraryRegistry libraries = new LibraryRegistry(IrFixtures.registry());
        types = libraries.namespace("test.types");
        values = new ValueConstructor(libraries);
    }

    private Map<String, Object> decodedHolder() {
        Map<String, Object> decoded = new HashMap<>();
        decoded.put("id", 9);
        decoded.put("label", null);
        decoded.put("MaxSize", 16);
        decoded.put("class", false);
        decoded.put("color", 2);
        decoded.put("perms", 3);
        decoded.put("tags", List.of("t"));
        decoded.put("corners", List.of(1, 2, 3, 4));
        decoded.put("options", Map.of("verbose", true));
        decoded.put("shape", Map.of("square", 4));
        decoded.put("peer", null);
        decoded.put("vmo", null);
        return decoded;
    }

    @Test
    void buildsTypedValuesFromDecodedForm() {
        RecordValue holder = (RecordValue) values.construct("test.types/Holder", decodedHolder());

        assertEquals(9L, holder.get("id"));
        assertEquals(16, holder.get("max_size"));
        assertSame(types.enumType("Color").member("GREEN"), holder.get("color"));
        assertEquals(3L, ((BitsValue) holder.get("perms")).bits());
        assertEquals(List.of(1, 2, 3, 4), holder.get("corners"));
        assertEquals(true, ((RecordValue) holder.get("options")).get("verbose"));
        assertEquals(Optional.of("square"), ((UnionValue) holder.get("shape")).variant());
    }

    @Test
    void nullDecodesToNull() {
        assertNull(values.construct("test.types/Holder", null));
    }

    @Test
    void typedValuesPassThrough() {
        EnumValue red = types.enumType("Color").member("RED");

        assertSame(red, values.construct("test.types/Color", red));
    }

    @Test
    void unionWithOnlyNullEntriesIsEmpty() {
        Map<String, Object> decoded = new HashMap<>();
        decoded.put("circle", null);

        assertTrue(((UnionValue) values.construct("test.types/Shape", decoded)).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> values.construct("test.types/Shape", Map.of("hexagon", 6)));
    }

    @Test
    void aliasConstructsItsTarget() {
        assertSame(types.enumType("Color").member("RED"), values.construct("test.types/ColorAlias", 1));
    }

    @Test
    void wrongShapeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> values.construct("test.types/Holder", List.of()));
        assertThrows(IllegalArgumentException.class, () -> values.construct("test.types/Color", "RED"));
    }

    @Test
    void plainFormRoundTripsThroughTheConstructor() {
        RecordValue holder = (RecordValue) values.construct("test.types/Holder", decodedHolder());

        Object plain = ValueConstructor.toPlain(holder);

        assertTrue(plain instanceof Map);
        Map<?, ?> map = (Map<?, ?>) plain;
        assertTrue(map.containsKey("label"));
        assertEquals(2L, map.get("color"));
        assertEquals(Map.of("square", 4), map.get("shape"));
        assertEquals(holder, values.construct("test.types/Holder", plain));
    }

    @Test
    void emptyUnionReducesToEmptyMap() {
        assertEquals(new LinkedHashMap<>(), ValueConstructor.toPlain(types.union("Shape").empty()));
    }
}
