package com.questrail.fidl.types;

import com.questrail.fidl.ir.DefinitionException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

final class PrimitiveSubtypeTest
{
    @Test
    void zeroValuesUseTheJavaRepresentation() {
        assertEquals(Boolean.FALSE, PrimitiveSubtype.BOOL.zeroValue());
        assertEquals(0, PrimitiveSubtype.UINT8.zeroValue());
        assertEquals(0L, PrimitiveSubtype.UINT32.zeroValue());
        assertEquals(0.0f, PrimitiveSubtype.FLOAT32.zeroValue());
        assertEquals(0.0d, PrimitiveSubtype.FLOAT64.zeroValue());
    }

    @Test
    void uint64LiteralsKeepTheirBitPattern() {
        assertEquals(-1L, PrimitiveSubtype.UINT64.fromLiteral("18446744073709551615"));
        assertEquals(42, PrimitiveSubtype.INT32.fromLiteral(" 42 "));
        assertEquals(true, PrimitiveSubtype.BOOL.fromLiteral("true"));
    }

    @Test
    void coercionRejectsIncompatibleValues() {
        assertEquals(7L, PrimitiveSubtype.INT64.coerce(7));
        assertThrows(IllegalArgumentException.class, () -> PrimitiveSubtype.INT32.coerce("7"));
        assertThrows(IllegalArgumentException.class, () -> PrimitiveSubtype.BOOL.coerce(1));
    }

    @Test
    void integerSubtypesEnforceTheirRange() {
        assertEquals(127, PrimitiveSubtype.INT8.coerce(127));
        assertThrows(IllegalArgumentException.class, () -> PrimitiveSubtype.INT8.coerce(128));
        assertThrows(IllegalArgumentException.class, () -> PrimitiveSubtype.INT16.coerce(-32769));
        assertThrows(IllegalArgumentException.class, () -> PrimitiveSubtype.INT32.coerce(5_000_000_000L));
        assertThrows(IllegalArgumentException.class,
                () -> PrimitiveSubtype.INT64.coerce(BigInteger.ONE.shiftLeft(63)));

        assertThrows(IllegalArgumentException.class, () -> PrimitiveSubtype.UINT8.coerce(-1));
        assertEquals(255, PrimitiveSubtype.UINT8.coerce(255));
        assertThrows(IllegalArgumentException.class, () -> PrimitiveSubtype.UINT8.coerce(256));
        assertEquals(4294967295L, PrimitiveSubtype.UINT32.coerce(4294967295L));
        assertThrows(IllegalArgumentException.class, () -> PrimitiveSubtype.UINT32.coerce(4294967296L));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> PrimitiveSubtype.UINT16.coerce(70000));
        assertEquals("Integer 70000 is out of range for uint16 [0, 65535]", e.getMessage());
    }

    @Test
    void uint64AcceptsItsFullRangeAndLongBitPatterns() {
        BigInteger max = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

        assertEquals(-1L, PrimitiveSubtype.UINT64.coerce(max));
        assertEquals(-1L, PrimitiveSubtype.UINT64.coerce(-1L));
        assertThrows(IllegalArgumentException.class, () -> PrimitiveSubtype.UINT64.coerce(-1));
        assertThrows(IllegalArgumentException.class, () -> PrimitiveSubtype.UINT64.coerce(max.add(BigInteger.ONE)));
    }

    @Test
    void integerSubtypesRejectFractions() {
        assertEquals(3, PrimitiveSubtype.INT32.coerce(3.0d));
        assertEquals(3L, PrimitiveSubtype.INT64.coerce(new BigDecimal("3.00")));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> PrimitiveSubtype.INT32.coerce(2.9d));
        assertEquals("Expected integral int32, got Double 2.9", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> PrimitiveSubtype.INT64.coerce(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> PrimitiveSubtype.UINT8.coerce(Double.POSITIVE_INFINITY));
    }

    @Test
    void float32RejectsValuesBeyondItsRange() {
        assertEquals(1.5f, PrimitiveSubtype.FLOAT32.coerce(1.5d));
        assertEquals(Float.POSITIVE_INFINITY, PrimitiveSubtype.FLOAT32.coerce(Double.POSITIVE_INFINITY));
        assertThrows(IllegalArgumentException.class, () -> PrimitiveSubtype.FLOAT32.coerce(1e39d));
        assertEquals(1e39d, PrimitiveSubtype.FLOAT64.coerce(1e39d));
    }

    @Test
    void unknownSubtypeIsADefinitionError() {
        assertThrows(DefinitionException.class, () -> PrimitiveSubtype.fromIrName("int128"));
        assertTrue(PrimitiveSubtype.find("float64").isPresent());
    }
}
