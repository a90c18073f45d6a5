package com.questrail.fidl.types;

import com.questrail.fidl.ir.DefinitionException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Optional;

/**
 * FIDL primitive subtypes and their Java value representation.
 *
 * <ul>
 *   <li>{@code int8/int16/int32/uint8/uint16} map to {@link Integer}</li>
 *   <li>{@code int64/uint32} map to {@link Long}</li>
 *   <li>{@code uint64} maps to {@link Long} holding the unsigned bit pattern</li>
 *   <li>{@code float32} maps to {@link Float}, {@code float64} to {@link Double}</li>
 * </ul>
 *
 * <p>Integer subtypes accept any integral {@link Number} within their range.
 * A {@link Long} given for {@code uint64} is taken as the bit pattern, so
 * values read back from a {@code uint64} member can be supplied again
 * unchanged.</p>
 */
public enum PrimitiveSubtype
{
    BOOL("bool", Boolean.class, null, null),
    INT8("int8", Integer.class, -128L, 127L),
    INT16("int16", Integer.class, -32768L, 32767L),
    INT32("int32", Integer.class, (long) Integer.MIN_VALUE, (long) Integer.MAX_VALUE),
    INT64("int64", Long.class, Long.MIN_VALUE, Long.MAX_VALUE),
    UINT8("uint8", Integer.class, 0L, 255L),
    UINT16("uint16", Integer.class, 0L, 65535L),
    UINT32("uint32", Long.class, 0L, 0xFFFF_FFFFL),
    UINT64("uint64", Long.class, 0L, null),
    FLOAT32("float32", Float.class, null, null),
    FLOAT64("float64", Double.class, null, null);

    private static final BigInteger UINT64_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private final String irName;
    private final Class<?> javaType;
    private final BigInteger min;
    private final BigInteger max;

    PrimitiveSubtype(String irName, Class<?> javaType, Long min, Long max) {
        this.irName = irName;
        this.javaType = javaType;
        this.min = min == null ? null : BigInteger.valueOf(min);
        this.max = max == null ? null : BigInteger.valueOf(max);
    }

    public String irName() {
        return irName;
    }

    public Class<?> javaType() {
        return javaType;
    }

    public boolean isInteger() {
        return javaType == Integer.class || javaType == Long.class;
    }

    public static Optional<PrimitiveSubtype> find(String irName) {
        return Arrays.stream(values()).filter(p -> p.irName.equals(irName)).findFirst();
    }

    /**
     * @throws DefinitionException for a subtype this compiler does not know
     */
    public static PrimitiveSubtype fromIrName(String irName) {
        return find(irName).orElseThrow(() -> new DefinitionException("Unsupported primitive subtype: " + irName));
    }

    /**
     * Zero value of this subtype.
     */
    public Object zeroValue() {
        if (this == BOOL) {
            return Boolean.FALSE;
        }
        return coerce(0);
    }

    /**
     * Converts a literal from the IR (constants, enum and bits members) into
     * this subtype's Java representation.
     */
    public Object fromLiteral(String literal) {
        String text = literal.strip();
        switch (this) {
            case BOOL:
                return Boolean.parseBoolean(text);
            case FLOAT32:
                return Float.parseFloat(text);
            case FLOAT64:
                return Double.parseDouble(text);
            default:
                return coerce(new BigInteger(text));
        }
    }

    /**
     * Converts a decoded or user-supplied value into this subtype's Java
     * representation.
     *
     * @throws IllegalArgumentException if the value is not of a compatible
     *         kind, is not integral for an integer subtype, or is out of range
     */
    public Object coerce(Object value) {
        if (this == BOOL) {
            if (value instanceof Boolean) {
                return value;
            }
            throw new IllegalArgumentException("Expected bool, got " + describe(value));
        }
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException("Expected " + irName + ", got " + describe(value));
        }
        Number number = (Number) value;
        if (this == FLOAT64) {
            return number.doubleValue();
        }
        if (this == FLOAT32) {
            double d = number.doubleValue();
            if (Double.isFinite(d) && Math.abs(d) > Float.MAX_VALUE) {
                throw new IllegalArgumentException(describe(value) + " is out of range for float32");
            }
            return (float) d;
        }
        if (this == UINT64 && value instanceof Long) {
            return value;
        }

        BigInteger integral = integral(number);
        BigInteger upper = this == UINT64 ? UINT64_MAX : max;
        if (integral.compareTo(min) < 0 || integral.compareTo(upper) > 0) {
            throw new IllegalArgumentException(describe(value) + " is out of range for " + irName
                    + " [" + min + ", " + upper + "]");
        }
        if (javaType == Integer.class) {
            return integral.intValue();
        }
        return integral.longValue();
    }

    private BigInteger integral(Number number) {
        if (number instanceof Integer || number instanceof Long
                || number instanceof Short || number instanceof Byte) {
            return BigInteger.valueOf(number.longValue());
        }
        if (number instanceof BigInteger) {
            return (BigInteger) number;
        }
        BigDecimal decimal;
        if (number instanceof BigDecimal) {
            decimal = (BigDecimal) number;
        }
        else {
            double d = number.doubleValue();
            if (!Double.isFinite(d)) {
                throw new IllegalArgumentException("Expected " + irName + ", got " + describe(number));
            }
            decimal = new BigDecimal(d);
        }
        try {
            return decimal.toBigIntegerExact();
        }
        catch (ArithmeticException e) {
            throw new IllegalArgumentException("Expected integral " + irName + ", got " + describe(number), e);
        }
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " " + value;
    }
}
