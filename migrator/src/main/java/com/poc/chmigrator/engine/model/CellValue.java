package com.poc.chmigrator.engine.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Objects;

/**
 * A destination-typed value. The kind tags the payload so writers can bind it
 * exhaustively instead of inspecting arbitrary objects.
 */
public final class CellValue {

    public enum Kind {
        NULL, INTEGER, FLOAT, DECIMAL, STRING, BYTES, DATE, DATE_TIME
    }

    private static final CellValue NULL = new CellValue(Kind.NULL, null);

    private final Kind kind;
    private final Object value;

    private CellValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static CellValue ofNull() {
        return NULL;
    }

    public static CellValue ofInteger(long value) {
        return new CellValue(Kind.INTEGER, value);
    }

    /**
     * Integers past {@code Long.MAX_VALUE} only occur for UInt64 columns.
     */
    public static CellValue ofInteger(BigInteger value) {
        if (value.bitLength() < 64) {
            return ofInteger(value.longValue());
        }
        return new CellValue(Kind.INTEGER, value);
    }

    public static CellValue ofFloat(float value) {
        return new CellValue(Kind.FLOAT, value);
    }

    public static CellValue ofDouble(double value) {
        return new CellValue(Kind.FLOAT, value);
    }

    public static CellValue ofDecimal(BigDecimal value) {
        return new CellValue(Kind.DECIMAL, Objects.requireNonNull(value));
    }

    public static CellValue ofString(String value) {
        return new CellValue(Kind.STRING, Objects.requireNonNull(value));
    }

    public static CellValue ofBytes(byte[] value) {
        return new CellValue(Kind.BYTES, value.clone());
    }

    public static CellValue ofDate(LocalDate value) {
        return new CellValue(Kind.DATE, Objects.requireNonNull(value));
    }

    public static CellValue ofDateTime(LocalDateTime value) {
        return new CellValue(Kind.DATE_TIME, Objects.requireNonNull(value));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    /**
     * The payload: {@code Long} or {@code BigInteger}, {@code Float} or {@code Double},
     * {@code BigDecimal}, {@code String}, {@code byte[]}, {@code LocalDate},
     * {@code LocalDateTime}, or {@code null}.
     */
    public Object getValue() {
        return kind == Kind.BYTES ? ((byte[]) value).clone() : value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue)) {
            return false;
        }
        CellValue other = (CellValue) o;
        return kind == other.kind && Objects.deepEquals(value, other.value);
    }

    @Override
    public int hashCode() {
        int payloadHash = kind == Kind.BYTES ? Arrays.hashCode((byte[]) value) : Objects.hashCode(value);
        return 31 * kind.hashCode() + payloadHash;
    }

    @Override
    public String toString() {
        if (kind == Kind.BYTES) {
            return "CellValue(BYTES, " + ((byte[]) value).length + " bytes)";
        }
        return "CellValue(" + kind + ", " + value + ")";
    }
}
