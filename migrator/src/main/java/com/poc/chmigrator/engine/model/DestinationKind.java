package com.poc.chmigrator.engine.model;

import java.math.BigInteger;

/**
 * ClickHouse column types the migrator writes, each doubling as the coercion rule
 * applied to source values of a mapped column.
 */
public enum DestinationKind {
    INT8("Int8", -128L, 127L),
    INT16("Int16", -32_768L, 32_767L),
    INT32("Int32", Integer.MIN_VALUE, Integer.MAX_VALUE),
    INT64("Int64", Long.MIN_VALUE, Long.MAX_VALUE),
    UINT8("UInt8", 0L, 255L),
    UINT16("UInt16", 0L, 65_535L),
    UINT32("UInt32", 0L, 4_294_967_295L),
    UINT64("UInt64", BigInteger.ZERO, BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE)),
    FLOAT32("Float32"),
    FLOAT64("Float64"),
    DECIMAL("Decimal"),
    STRING("String"),
    BYTES("String"),
    DATE("Date"),
    DATE_TIME("DateTime");

    private final String clickHouseName;
    private final BigInteger min;
    private final BigInteger max;

    DestinationKind(String clickHouseName) {
        this(clickHouseName, null, null);
    }

    DestinationKind(String clickHouseName, long min, long max) {
        this(clickHouseName, BigInteger.valueOf(min), BigInteger.valueOf(max));
    }

    DestinationKind(String clickHouseName, BigInteger min, BigInteger max) {
        this.clickHouseName = clickHouseName;
        this.min = min;
        this.max = max;
    }

    public String getClickHouseName() {
        return clickHouseName;
    }

    public boolean isInteger() {
        return min != null;
    }

    public boolean inRange(BigInteger value) {
        return isInteger() && value.compareTo(min) >= 0 && value.compareTo(max) <= 0;
    }

    /**
     * Unsigned counterpart of a signed integer kind; other kinds are returned unchanged.
     */
    public DestinationKind unsigned() {
        switch (this) {
            case INT8:
                return UINT8;
            case INT16:
                return UINT16;
            case INT32:
                return UINT32;
            case INT64:
                return UINT64;
            default:
                return this;
        }
    }
}
