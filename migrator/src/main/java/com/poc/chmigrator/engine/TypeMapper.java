package com.poc.chmigrator.engine;

import com.poc.chmigrator.engine.model.CellValue;
import com.poc.chmigrator.engine.model.ColumnDef;
import com.poc.chmigrator.engine.model.DestinationKind;
import com.poc.chmigrator.engine.model.SourceColumn;
import com.poc.chmigrator.exception.CoercionException;
import com.poc.chmigrator.exception.UnsupportedTypeException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Map;

/**
 * Maps MySQL column definitions to ClickHouse ones and coerces source values into
 * destination values. Stateless apart from the configured source character set.
 */
public class TypeMapper {

    /**
     * MySQL decimal without an explicit precision is {@code decimal(10,0)}.
     */
    private static final int DEFAULT_DECIMAL_PRECISION = 10;

    private static final LocalDate MIN_DATE = LocalDate.of(1970, 1, 1);
    private static final LocalDate MAX_DATE = LocalDate.of(2149, 6, 6);
    private static final LocalDateTime MIN_DATE_TIME = LocalDateTime.of(1970, 1, 1, 0, 0, 0);
    private static final LocalDateTime MAX_DATE_TIME = LocalDateTime.of(2106, 2, 7, 6, 28, 15);

    private static final Map<String, DestinationKind> TYPE_MAPPING = Map.ofEntries(
        Map.entry("tinyint", DestinationKind.INT8),
        Map.entry("smallint", DestinationKind.INT16),
        Map.entry("mediumint", DestinationKind.INT32),
        Map.entry("int", DestinationKind.INT32),
        Map.entry("integer", DestinationKind.INT32),
        Map.entry("bigint", DestinationKind.INT64),
        Map.entry("year", DestinationKind.INT16),
        Map.entry("bool", DestinationKind.UINT8),
        Map.entry("boolean", DestinationKind.UINT8),
        Map.entry("bit", DestinationKind.UINT64),
        Map.entry("float", DestinationKind.FLOAT32),
        Map.entry("double", DestinationKind.FLOAT64),
        Map.entry("real", DestinationKind.FLOAT64),
        Map.entry("decimal", DestinationKind.DECIMAL),
        Map.entry("numeric", DestinationKind.DECIMAL),
        Map.entry("char", DestinationKind.STRING),
        Map.entry("varchar", DestinationKind.STRING),
        Map.entry("tinytext", DestinationKind.STRING),
        Map.entry("text", DestinationKind.STRING),
        Map.entry("mediumtext", DestinationKind.STRING),
        Map.entry("longtext", DestinationKind.STRING),
        Map.entry("json", DestinationKind.STRING),
        Map.entry("enum", DestinationKind.STRING),
        Map.entry("set", DestinationKind.STRING),
        Map.entry("time", DestinationKind.STRING),
        Map.entry("binary", DestinationKind.BYTES),
        Map.entry("varbinary", DestinationKind.BYTES),
        Map.entry("tinyblob", DestinationKind.BYTES),
        Map.entry("blob", DestinationKind.BYTES),
        Map.entry("mediumblob", DestinationKind.BYTES),
        Map.entry("longblob", DestinationKind.BYTES),
        Map.entry("date", DestinationKind.DATE),
        Map.entry("datetime", DestinationKind.DATE_TIME),
        Map.entry("timestamp", DestinationKind.DATE_TIME)
    );

    private final Charset sourceCharset;

    public TypeMapper(Charset sourceCharset) {
        this.sourceCharset = sourceCharset;
    }

    /**
     * Maps one source column. Fails for types outside the mapping table rather than
     * defaulting them.
     */
    public ColumnDef mapColumn(SourceColumn column) {
        String fullType = column.getColumnType().trim().toLowerCase(Locale.ROOT);
        String baseType = baseType(fullType);
        DestinationKind kind = TYPE_MAPPING.get(baseType);
        if (kind == null) {
            throw new UnsupportedTypeException(column.getName(), column.getColumnType());
        }

        if (fullType.contains("unsigned")) {
            kind = kind.unsigned();
        }
        if ("bit".equals(baseType) && "1".equals(typeArguments(fullType))) {
            kind = DestinationKind.UINT8;
        }

        int precision = 0;
        int scale = 0;
        String destinationType = kind.getClickHouseName();
        if (kind == DestinationKind.DECIMAL) {
            String args = typeArguments(fullType);
            precision = DEFAULT_DECIMAL_PRECISION;
            if (args != null) {
                String[] parts = args.split(",");
                precision = Integer.parseInt(parts[0].trim());
                scale = parts.length > 1 ? Integer.parseInt(parts[1].trim()) : 0;
            }
            destinationType = String.format("Decimal(%d, %d)", precision, scale);
        }
        if (column.isNullable()) {
            destinationType = "Nullable(" + destinationType + ")";
        }

        return ColumnDef.builder()
            .name(column.getName())
            .sourceType(column.getColumnType())
            .destinationType(destinationType)
            .nullable(column.isNullable())
            .kind(kind)
            .precision(precision)
            .scale(scale)
            .build();
    }

    /**
     * Converts a raw JDBC value into the destination value for its column.
     */
    public CellValue coerce(Object value, ColumnDef column) {
        if (value == null) {
            if (!column.isNullable()) {
                throw new CoercionException(column.getName(), "null in a non-nullable column");
            }
            return CellValue.ofNull();
        }

        switch (column.getKind()) {
            case INT8:
            case INT16:
            case INT32:
            case INT64:
            case UINT8:
            case UINT16:
            case UINT32:
            case UINT64:
                return coerceInteger(value, column);
            case FLOAT32:
                return CellValue.ofFloat(toNumber(value, column).floatValue());
            case FLOAT64:
                return CellValue.ofDouble(toNumber(value, column).doubleValue());
            case DECIMAL:
                return coerceDecimal(value, column);
            case STRING:
                return coerceString(value, column);
            case BYTES:
                return coerceBytes(value, column);
            case DATE:
                return coerceDate(value, column);
            case DATE_TIME:
                return coerceDateTime(value, column);
            default:
                throw new CoercionException(column.getName(), "no coercion rule for " + column.getKind());
        }
    }

    private CellValue coerceInteger(Object value, ColumnDef column) {
        BigInteger integer;
        if (value instanceof Boolean) {
            integer = (Boolean) value ? BigInteger.ONE : BigInteger.ZERO;
        } else if (value instanceof byte[]) {
            integer = new BigInteger(1, (byte[]) value);
        } else if (value instanceof java.sql.Date) {
            integer = BigInteger.valueOf(((java.sql.Date) value).toLocalDate().getYear());
        } else if (value instanceof LocalDate) {
            integer = BigInteger.valueOf(((LocalDate) value).getYear());
        } else if (value instanceof BigInteger) {
            integer = (BigInteger) value;
        } else if (value instanceof BigDecimal) {
            try {
                integer = ((BigDecimal) value).toBigIntegerExact();
            } catch (ArithmeticException e) {
                throw new CoercionException(column.getName(), "fractional value " + value, e);
            }
        } else if (value instanceof Number) {
            integer = BigInteger.valueOf(((Number) value).longValue());
        } else {
            throw unexpectedType(value, column);
        }

        if (!column.getKind().inRange(integer)) {
            throw new CoercionException(column.getName(),
                integer + " is out of range for " + column.getKind().getClickHouseName());
        }
        return CellValue.ofInteger(integer);
    }

    private CellValue coerceDecimal(Object value, ColumnDef column) {
        BigDecimal decimal;
        if (value instanceof BigDecimal) {
            decimal = (BigDecimal) value;
        } else if (value instanceof BigInteger) {
            decimal = new BigDecimal((BigInteger) value);
        } else if (value instanceof Number) {
            decimal = new BigDecimal(value.toString());
        } else {
            throw unexpectedType(value, column);
        }

        try {
            decimal = decimal.setScale(column.getScale(), RoundingMode.UNNECESSARY);
        } catch (ArithmeticException e) {
            throw new CoercionException(column.getName(),
                value + " has more than " + column.getScale() + " fractional digits", e);
        }
        if (decimal.precision() > column.getPrecision()) {
            throw new CoercionException(column.getName(),
                value + " does not fit " + column.getDestinationType());
        }
        return CellValue.ofDecimal(decimal);
    }

    private CellValue coerceString(Object value, ColumnDef column) {
        if (value instanceof String) {
            return CellValue.ofString((String) value);
        }
        if (value instanceof byte[]) {
            return CellValue.ofString(decode((byte[]) value, column));
        }
        if (value instanceof Time) {
            return CellValue.ofString(value.toString());
        }
        if (value instanceof LocalTime) {
            return CellValue.ofString(((LocalTime) value).truncatedTo(ChronoUnit.SECONDS).toString());
        }
        if (value instanceof Character || value instanceof Number || value instanceof Boolean) {
            return CellValue.ofString(String.valueOf(value));
        }
        throw unexpectedType(value, column);
    }

    private CellValue coerceBytes(Object value, ColumnDef column) {
        if (value instanceof byte[]) {
            return CellValue.ofBytes((byte[]) value);
        }
        if (value instanceof String) {
            return CellValue.ofBytes(((String) value).getBytes(sourceCharset));
        }
        throw unexpectedType(value, column);
    }

    private CellValue coerceDate(Object value, ColumnDef column) {
        LocalDate date;
        if (value instanceof java.sql.Date) {
            date = ((java.sql.Date) value).toLocalDate();
        } else if (value instanceof LocalDate) {
            date = (LocalDate) value;
        } else if (value instanceof LocalDateTime) {
            date = ((LocalDateTime) value).toLocalDate();
        } else {
            throw unexpectedType(value, column);
        }
        if (date.isBefore(MIN_DATE) || date.isAfter(MAX_DATE)) {
            throw new CoercionException(column.getName(), date + " is outside the Date range");
        }
        return CellValue.ofDate(date);
    }

    private CellValue coerceDateTime(Object value, ColumnDef column) {
        LocalDateTime dateTime;
        if (value instanceof Timestamp) {
            dateTime = ((Timestamp) value).toLocalDateTime();
        } else if (value instanceof LocalDateTime) {
            dateTime = (LocalDateTime) value;
        } else if (value instanceof java.sql.Date) {
            dateTime = ((java.sql.Date) value).toLocalDate().atStartOfDay();
        } else if (value instanceof LocalDate) {
            dateTime = ((LocalDate) value).atStartOfDay();
        } else {
            throw unexpectedType(value, column);
        }
        dateTime = dateTime.truncatedTo(ChronoUnit.SECONDS);
        if (dateTime.isBefore(MIN_DATE_TIME) || dateTime.isAfter(MAX_DATE_TIME)) {
            throw new CoercionException(column.getName(), dateTime + " is outside the DateTime range");
        }
        return CellValue.ofDateTime(dateTime);
    }

    private Number toNumber(Object value, ColumnDef column) {
        if (value instanceof Number) {
            return (Number) value;
        }
        throw unexpectedType(value, column);
    }

    private String decode(byte[] bytes, ColumnDef column) {
        try {
            return sourceCharset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        } catch (CharacterCodingException e) {
            throw new CoercionException(column.getName(),
                "bytes are not valid " + sourceCharset.name(), e);
        }
    }

    private CoercionException unexpectedType(Object value, ColumnDef column) {
        return new CoercionException(column.getName(),
            "unexpected " + value.getClass().getSimpleName() + " for source type " + column.getSourceType());
    }

    private static String baseType(String fullType) {
        int end = fullType.length();
        int paren = fullType.indexOf('(');
        int space = fullType.indexOf(' ');
        if (paren >= 0) {
            end = paren;
        }
        if (space >= 0 && space < end) {
            end = space;
        }
        return fullType.substring(0, end);
    }

    private static String typeArguments(String fullType) {
        int open = fullType.indexOf('(');
        int close = fullType.indexOf(')', open + 1);
        if (open < 0 || close < 0) {
            return null;
        }
        return fullType.substring(open + 1, close).trim();
    }
}
