package com.poc.chmigrator.exception;

import lombok.Getter;

/**
 * Exception thrown when a source column has a type with no ClickHouse mapping.
 * Mapping it to a default type would silently corrupt the destination data.
 */
@Getter
public class UnsupportedTypeException extends SchemaException {
    
    private final String columnName;
    private final String sourceType;
    
    public UnsupportedTypeException(String columnName, String sourceType) {
        super(String.format("Unsupported source type '%s' for column '%s'", sourceType, columnName));
        this.columnName = columnName;
        this.sourceType = sourceType;
    }
}
