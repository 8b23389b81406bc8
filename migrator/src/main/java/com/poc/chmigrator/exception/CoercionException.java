package com.poc.chmigrator.exception;

import lombok.Getter;

/**
 * Exception thrown when a source value falls outside the domain of its column's
 * destination type.
 */
@Getter
public class CoercionException extends DataMigrationException {
    
    private final String columnName;
    
    public CoercionException(String columnName, String message) {
        super(String.format("Cannot coerce value of column '%s': %s", columnName, message));
        this.columnName = columnName;
    }
    
    public CoercionException(String columnName, String message, Throwable cause) {
        super(String.format("Cannot coerce value of column '%s': %s", columnName, message), cause);
        this.columnName = columnName;
    }
}
