package com.poc.chmigrator.exception;

/**
 * Exception thrown when reading the source structure or preparing the destination table fails.
 */
public class SchemaException extends MigrationException {
    
    public SchemaException(String message) {
        super(message);
    }
    
    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
