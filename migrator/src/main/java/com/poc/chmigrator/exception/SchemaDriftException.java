package com.poc.chmigrator.exception;

/**
 * Exception thrown when the source columns seen by the cursor differ from the ones
 * the destination table was synchronized with.
 */
public class SchemaDriftException extends SchemaException {
    
    public SchemaDriftException(String message) {
        super(message);
    }
    
    public SchemaDriftException(String message, Throwable cause) {
        super(message, cause);
    }
}
