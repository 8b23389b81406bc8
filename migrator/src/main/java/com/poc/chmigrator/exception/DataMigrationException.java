package com.poc.chmigrator.exception;

/**
 * Exception thrown when moving rows between the databases fails.
 */
public class DataMigrationException extends MigrationException {
    
    public DataMigrationException(String message) {
        super(message);
    }
    
    public DataMigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
