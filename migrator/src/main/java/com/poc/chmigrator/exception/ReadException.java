package com.poc.chmigrator.exception;

/**
 * Exception thrown when the source cursor cannot be opened or breaks while streaming.
 */
public class ReadException extends DataMigrationException {
    
    public ReadException(String message) {
        super(message);
    }
    
    public ReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
