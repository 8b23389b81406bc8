package com.poc.chmigrator.exception;

/**
 * Exception thrown when the source or destination database cannot be reached.
 * Raised before any table starts it aborts the whole task.
 */
public class ConnectionException extends MigrationException {
    
    public ConnectionException(String message) {
        super(message);
    }
    
    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
