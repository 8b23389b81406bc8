package com.poc.chmigrator.exception;

/**
 * Base exception for every error raised while migrating tables.
 * Unchecked, so table-fatal conditions travel up to the table migrator untouched.
 */
public class MigrationException extends RuntimeException {
    
    public MigrationException(String message) {
        super(message);
    }
    
    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
    
    public MigrationException(Throwable cause) {
        super(cause);
    }
}


