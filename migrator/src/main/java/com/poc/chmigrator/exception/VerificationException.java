package com.poc.chmigrator.exception;

/**
 * Exception thrown when post-migration row counts cannot be obtained or do not match.
 */
public class VerificationException extends MigrationException {
    
    public VerificationException(String message) {
        super(message);
    }
    
    public VerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
