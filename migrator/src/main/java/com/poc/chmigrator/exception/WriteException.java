package com.poc.chmigrator.exception;

import lombok.Getter;

/**
 * Exception thrown when a batch could not be inserted into the destination,
 * either because the failure was not transient or because retries ran out.
 */
@Getter
public class WriteException extends DataMigrationException {
    
    private final int attempts;
    
    public WriteException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }
}
