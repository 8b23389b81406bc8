package com.poc.chmigrator.util;

import lombok.extern.slf4j.Slf4j;

import java.util.function.Predicate;

/**
 * Utility class for retry logic with exponential backoff.
 */
@Slf4j
public class RetryUtil {
    
    /**
     * Upper bound for a single backoff pause.
     */
    static final long MAX_DELAY_MS = 60_000;
    
    private RetryUtil() {
        // Utility class - prevent instantiation
    }
    
    /**
     * An operation that may throw checked exceptions, typically JDBC calls.
     */
    @FunctionalInterface
    public interface Attempt<T> {
        T run() throws Exception;
    }
    
    /**
     * Thrown when every attempt failed with a retryable error.
     * The cause is the error of the last attempt.
     */
    public static class RetriesExhaustedException extends Exception {
        
        private final int attempts;
        
        public RetriesExhaustedException(String message, int attempts, Throwable cause) {
            super(message, cause);
            this.attempts = attempts;
        }
        
        public int getAttempts() {
            return attempts;
        }
    }
    
    /**
     * Execute operation with retry logic.
     * Errors rejected by {@code retryable} are rethrown at once without retrying.
     * 
     * @param operation The operation to execute; invoked afresh on every attempt
     * @param maxAttempts Maximum number of attempts
     * @param delayMs Delay before the second attempt in milliseconds, doubled after each failure
     * @param operationName Name of the operation for logging
     * @param retryable Decides whether a failure is worth another attempt
     * @return Result of the operation
     * @throws RetriesExhaustedException if all attempts fail with retryable errors
     * @throws InterruptedException if interrupted while backing off
     */
    public static <T> T executeWithRetry(
            Attempt<T> operation,
            int maxAttempts,
            long delayMs,
            String operationName,
            Predicate<Exception> retryable) throws Exception {
        
        Exception lastException = null;
        
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                log.debug("Attempting {}: attempt {}/{}", operationName, attempt, maxAttempts);
                return operation.run();
                
            } catch (Exception e) {
                if (!retryable.test(e)) {
                    throw e;
                }
                lastException = e;
                
                if (attempt < maxAttempts) {
                    long currentDelay = backoffDelay(delayMs, attempt);
                    log.warn("Attempt {}/{} failed for {}: {}. Retrying in {}ms...",
                            attempt, maxAttempts, operationName, e.getMessage(), currentDelay);
                    Thread.sleep(currentDelay);
                } else {
                    log.error("All {} attempts failed for {}", maxAttempts, operationName);
                }
            }
        }
        
        throw new RetriesExhaustedException(
            String.format("Operation '%s' failed after %d attempts", operationName, maxAttempts),
            maxAttempts,
            lastException
        );
    }
    
    /**
     * Delay before attempt {@code attempt + 1}: {@code delayMs * 2^(attempt-1)}, capped.
     */
    static long backoffDelay(long delayMs, int attempt) {
        if (delayMs <= 0) {
            return 0;
        }
        int shift = Math.min(attempt - 1, 20);
        return Math.min(delayMs << shift, MAX_DELAY_MS);
    }
}
