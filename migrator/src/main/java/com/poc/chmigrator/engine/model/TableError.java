package com.poc.chmigrator.engine.model;

import lombok.Builder;
import lombok.Value;

/**
 * Failure detail recorded on a table result: what went wrong, in which state,
 * and the innermost cause.
 */
@Value
@Builder
public class TableError {
    String type;
    String message;
    TableState failedState;
    String rootCause;

    public static TableError of(Throwable error, TableState failedState) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return TableError.builder()
            .type(error.getClass().getSimpleName())
            .message(error.getMessage() != null ? error.getMessage() : error.getClass().getName())
            .failedState(failedState)
            .rootCause(root == error ? null : root.getClass().getSimpleName() + ": " + root.getMessage())
            .build();
    }

    /**
     * One-line rendering for logs and notifications.
     */
    public String summary() {
        return "[" + failedState + "] " + type + ": " + message;
    }
}
