package com.poc.chmigrator.engine.model;

/**
 * Status of a migration task as a whole.
 */
public enum TaskStatus {
    PENDING("Pending", false, false),
    RUNNING("Running", false, false),
    SUCCEEDED("Completed Successfully", true, false),
    SUCCEEDED_WITH_WARNINGS("Completed With Failed Tables", true, false),
    FAILED("Failed", true, true),
    CANCELLED("Cancelled", true, false);

    private final String displayName;
    private final boolean isTerminal;
    private final boolean isError;

    TaskStatus(String displayName, boolean isTerminal, boolean isError) {
        this.displayName = displayName;
        this.isTerminal = isTerminal;
        this.isError = isError;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return isTerminal;
    }

    public boolean isError() {
        return isError;
    }

    public boolean isRunning() {
        return !isTerminal;
    }
}
