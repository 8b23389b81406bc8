package com.poc.chmigrator.engine.model;

/**
 * Lifecycle state of a single table migration.
 * PENDING → SYNCING → STREAMING → VERIFYING → {SUCCEEDED, FAILED, SKIPPED}.
 */
public enum TableState {
    PENDING("Pending", false, false),
    SYNCING("Synchronizing Schema", false, false),
    STREAMING("Streaming Rows", false, false),
    VERIFYING("Verifying Counts", false, false),
    SUCCEEDED("Succeeded", true, false),
    FAILED("Failed", true, true),
    SKIPPED("Skipped", true, false);

    private final String displayName;
    private final boolean isTerminal;
    private final boolean isError;

    TableState(String displayName, boolean isTerminal, boolean isError) {
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

    /**
     * Whether the state machine allows moving from this state to {@code next}.
     * Terminal states never move; FAILED is reachable from any running state,
     * SKIPPED only before VERIFYING.
     */
    public boolean canTransitionTo(TableState next) {
        if (isTerminal) {
            return false;
        }
        switch (next) {
            case SYNCING:
                return this == PENDING;
            case STREAMING:
                return this == SYNCING;
            case VERIFYING:
                return this == STREAMING;
            case SUCCEEDED:
                return this == STREAMING || this == VERIFYING;
            case FAILED:
                return true;
            case SKIPPED:
                return this == PENDING || this == SYNCING || this == STREAMING;
            default:
                return false;
        }
    }
}
