package com.poc.chmigrator.engine.model;

import lombok.Builder;
import lombok.Value;

/**
 * One table to migrate. Immutable once a task starts; a task keeps its specs in
 * migration order.
 */
@Value
public class TableSpec {

    String sourceTable;
    String destinationTable;
    int batchSize;
    boolean verify;
    boolean continueOnError;

    @Builder
    public TableSpec(String sourceTable, String destinationTable, int batchSize,
                     boolean verify, boolean continueOnError) {
        if (sourceTable == null || sourceTable.isBlank()) {
            throw new IllegalArgumentException("Source table is required");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.sourceTable = sourceTable;
        this.destinationTable = destinationTable == null || destinationTable.isBlank()
            ? sourceTable : destinationTable;
        this.batchSize = batchSize;
        this.verify = verify;
        this.continueOnError = continueOnError;
    }

    /**
     * Short label used in log lines.
     */
    public String label() {
        return sourceTable + " -> " + destinationTable;
    }
}
