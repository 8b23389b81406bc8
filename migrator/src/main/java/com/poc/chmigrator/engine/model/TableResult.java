package com.poc.chmigrator.engine.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Final outcome of one table migration. Counts that were never measured are -1.
 */
@Value
@Builder
public class TableResult {
    TableSpec table;
    TableState status;
    long rowsRead;
    long rowsWritten;
    int batchesWritten;
    @Builder.Default
    long sourceCount = -1;
    @Builder.Default
    long destinationCount = -1;
    boolean verified;
    TableError error;
    String skipReason;
    Duration duration;

    public boolean isSucceeded() {
        return status == TableState.SUCCEEDED;
    }

    public boolean isFailed() {
        return status == TableState.FAILED;
    }

    public boolean isSkipped() {
        return status == TableState.SKIPPED;
    }

    /**
     * Average written rows per second over the whole table run.
     */
    public double rowsPerSecond() {
        long millis = duration == null ? 0 : duration.toMillis();
        return millis > 0 ? rowsWritten * 1000.0 / millis : 0;
    }

    public static TableResult skipped(TableSpec table, String reason) {
        return TableResult.builder()
            .table(table)
            .status(TableState.SKIPPED)
            .skipReason(reason)
            .duration(Duration.ZERO)
            .build();
    }
}
