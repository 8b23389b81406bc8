package com.poc.chmigrator.engine.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of a whole task; table results are in migration order.
 */
@Value
@Builder
public class TaskResult {
    Long taskId;
    String taskName;
    List<TableResult> tableResults;
    TaskStatus overallStatus;
    Duration duration;

    /**
     * Set only when the task was aborted before any table started.
     */
    String taskError;

    public long succeededCount() {
        return tableResults.stream().filter(TableResult::isSucceeded).count();
    }

    public long failedCount() {
        return tableResults.stream().filter(TableResult::isFailed).count();
    }

    public long skippedCount() {
        return tableResults.stream().filter(TableResult::isSkipped).count();
    }

    public long totalRowsWritten() {
        return tableResults.stream().mapToLong(TableResult::getRowsWritten).sum();
    }

    public Optional<TableResult> firstFailure() {
        return tableResults.stream().filter(TableResult::isFailed).findFirst();
    }
}
