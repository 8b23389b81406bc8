package com.poc.chmigrator.engine;

import com.poc.chmigrator.engine.model.TableError;
import com.poc.chmigrator.engine.model.TableResult;
import com.poc.chmigrator.engine.model.TableSpec;
import com.poc.chmigrator.engine.model.TableState;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * Mutable state of one table migration while it runs. Finalizes into an immutable
 * {@link TableResult} exactly once.
 */
@Getter
class TableRun {

    private final TableSpec spec;
    private final Instant startedAt = Instant.now();

    private TableState state = TableState.PENDING;
    private long rowsRead;
    private long rowsWritten;
    private int batchesWritten;
    private long sourceCount = -1;
    private long destinationCount = -1;
    private boolean verified;
    private TableResult result;

    TableRun(TableSpec spec) {
        this.spec = spec;
    }

    void transition(TableState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(
                "Table " + spec.getSourceTable() + " cannot move from " + state + " to " + next);
        }
        state = next;
    }

    void rowsRead(int count) {
        rowsRead += count;
    }

    void batchWritten(int rows) {
        if (rowsWritten + rows > rowsRead) {
            throw new IllegalStateException("Written rows would exceed read rows for " + spec.getSourceTable());
        }
        rowsWritten += rows;
        batchesWritten++;
    }

    void sourceCount(long count) {
        this.sourceCount = count;
    }

    void counts(long source, long destination, boolean match) {
        this.sourceCount = source;
        this.destinationCount = destination;
        this.verified = match;
    }

    TableResult succeed() {
        return finish(TableState.SUCCEEDED, null, null);
    }

    TableResult skip(String reason) {
        return finish(TableState.SKIPPED, null, reason);
    }

    TableResult fail(Throwable error) {
        return finish(TableState.FAILED, TableError.of(error, state), null);
    }

    private TableResult finish(TableState terminal, TableError error, String skipReason) {
        if (result != null) {
            throw new IllegalStateException("Result of " + spec.getSourceTable() + " is already final");
        }
        transition(terminal);
        result = TableResult.builder()
            .table(spec)
            .status(terminal)
            .rowsRead(rowsRead)
            .rowsWritten(rowsWritten)
            .batchesWritten(batchesWritten)
            .sourceCount(sourceCount)
            .destinationCount(destinationCount)
            .verified(verified)
            .error(error)
            .skipReason(skipReason)
            .duration(Duration.between(startedAt, Instant.now()))
            .build();
        return result;
    }
}
