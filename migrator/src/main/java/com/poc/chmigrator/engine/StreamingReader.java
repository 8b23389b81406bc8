package com.poc.chmigrator.engine;

import com.poc.chmigrator.engine.model.ColumnDef;
import com.poc.chmigrator.engine.model.Row;
import com.poc.chmigrator.engine.port.RowCursor;
import com.poc.chmigrator.engine.port.SourceDatabase;
import com.poc.chmigrator.exception.ReadException;
import com.poc.chmigrator.exception.SchemaDriftException;
import com.poc.chmigrator.util.RetryUtil;
import com.poc.chmigrator.util.TransientErrors;
import lombok.extern.slf4j.Slf4j;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pulls rows from a forward-only source cursor in groups of at most
 * {@code fetchSize}. Every {@link #open} starts a new cursor; a broken cursor is
 * never resumed, the whole table is migrated again instead.
 */
@Slf4j
public class StreamingReader implements AutoCloseable {

    private final SourceDatabase source;
    private final EngineSettings settings;

    private RowCursor cursor;
    private String table;
    private int fetchSize;
    private int columnCount;
    private boolean exhausted;

    public StreamingReader(SourceDatabase source, EngineSettings settings) {
        this.source = source;
        this.settings = settings;
    }

    /**
     * Opens the cursor, retrying transient failures, and checks that the columns it
     * returns are the ones the destination was synchronized with.
     */
    public void open(String table, int fetchSize, List<ColumnDef> expectedColumns) {
        if (cursor != null) {
            throw new IllegalStateException("Reader for " + this.table + " is already open");
        }
        this.table = table;
        this.fetchSize = fetchSize;
        this.exhausted = false;

        try {
            cursor = RetryUtil.executeWithRetry(
                () -> source.openCursor(table, fetchSize),
                settings.getReadMaxAttempts(),
                settings.getRetryDelay().toMillis(),
                "open cursor on " + table,
                TransientErrors::isTransient);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReadException("Interrupted while opening cursor on " + table, e);
        } catch (Exception e) {
            throw new ReadException("Failed to open cursor on " + table, e);
        }

        checkDrift(expectedColumns);
        columnCount = expectedColumns.size();
        log.debug("Opened streaming cursor on {} (fetch size {})", table, fetchSize);
    }

    /**
     * Next group of rows in cursor order, or empty at end of stream.
     */
    public Optional<List<Row>> nextBatch() {
        if (cursor == null) {
            throw new IllegalStateException("Reader is not open");
        }
        if (exhausted) {
            return Optional.empty();
        }

        List<Row> rows = new ArrayList<>(Math.min(fetchSize, 10_000));
        try {
            while (rows.size() < fetchSize) {
                Optional<Row> row = cursor.next();
                if (row.isEmpty()) {
                    exhausted = true;
                    break;
                }
                if (row.get().size() != columnCount) {
                    throw new SchemaDriftException(String.format(
                        "Row from %s has %d values, expected %d", table, row.get().size(), columnCount));
                }
                rows.add(row.get());
            }
        } catch (SQLException e) {
            String kind = TransientErrors.isTransient(e) ? "Connection lost" : "Read failed";
            throw new ReadException(kind + " while streaming " + table + ": " + e.getMessage(), e);
        }

        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(rows);
    }

    @Override
    public void close() {
        if (cursor != null) {
            cursor.close();
            cursor = null;
        }
    }

    private void checkDrift(List<ColumnDef> expectedColumns) {
        List<String> actual = cursor.columnNames();
        boolean same = actual.size() == expectedColumns.size();
        for (int i = 0; same && i < actual.size(); i++) {
            same = actual.get(i).equalsIgnoreCase(expectedColumns.get(i).getName());
        }
        if (!same) {
            List<String> expected = new ArrayList<>();
            expectedColumns.forEach(column -> expected.add(column.getName()));
            close();
            throw new SchemaDriftException(String.format(
                "Columns of %s changed since synchronization: expected %s, cursor returned %s",
                table, expected, actual));
        }
    }
}
