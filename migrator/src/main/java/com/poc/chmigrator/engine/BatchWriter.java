package com.poc.chmigrator.engine;

import com.poc.chmigrator.engine.model.Batch;
import com.poc.chmigrator.engine.model.CellValue;
import com.poc.chmigrator.engine.model.ColumnDef;
import com.poc.chmigrator.engine.model.Row;
import com.poc.chmigrator.engine.port.DestinationDatabase;
import com.poc.chmigrator.exception.WriteException;
import com.poc.chmigrator.util.RetryUtil;
import com.poc.chmigrator.util.TransientErrors;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes batches to one destination table with one bulk insert per attempt.
 * <p>
 * Transient failures are retried with backoff. A retried insert may already have
 * been applied before the connection dropped, so a retry can duplicate rows; the
 * append-only destination accepts that and count verification surfaces it.
 */
@Slf4j
public class BatchWriter {

    private final DestinationDatabase destination;
    private final String table;
    private final List<ColumnDef> columns;
    private final TypeMapper typeMapper;
    private final EngineSettings settings;

    public BatchWriter(DestinationDatabase destination, String table, List<ColumnDef> columns,
                       TypeMapper typeMapper, EngineSettings settings) {
        this.destination = destination;
        this.table = table;
        this.columns = List.copyOf(columns);
        this.typeMapper = typeMapper;
        this.settings = settings;
    }

    /**
     * @return rows written, which is the batch size
     * @throws com.poc.chmigrator.exception.CoercionException when a value does not fit its column
     * @throws WriteException when the insert fails for good
     */
    public int write(Batch batch) {
        String operation = "insert batch #" + batch.getSequence() + " (" + batch.size() + " rows) into " + table;
        try {
            return RetryUtil.executeWithRetry(
                () -> destination.bulkInsert(table, columns, coerce(batch)),
                settings.getWriteMaxAttempts(),
                settings.getRetryDelay().toMillis(),
                operation,
                TransientErrors::isTransient);

        } catch (RuntimeException e) {
            throw e;
        } catch (RetryUtil.RetriesExhaustedException e) {
            throw new WriteException("Gave up on " + operation + " after " + e.getAttempts() + " attempts",
                e.getAttempts(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WriteException("Interrupted during " + operation, 0, e);
        } catch (Exception e) {
            throw new WriteException("Failed to " + operation + ": " + e.getMessage(), 1, e);
        }
    }

    /**
     * Builds the destination values for one insert attempt.
     */
    private List<List<CellValue>> coerce(Batch batch) {
        List<List<CellValue>> values = new ArrayList<>(batch.size());
        for (Row row : batch.getRows()) {
            List<CellValue> cells = new ArrayList<>(columns.size());
            for (int i = 0; i < columns.size(); i++) {
                cells.add(typeMapper.coerce(row.get(i), columns.get(i)));
            }
            values.add(cells);
        }
        return values;
    }
}
