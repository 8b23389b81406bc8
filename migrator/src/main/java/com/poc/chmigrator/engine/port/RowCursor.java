package com.poc.chmigrator.engine.port;

import com.poc.chmigrator.engine.model.Row;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Forward-only iteration over a source table.
 */
public interface RowCursor extends AutoCloseable {

    /**
     * Column names in the order values appear in each row.
     */
    List<String> columnNames();

    /**
     * The next row, or empty once the table is exhausted.
     */
    Optional<Row> next() throws SQLException;

    @Override
    void close();
}
