package com.poc.chmigrator.engine.port;

import com.poc.chmigrator.engine.model.SourceColumn;

import java.sql.SQLException;
import java.util.List;

/**
 * What the engine needs from the row-oriented source. One instance is owned by a
 * single table migration and is closed when that migration ends.
 */
public interface SourceDatabase extends AutoCloseable {

    /**
     * Columns of the table in ordinal order.
     */
    List<SourceColumn> describeColumns(String table) throws SQLException;

    /**
     * Primary key column names in key order; empty when the table has none.
     */
    List<String> primaryKeyColumns(String table) throws SQLException;

    long countRows(String table) throws SQLException;

    /**
     * Opens a forward-only cursor over every row of the table. The cursor must not
     * buffer the result set client-side.
     */
    RowCursor openCursor(String table, int fetchSize) throws SQLException;

    @Override
    void close();
}
