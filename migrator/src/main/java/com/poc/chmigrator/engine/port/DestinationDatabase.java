package com.poc.chmigrator.engine.port;

import com.poc.chmigrator.engine.model.CellValue;
import com.poc.chmigrator.engine.model.ColumnDef;

import java.sql.SQLException;
import java.util.List;

/**
 * What the engine needs from the column-oriented destination. One instance is owned
 * by a single table migration.
 */
public interface DestinationDatabase extends AutoCloseable {

    boolean tableExists(String table) throws SQLException;

    /**
     * Live column names of an existing table.
     */
    List<String> describeColumns(String table) throws SQLException;

    /**
     * Creates the table with the columns in the given order, sorted by
     * {@code orderBy} or by insertion order when it is empty.
     */
    void createTable(String table, List<ColumnDef> columns, List<String> orderBy) throws SQLException;

    void dropTable(String table) throws SQLException;

    /**
     * Inserts all rows in one bulk call and returns the number of rows sent.
     */
    int bulkInsert(String table, List<ColumnDef> columns, List<List<CellValue>> rows) throws SQLException;

    long countRows(String table) throws SQLException;

    @Override
    void close();
}
