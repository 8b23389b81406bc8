package com.poc.chmigrator.infrastructure.database;

import com.poc.chmigrator.engine.model.CellValue;
import com.poc.chmigrator.engine.model.ColumnDef;
import com.poc.chmigrator.engine.port.DestinationDatabase;
import com.poc.chmigrator.util.SqlValidator;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * ClickHouse destination over one dedicated JDBC connection.
 */
@Slf4j
public class ClickHouseDestinationDatabase implements DestinationDatabase {

    private final Connection connection;
    private final String database;
    private final int queryTimeoutSeconds;

    public ClickHouseDestinationDatabase(Connection connection, String database, int queryTimeoutSeconds) {
        this.connection = connection;
        this.database = database;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    @Override
    public boolean tableExists(String table) throws SQLException {
        SqlValidator.validateTableName(table);
        try (PreparedStatement stmt = connection.prepareStatement(
                "SELECT count() FROM system.tables WHERE database = ? AND name = ?")) {
            stmt.setString(1, database);
            stmt.setString(2, table);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() && rs.getLong(1) > 0;
            }
        }
    }

    @Override
    public List<String> describeColumns(String table) throws SQLException {
        SqlValidator.validateTableName(table);
        List<String> names = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(
                "SELECT name FROM system.columns WHERE database = ? AND table = ? ORDER BY position")) {
            stmt.setString(1, database);
            stmt.setString(2, table);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    names.add(rs.getString(1));
                }
            }
        }
        return names;
    }

    @Override
    public void createTable(String table, List<ColumnDef> columns, List<String> orderBy) throws SQLException {
        String ddl = buildCreateTable(SqlValidator.qualifiedTable(database, table), columns, orderBy);
        log.debug("Executing DDL:\n{}", ddl);
        execute(ddl);
    }

    @Override
    public void dropTable(String table) throws SQLException {
        execute("DROP TABLE IF EXISTS " + SqlValidator.qualifiedTable(database, table));
    }

    @Override
    public int bulkInsert(String table, List<ColumnDef> columns, List<List<CellValue>> rows) throws SQLException {
        if (rows.isEmpty()) {
            return 0;
        }
        String columnList = columns.stream()
            .map(column -> SqlValidator.quote(column.getName()))
            .collect(Collectors.joining(", "));
        String placeholders = String.join(", ", Collections.nCopies(columns.size(), "?"));
        String sql = "INSERT INTO " + SqlValidator.qualifiedTable(database, table)
            + " (" + columnList + ") VALUES (" + placeholders + ")";

        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setQueryTimeout(queryTimeoutSeconds);
            for (List<CellValue> row : rows) {
                for (int i = 0; i < row.size(); i++) {
                    bind(stmt, i + 1, row.get(i));
                }
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
        return rows.size();
    }

    @Override
    public long countRows(String table) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(
                "SELECT count() FROM " + SqlValidator.qualifiedTable(database, table))) {
            stmt.setQueryTimeout(queryTimeoutSeconds);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return rs.getLong(1);
                }
                throw new SQLException("No result returned from count query");
            }
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close ClickHouse connection: {}", e.getMessage());
        }
    }

    /**
     * MergeTree table with the columns in source order. An empty sort key orders by
     * {@code tuple()}, i.e. insertion order.
     */
    static String buildCreateTable(String qualifiedTable, List<ColumnDef> columns, List<String> orderBy) {
        String columnDefs = columns.stream()
            .map(column -> "    " + SqlValidator.quote(column.getName()) + " " + column.getDestinationType())
            .collect(Collectors.joining(",\n"));
        String sortKey = orderBy.isEmpty()
            ? "tuple()"
            : orderBy.stream().map(SqlValidator::quote).collect(Collectors.joining(", "));

        return "CREATE TABLE IF NOT EXISTS " + qualifiedTable + "\n"
            + "(\n" + columnDefs + "\n)\n"
            + "ENGINE = MergeTree()\n"
            + "ORDER BY (" + sortKey + ")\n"
            + "SETTINGS index_granularity = 8192";
    }

    private void execute(String sql) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.setQueryTimeout(queryTimeoutSeconds);
            stmt.execute(sql);
        }
    }

    private static void bind(PreparedStatement stmt, int index, CellValue cell) throws SQLException {
        switch (cell.getKind()) {
            case NULL:
                stmt.setNull(index, Types.NULL);
                break;
            case BYTES:
                stmt.setBytes(index, (byte[]) cell.getValue());
                break;
            case STRING:
                stmt.setString(index, (String) cell.getValue());
                break;
            default:
                stmt.setObject(index, cell.getValue());
                break;
        }
    }
}
