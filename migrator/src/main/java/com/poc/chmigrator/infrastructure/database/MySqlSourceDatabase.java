package com.poc.chmigrator.infrastructure.database;

import com.poc.chmigrator.engine.model.Row;
import com.poc.chmigrator.engine.model.SourceColumn;
import com.poc.chmigrator.engine.port.RowCursor;
import com.poc.chmigrator.engine.port.SourceDatabase;
import com.poc.chmigrator.util.SqlValidator;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * MySQL source over one dedicated JDBC connection.
 * <p>
 * Cursors use Connector/J row streaming ({@code fetchSize = Integer.MIN_VALUE} on a
 * forward-only, read-only statement): rows arrive one by one from the server and
 * nothing else may run on the connection until the cursor is closed.
 */
@Slf4j
public class MySqlSourceDatabase implements SourceDatabase {

    private static final String DESCRIBE_SQL =
        "SELECT COLUMN_NAME, COLUMN_TYPE, IS_NULLABLE FROM INFORMATION_SCHEMA.COLUMNS "
            + "WHERE TABLE_SCHEMA = ? AND TABLE_NAME = ? ORDER BY ORDINAL_POSITION";

    private static final String PRIMARY_KEY_SQL =
        "SELECT COLUMN_NAME FROM INFORMATION_SCHEMA.KEY_COLUMN_USAGE "
            + "WHERE TABLE_SCHEMA = ? AND TABLE_NAME = ? AND CONSTRAINT_NAME = 'PRIMARY' "
            + "ORDER BY ORDINAL_POSITION";

    private final Connection connection;
    private final String database;
    private final int queryTimeoutSeconds;

    public MySqlSourceDatabase(Connection connection, String database, int queryTimeoutSeconds) {
        this.connection = connection;
        this.database = database;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    @Override
    public List<SourceColumn> describeColumns(String table) throws SQLException {
        SqlValidator.validateTableName(table);
        List<SourceColumn> columns = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(DESCRIBE_SQL)) {
            stmt.setQueryTimeout(queryTimeoutSeconds);
            stmt.setString(1, database);
            stmt.setString(2, table);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    columns.add(SourceColumn.builder()
                        .name(rs.getString("COLUMN_NAME"))
                        .columnType(rs.getString("COLUMN_TYPE"))
                        .nullable("YES".equalsIgnoreCase(rs.getString("IS_NULLABLE")))
                        .build());
                }
            }
        }
        return columns;
    }

    @Override
    public List<String> primaryKeyColumns(String table) throws SQLException {
        SqlValidator.validateTableName(table);
        List<String> keys = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(PRIMARY_KEY_SQL)) {
            stmt.setQueryTimeout(queryTimeoutSeconds);
            stmt.setString(1, database);
            stmt.setString(2, table);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    keys.add(rs.getString(1));
                }
            }
        }
        return keys;
    }

    @Override
    public long countRows(String table) throws SQLException {
        String sql = "SELECT COUNT(*) FROM " + SqlValidator.qualifiedTable(database, table);
        log.debug("Executing: {}", sql);
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
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
    public RowCursor openCursor(String table, int fetchSize) throws SQLException {
        String sql = "SELECT * FROM " + SqlValidator.qualifiedTable(database, table);
        log.info("Executing streaming query: {} (requested fetch size {})", sql, fetchSize);

        PreparedStatement stmt = connection.prepareStatement(sql,
            ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY);
        try {
            stmt.setFetchSize(Integer.MIN_VALUE);
            ResultSet rs = stmt.executeQuery();
            return new StreamingCursor(stmt, rs);
        } catch (SQLException e) {
            stmt.close();
            throw e;
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close MySQL connection: {}", e.getMessage());
        }
    }

    /**
     * Row-streaming cursor. Closing it before the end cancels the statement so the
     * driver does not drain the remaining rows.
     */
    private static final class StreamingCursor implements RowCursor {

        private final PreparedStatement statement;
        private final ResultSet resultSet;
        private final List<String> columnNames;
        private boolean exhausted;

        StreamingCursor(PreparedStatement statement, ResultSet resultSet) throws SQLException {
            this.statement = statement;
            this.resultSet = resultSet;
            ResultSetMetaData metaData = resultSet.getMetaData();
            List<String> names = new ArrayList<>(metaData.getColumnCount());
            for (int i = 1; i <= metaData.getColumnCount(); i++) {
                names.add(metaData.getColumnLabel(i));
            }
            this.columnNames = List.copyOf(names);
        }

        @Override
        public List<String> columnNames() {
            return columnNames;
        }

        @Override
        public Optional<Row> next() throws SQLException {
            if (exhausted || !resultSet.next()) {
                exhausted = true;
                return Optional.empty();
            }
            List<Object> values = new ArrayList<>(columnNames.size());
            for (int i = 1; i <= columnNames.size(); i++) {
                values.add(resultSet.getObject(i));
            }
            return Optional.of(new Row(values));
        }

        @Override
        public void close() {
            try {
                if (!exhausted) {
                    statement.cancel();
                }
                resultSet.close();
            } catch (SQLException e) {
                log.debug("Closing streaming result set: {}", e.getMessage());
            } finally {
                try {
                    statement.close();
                } catch (SQLException e) {
                    log.warn("Failed to close streaming statement: {}", e.getMessage());
                }
            }
        }
    }
}
