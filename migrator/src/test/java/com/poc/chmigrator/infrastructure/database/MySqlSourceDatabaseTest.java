package com.poc.chmigrator.infrastructure.database;

import com.poc.chmigrator.engine.model.Row;
import com.poc.chmigrator.engine.model.SourceColumn;
import com.poc.chmigrator.engine.port.RowCursor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MySqlSourceDatabaseTest {

    @Mock
    private Connection connection;

    @Mock
    private PreparedStatement statement;

    @Mock
    private ResultSet resultSet;

    @Mock
    private ResultSetMetaData metaData;

    @Test
    void opensARowStreamingCursor() throws SQLException {
        when(connection.prepareStatement("SELECT * FROM `shop`.`users`",
            ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY)).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.getMetaData()).thenReturn(metaData);
        when(metaData.getColumnCount()).thenReturn(2);
        when(metaData.getColumnLabel(1)).thenReturn("id");
        when(metaData.getColumnLabel(2)).thenReturn("name");
        when(resultSet.next()).thenReturn(true, false);
        when(resultSet.getObject(1)).thenReturn(1L);
        when(resultSet.getObject(2)).thenReturn(null);
        MySqlSourceDatabase source = new MySqlSourceDatabase(connection, "shop", 60);

        try (RowCursor cursor = source.openCursor("users", 1000)) {
            assertThat(cursor.columnNames()).containsExactly("id", "name");
            assertThat(cursor.next()).contains(Row.of(1L, null));
            assertThat(cursor.next()).isEmpty();
        }

        verify(statement).setFetchSize(Integer.MIN_VALUE);
        verify(statement, never()).cancel();
        verify(statement).close();
    }

    @Test
    void cancelsAnUnfinishedCursorOnClose() throws SQLException {
        when(connection.prepareStatement(anyString(), eq(ResultSet.TYPE_FORWARD_ONLY), eq(ResultSet.CONCUR_READ_ONLY)))
            .thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.getMetaData()).thenReturn(metaData);
        when(metaData.getColumnCount()).thenReturn(0);
        MySqlSourceDatabase source = new MySqlSourceDatabase(connection, "shop", 60);

        source.openCursor("users", 1000).close();

        verify(statement).cancel();
        verify(resultSet).close();
    }

    @Test
    void describesColumnsFromInformationSchema() throws SQLException {
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true, true, false);
        when(resultSet.getString("COLUMN_NAME")).thenReturn("id", "price");
        when(resultSet.getString("COLUMN_TYPE")).thenReturn("int(10) unsigned", "decimal(10,2)");
        when(resultSet.getString("IS_NULLABLE")).thenReturn("NO", "YES");
        MySqlSourceDatabase source = new MySqlSourceDatabase(connection, "shop", 60);

        List<SourceColumn> columns = source.describeColumns("products");

        assertThat(columns).containsExactly(
            SourceColumn.builder().name("id").columnType("int(10) unsigned").nullable(false).build(),
            SourceColumn.builder().name("price").columnType("decimal(10,2)").nullable(true).build());
        verify(statement).setString(1, "shop");
        verify(statement).setString(2, "products");
    }

    @Test
    void refusesUnsafeTableNames() {
        MySqlSourceDatabase source = new MySqlSourceDatabase(connection, "shop", 60);

        assertThatThrownBy(() -> source.countRows("users; DROP TABLE users"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
