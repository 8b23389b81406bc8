package com.poc.chmigrator.infrastructure.database;

import com.poc.chmigrator.config.MigrationProperties;
import com.poc.chmigrator.engine.port.DatabaseSessionFactory;
import com.poc.chmigrator.engine.port.DestinationDatabase;
import com.poc.chmigrator.engine.port.SourceDatabase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens a fresh MySQL and ClickHouse connection for every table migration, so no
 * cursor or write handle is ever shared between tables.
 */
@Component
@Slf4j
public class JdbcDatabaseSessionFactory implements DatabaseSessionFactory {

    private final DatabaseConnectionFactory connectionFactory;
    private final DatabaseConnectionConfig sourceConfig;
    private final DatabaseConnectionConfig destinationConfig;
    private final int queryTimeoutSeconds;

    public JdbcDatabaseSessionFactory(DatabaseConnectionFactory connectionFactory, MigrationProperties properties) {
        this.connectionFactory = connectionFactory;
        this.sourceConfig = properties.getSource().toConnectionConfig(DatabaseType.MYSQL, properties.getPerformance());
        this.destinationConfig = properties.getDestination().toConnectionConfig(
            DatabaseType.CLICKHOUSE, properties.getPerformance());
        this.queryTimeoutSeconds = properties.getPerformance().getQueryTimeoutSeconds();
    }

    @Override
    public SourceDatabase openSource() throws SQLException {
        Connection connection = connectionFactory.createConnection(sourceConfig);
        log.debug("Opened MySQL connection to {}", sourceConfig.describe());
        return new MySqlSourceDatabase(connection, sourceConfig.getDatabase(), queryTimeoutSeconds);
    }

    @Override
    public DestinationDatabase openDestination() throws SQLException {
        Connection connection = connectionFactory.createConnection(destinationConfig);
        log.debug("Opened ClickHouse connection to {}", destinationConfig.describe());
        return new ClickHouseDestinationDatabase(connection, destinationConfig.getDatabase(), queryTimeoutSeconds);
    }
}
