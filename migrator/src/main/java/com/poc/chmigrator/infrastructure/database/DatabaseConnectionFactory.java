package com.poc.chmigrator.infrastructure.database;

import com.poc.chmigrator.exception.ConnectionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Opens plain JDBC connections to MySQL and ClickHouse. Every call returns a new
 * connection owned by the caller; there is no pool because each table run holds
 * its connections for the whole copy.
 */
@Component
@Slf4j
public class DatabaseConnectionFactory {

    private final Map<DatabaseType, JdbcUrlBuilder> urlBuilders = new EnumMap<>(DatabaseType.class);

    public DatabaseConnectionFactory(List<JdbcUrlBuilder> builders) {
        for (JdbcUrlBuilder builder : builders) {
            JdbcUrlBuilder previous = urlBuilders.put(builder.type(), builder);
            if (previous != null) {
                throw new IllegalStateException("Two JDBC URL builders for " + builder.type() + ": "
                    + previous.getClass().getSimpleName() + ", " + builder.getClass().getSimpleName());
            }
        }
    }

    /**
     * A missing driver or URL builder is a configuration problem and surfaces as
     * {@link ConnectionException}. Network and authentication problems stay
     * {@link SQLException} so callers can classify them.
     */
    public Connection createConnection(DatabaseConnectionConfig config) throws SQLException {
        JdbcUrlBuilder builder = builderFor(config.getType());
        try {
            Class.forName(config.getType().getDriverClassName());
        } catch (ClassNotFoundException e) {
            throw new ConnectionException("Database driver not found: " + config.getType().getDriverClassName(), e);
        }

        String jdbcUrl = builder.buildUrl(config);
        log.debug("Connecting to {} as {}: {}", config.getType().getTypeName(), config.getUser(), jdbcUrl);
        return DriverManager.getConnection(jdbcUrl, builder.connectionProperties(config));
    }

    public String buildJdbcUrl(DatabaseConnectionConfig config) {
        return builderFor(config.getType()).buildUrl(config);
    }

    private JdbcUrlBuilder builderFor(DatabaseType type) {
        JdbcUrlBuilder builder = urlBuilders.get(type);
        if (builder == null) {
            throw new ConnectionException("No JDBC URL builder found for database type: " + type);
        }
        return builder;
    }
}
