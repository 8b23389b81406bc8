package com.poc.chmigrator.infrastructure.database;

import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * ClickHouse-specific JDBC URL builder (HTTP interface).
 */
@Component
public class ClickHouseJdbcUrlBuilder implements JdbcUrlBuilder {
    
    @Override
    public String buildUrl(DatabaseConnectionConfig config) {
        return String.format(Locale.ROOT,
            "jdbc:clickhouse://%s:%d/%s?connect_timeout=%d&socket_timeout=%d",
            config.getHost(),
            config.getPortOrDefault(),
            config.getDatabase(),
            config.getConnectTimeoutSeconds() * 1000,
            config.getSocketTimeoutSeconds() * 1000
        );
    }
    
    @Override
    public DatabaseType type() {
        return DatabaseType.CLICKHOUSE;
    }
}
