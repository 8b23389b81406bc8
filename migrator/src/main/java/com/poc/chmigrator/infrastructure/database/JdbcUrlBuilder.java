package com.poc.chmigrator.infrastructure.database;

import java.util.Properties;

/**
 * Builds the JDBC URL and driver properties for one database type. Credentials go
 * into the properties, never into the URL, so URLs are safe to log.
 */
public interface JdbcUrlBuilder {

    DatabaseType type();

    String buildUrl(DatabaseConnectionConfig config);

    default Properties connectionProperties(DatabaseConnectionConfig config) {
        Properties properties = new Properties();
        properties.setProperty("user", config.getUser() != null ? config.getUser() : "");
        properties.setProperty("password", config.getPassword() != null ? config.getPassword() : "");
        return properties;
    }
}
