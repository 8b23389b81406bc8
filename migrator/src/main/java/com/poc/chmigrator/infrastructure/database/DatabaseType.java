package com.poc.chmigrator.infrastructure.database;

import lombok.Getter;

/**
 * The two ends of a migration: MySQL is always read, ClickHouse is always written.
 */
@Getter
public enum DatabaseType {
    MYSQL("mysql", "com.mysql.cj.jdbc.Driver", 3306),
    /**
     * HTTP interface; the native TCP port 9000 is not used by the JDBC driver.
     */
    CLICKHOUSE("clickhouse", "com.clickhouse.jdbc.ClickHouseDriver", 8123);

    private final String typeName;
    private final String driverClassName;
    private final int defaultPort;

    DatabaseType(String typeName, String driverClassName, int defaultPort) {
        this.typeName = typeName;
        this.driverClassName = driverClassName;
        this.defaultPort = defaultPort;
    }
}
