package com.poc.chmigrator.infrastructure.database;

import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * MySQL-specific JDBC URL builder.
 * Keeps {@code DATETIME} values as local date-times and reports them in the
 * server's own time zone so nothing shifts on the way to ClickHouse.
 */
@Component
public class MySQLJdbcUrlBuilder implements JdbcUrlBuilder {
    
    @Override
    public String buildUrl(DatabaseConnectionConfig config) {
        return String.format(Locale.ROOT,
            "jdbc:mysql://%s:%d/%s?useSSL=false&allowPublicKeyRetrieval=true"
                + "&characterEncoding=%s&connectTimeout=%d&socketTimeout=%d"
                + "&zeroDateTimeBehavior=CONVERT_TO_NULL&preserveInstants=false",
            config.getHost(),
            config.getPortOrDefault(),
            config.getDatabase(),
            javaEncoding(config.getCharset()),
            config.getConnectTimeoutSeconds() * 1000,
            config.getSocketTimeoutSeconds() * 1000
        );
    }
    
    @Override
    public DatabaseType type() {
        return DatabaseType.MYSQL;
    }
    
    /**
     * Connector/J takes Java encoding names; MySQL's utf8mb4 and utf8 are both UTF-8.
     */
    public static String javaEncoding(String mysqlCharset) {
        if (mysqlCharset == null || mysqlCharset.isBlank() || mysqlCharset.toLowerCase(Locale.ROOT).startsWith("utf8")) {
            return "UTF-8";
        }
        if ("latin1".equalsIgnoreCase(mysqlCharset)) {
            return "Cp1252";
        }
        return mysqlCharset;
    }
}
