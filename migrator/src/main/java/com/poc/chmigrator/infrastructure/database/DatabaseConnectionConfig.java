package com.poc.chmigrator.infrastructure.database;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Configuration holder for database connections.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DatabaseConnectionConfig {
    private DatabaseType type;
    private String host;
    private int port;
    private String database;
    private String user;
    private String password;
    
    /**
     * MySQL character set name, e.g. {@code utf8mb4}. Ignored for ClickHouse.
     */
    private String charset;
    
    private int connectTimeoutSeconds;
    private int socketTimeoutSeconds;
    
    /**
     * Port with the type's default as fallback.
     */
    public int getPortOrDefault() {
        return port > 0 ? port : type.getDefaultPort();
    }
    
    /**
     * {@code host:port/database} for log lines; never includes credentials.
     */
    public String describe() {
        return host + ":" + getPortOrDefault() + "/" + database;
    }
}
