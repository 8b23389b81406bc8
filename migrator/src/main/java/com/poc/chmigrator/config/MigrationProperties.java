package com.poc.chmigrator.config;

import com.poc.chmigrator.engine.EngineSettings;
import com.poc.chmigrator.infrastructure.database.DatabaseConnectionConfig;
import com.poc.chmigrator.infrastructure.database.DatabaseType;
import com.poc.chmigrator.infrastructure.database.MySQLJdbcUrlBuilder;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.nio.charset.Charset;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for MySQL to ClickHouse migration.
 */
@Configuration
@ConfigurationProperties(prefix = "migration")
@Validated
@Data
public class MigrationProperties {

    /**
     * Name given to tasks started without an explicit name.
     */
    private String taskName = "mysql-to-clickhouse";

    /**
     * Run the configured table list once when the application starts.
     */
    private boolean runOnStartup = false;

    @NotNull
    @Valid
    private Endpoint source = Endpoint.mysqlDefaults();

    @NotNull
    @Valid
    private Endpoint destination = Endpoint.clickHouseDefaults();

    /**
     * Tables in migration order.
     */
    @Valid
    private List<TableConfig> tables = new ArrayList<>();

    @Min(1)
    private int defaultBatchSize = 10000;

    private boolean defaultVerify = true;

    /**
     * Default for tables that do not set {@code continue-on-error} themselves.
     */
    private boolean continueOnError = false;

    private boolean skipEmptyTables = true;

    private boolean dropTableBeforeCreate = false;

    @Valid
    private PerformanceConfig performance = new PerformanceConfig();

    @Valid
    private RetryConfig retry = new RetryConfig();

    /**
     * Resolves the engine's immutable settings from these properties.
     */
    public EngineSettings toEngineSettings() {
        return EngineSettings.builder()
            .fetchSize(performance.getFetchSize())
            .queueCapacity(performance.getQueueCapacity())
            .flushTimeout(Duration.ofMillis(performance.getFlushTimeoutMs()))
            .concurrency(performance.getConcurrency())
            .progressLogInterval(Duration.ofMillis(performance.getProgressLogIntervalMs()))
            .writeMaxAttempts(retry.getMaxAttempts())
            .readMaxAttempts(retry.getReadMaxAttempts())
            .retryDelay(Duration.ofMillis(retry.getDelayMs()))
            .skipEmptyTables(skipEmptyTables)
            .dropTableBeforeCreate(dropTableBeforeCreate)
            .sourceCharset(Charset.forName(MySQLJdbcUrlBuilder.javaEncoding(source.getCharset())))
            .build();
    }

    @Data
    public static class Endpoint {

        @NotBlank(message = "Database host is required")
        private String host = "localhost";

        /**
         * 0 uses the database type's default port.
         */
        @Min(0)
        private int port;

        @NotBlank(message = "Database name is required")
        private String database;

        private String user = "root";

        private String password = "";

        /**
         * Client character set, MySQL only.
         */
        private String charset = "utf8mb4";

        static Endpoint mysqlDefaults() {
            Endpoint endpoint = new Endpoint();
            endpoint.setPort(DatabaseType.MYSQL.getDefaultPort());
            return endpoint;
        }

        static Endpoint clickHouseDefaults() {
            Endpoint endpoint = new Endpoint();
            endpoint.setPort(DatabaseType.CLICKHOUSE.getDefaultPort());
            endpoint.setUser("default");
            return endpoint;
        }

        public DatabaseConnectionConfig toConnectionConfig(DatabaseType type, PerformanceConfig performance) {
            return DatabaseConnectionConfig.builder()
                .type(type)
                .host(host)
                .port(port)
                .database(database)
                .user(user)
                .password(password)
                .charset(charset)
                .connectTimeoutSeconds(performance.getConnectionTimeoutSeconds())
                .socketTimeoutSeconds(performance.getQueryTimeoutSeconds())
                .build();
        }
    }

    @Data
    public static class TableConfig {

        @NotBlank(message = "Source table is required")
        private String sourceTable;

        /**
         * Defaults to the source table name.
         */
        private String destinationTable;

        /**
         * Falls back to {@code default-batch-size}.
         */
        @Min(1)
        private Integer batchSize;

        /**
         * Falls back to {@code default-verify}.
         */
        private Boolean verify;

        /**
         * Falls back to the top-level {@code continue-on-error}.
         */
        private Boolean continueOnError;
    }

    @Data
    public static class PerformanceConfig {

        /**
         * Tables migrated at the same time.
         */
        @Min(1)
        private int concurrency = 1;

        /**
         * Row chunks buffered between reader and writer.
         */
        @Min(1)
        private int queueCapacity = 4;

        /**
         * Rows per cursor round; 0 uses each table's batch size.
         */
        @Min(0)
        private int fetchSize = 0;

        /**
         * Flush a partial batch after this long without completing it; 0 disables.
         */
        @Min(0)
        private long flushTimeoutMs = 30000;

        @Min(1)
        private int connectionTimeoutSeconds = 10;

        @Min(1)
        private int queryTimeoutSeconds = 3600;

        @Min(100)
        private long progressLogIntervalMs = 3000;
    }

    @Data
    public static class RetryConfig {
        /**
         * Maximum attempts per batch write.
         */
        @Min(1)
        private int maxAttempts = 5;

        /**
         * Maximum attempts when opening a source cursor.
         */
        @Min(1)
        private int readMaxAttempts = 3;

        /**
         * Base delay between attempts (milliseconds), doubled after each failure.
         */
        @Min(0)
        private long delayMs = 2000;
    }
}
