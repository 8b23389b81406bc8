package com.poc.chmigrator.engine;

import lombok.Builder;
import lombok.Value;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Resolved engine configuration. Built once per application from the migration
 * properties and handed to every engine component through its constructor.
 */
@Value
@Builder(toBuilder = true)
public class EngineSettings {

    /**
     * Rows requested per cursor round; 0 reuses the table's batch size.
     */
    @Builder.Default
    int fetchSize = 0;

    /**
     * Row batches that may wait between the reader and the writer.
     */
    @Builder.Default
    int queueCapacity = 4;

    /**
     * Partial batches older than this are flushed; zero disables time-based flushing.
     */
    @Builder.Default
    Duration flushTimeout = Duration.ofSeconds(30);

    @Builder.Default
    int writeMaxAttempts = 5;

    @Builder.Default
    Duration retryDelay = Duration.ofSeconds(2);

    @Builder.Default
    int readMaxAttempts = 3;

    /**
     * Tables migrated at the same time; 1 keeps the task strictly sequential.
     */
    @Builder.Default
    int concurrency = 1;

    @Builder.Default
    boolean skipEmptyTables = true;

    @Builder.Default
    boolean dropTableBeforeCreate = false;

    @Builder.Default
    Duration progressLogInterval = Duration.ofSeconds(3);

    @Builder.Default
    Charset sourceCharset = StandardCharsets.UTF_8;

    public int fetchSizeFor(int batchSize) {
        return fetchSize > 0 ? fetchSize : batchSize;
    }
}
