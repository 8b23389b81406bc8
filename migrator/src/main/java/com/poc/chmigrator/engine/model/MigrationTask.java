package com.poc.chmigrator.engine.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A named, ordered list of tables handed to the task runner.
 */
@Value
@Builder
public class MigrationTask {
    Long id;
    String name;
    List<TableSpec> tables;
    @Builder.Default
    CancellationToken cancellation = new CancellationToken();

    public String logPrefix() {
        return "[Task-" + id + "]";
    }
}
