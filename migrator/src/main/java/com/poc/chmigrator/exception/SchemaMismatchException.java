package com.poc.chmigrator.exception;

import lombok.Getter;

import java.util.List;

/**
 * Exception thrown when an existing destination table lacks columns of the source table.
 */
@Getter
public class SchemaMismatchException extends SchemaException {
    
    private final String tableName;
    private final List<String> missingColumns;
    
    public SchemaMismatchException(String tableName, List<String> missingColumns) {
        super(String.format("Destination table '%s' is missing columns %s", tableName, missingColumns));
        this.tableName = tableName;
        this.missingColumns = List.copyOf(missingColumns);
    }
}
