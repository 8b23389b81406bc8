package com.poc.chmigrator.engine;

import com.poc.chmigrator.engine.model.ColumnDef;
import com.poc.chmigrator.engine.model.SourceColumn;
import com.poc.chmigrator.engine.model.TableSpec;
import com.poc.chmigrator.engine.port.DestinationDatabase;
import com.poc.chmigrator.engine.port.SourceDatabase;
import com.poc.chmigrator.exception.SchemaException;
import com.poc.chmigrator.exception.SchemaMismatchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads the source structure and makes sure a compatible destination table exists.
 * Existing tables are checked, never altered.
 */
@Slf4j
@RequiredArgsConstructor
public class SchemaSynchronizer {

    private final TypeMapper typeMapper;
    private final EngineSettings settings;

    /**
     * Maps the source columns of {@code spec} and ensures the destination table.
     *
     * @return the mapped columns in source order
     */
    public List<ColumnDef> synchronize(TableSpec spec, SourceDatabase source, DestinationDatabase destination) {
        List<SourceColumn> sourceColumns;
        List<String> primaryKey;
        try {
            sourceColumns = source.describeColumns(spec.getSourceTable());
            primaryKey = source.primaryKeyColumns(spec.getSourceTable());
        } catch (SQLException e) {
            throw new SchemaException("Failed to read structure of source table " + spec.getSourceTable(), e);
        }
        if (sourceColumns.isEmpty()) {
            throw new SchemaException("Source table " + spec.getSourceTable() + " has no columns or does not exist");
        }
        log.info("Got table structure: {} ({} columns)", spec.getSourceTable(), sourceColumns.size());

        List<ColumnDef> columns = new ArrayList<>(sourceColumns.size());
        for (SourceColumn sourceColumn : sourceColumns) {
            columns.add(typeMapper.mapColumn(sourceColumn));
        }

        if (primaryKey.isEmpty()) {
            log.warn("No primary key on {}, destination will be ordered by tuple()", spec.getSourceTable());
        } else {
            log.info("Primary keys: {}", String.join(", ", primaryKey));
        }

        ensureTable(spec.getDestinationTable(), columns, primaryKey, destination);
        return columns;
    }

    /**
     * Creates the destination table when absent, otherwise verifies its columns are a
     * superset of {@code columns}.
     */
    public void ensureTable(String table, List<ColumnDef> columns, List<String> orderBy,
                            DestinationDatabase destination) {
        try {
            if (settings.isDropTableBeforeCreate()) {
                destination.dropTable(table);
                log.info("Dropped old table: {}", table);
            } else if (destination.tableExists(table)) {
                verifyCompatible(table, columns, destination.describeColumns(table));
                log.info("Destination table {} already exists and is compatible", table);
                return;
            }
            destination.createTable(table, columns, sortKey(orderBy, columns));
            log.info("Created destination table: {}", table);

        } catch (SQLException e) {
            throw new SchemaException("Failed to prepare destination table " + table, e);
        }
    }

    /**
     * ClickHouse column names are case-sensitive, so {@code ID} does not cover {@code id}.
     */
    private void verifyCompatible(String table, List<ColumnDef> columns, List<String> liveColumns) {
        Set<String> live = new HashSet<>(liveColumns);
        List<String> missing = columns.stream()
            .map(ColumnDef::getName)
            .filter(name -> !live.contains(name))
            .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new SchemaMismatchException(table, missing);
        }
    }

    /**
     * Primary key columns usable as a ClickHouse sorting key. Nullable columns cannot be
     * part of the key, so a key containing one falls back to insertion order.
     */
    private List<String> sortKey(List<String> primaryKey, List<ColumnDef> columns) {
        for (String keyColumn : primaryKey) {
            boolean usable = columns.stream()
                .anyMatch(column -> column.getName().equalsIgnoreCase(keyColumn) && !column.isNullable());
            if (!usable) {
                log.warn("Primary key column {} is nullable or unknown, ordering by tuple()", keyColumn);
                return List.of();
            }
        }
        return primaryKey;
    }
}
