package com.poc.chmigrator.service;

import com.poc.chmigrator.config.MigrationProperties;
import com.poc.chmigrator.engine.model.TableSpec;
import com.poc.chmigrator.exception.ConfigurationException;
import com.poc.chmigrator.util.SqlValidator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns the configured table list, or a requested subset of it, into validated
 * table specs with defaults applied.
 */
@Component
@RequiredArgsConstructor
public class TaskPlanner {

    private final MigrationProperties properties;

    public List<TableSpec> plan(List<String> requestedTables) {
        Map<String, TableSpec> configured = configuredTables();
        if (configured.isEmpty()) {
            throw new ConfigurationException("No tables configured under migration.tables");
        }
        if (requestedTables == null || requestedTables.isEmpty()) {
            return new ArrayList<>(configured.values());
        }

        List<TableSpec> selected = new ArrayList<>(requestedTables.size());
        Set<String> seen = new HashSet<>();
        for (String name : requestedTables) {
            TableSpec spec = configured.get(name);
            if (spec == null) {
                throw new ConfigurationException("Table is not configured for migration: " + name);
            }
            if (!seen.add(name)) {
                throw new ConfigurationException("Table requested twice: " + name);
            }
            selected.add(spec);
        }
        return selected;
    }

    private Map<String, TableSpec> configuredTables() {
        Map<String, TableSpec> specs = new LinkedHashMap<>();
        Set<String> destinations = new HashSet<>();
        for (MigrationProperties.TableConfig table : properties.getTables()) {
            TableSpec spec = toSpec(table);
            if (specs.containsKey(spec.getSourceTable())) {
                throw new ConfigurationException("Source table configured twice: " + spec.getSourceTable());
            }
            if (!destinations.add(spec.getDestinationTable())) {
                throw new ConfigurationException("Destination table targeted twice: " + spec.getDestinationTable());
            }
            specs.put(spec.getSourceTable(), spec);
        }
        return specs;
    }

    private TableSpec toSpec(MigrationProperties.TableConfig table) {
        try {
            SqlValidator.validateTableName(table.getSourceTable());
            if (table.getDestinationTable() != null && !table.getDestinationTable().isBlank()) {
                SqlValidator.validateTableName(table.getDestinationTable());
            }
            return TableSpec.builder()
                .sourceTable(table.getSourceTable())
                .destinationTable(table.getDestinationTable())
                .batchSize(table.getBatchSize() != null ? table.getBatchSize() : properties.getDefaultBatchSize())
                .verify(table.getVerify() != null ? table.getVerify() : properties.isDefaultVerify())
                .continueOnError(table.getContinueOnError() != null
                    ? table.getContinueOnError() : properties.isContinueOnError())
                .build();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid table configuration: " + e.getMessage(), e);
        }
    }
}
