package com.poc.chmigrator.engine.model;

import lombok.Builder;
import lombok.Value;

/**
 * A source column together with its ClickHouse definition and the coercion rule
 * for its values. Produced by the type mapper, used while creating the destination
 * table and while writing batches.
 */
@Value
@Builder
public class ColumnDef {
    String name;
    String sourceType;
    String destinationType;
    boolean nullable;
    DestinationKind kind;

    /**
     * Decimal precision and scale; zero for every other kind.
     */
    int precision;
    int scale;
}
