package com.poc.chmigrator.engine.model;

import lombok.Builder;
import lombok.Value;

/**
 * A column as described by the source database, e.g. {@code decimal(10,2) unsigned}.
 */
@Value
@Builder
public class SourceColumn {
    String name;
    String columnType;
    boolean nullable;
}
