package com.poc.chmigrator.engine.model;

import java.util.List;

/**
 * Rows flushed to the destination in one bulk insert. Sequence numbers start at 1
 * per table and are never reused.
 */
public final class Batch {

    private final int sequence;
    private final List<Row> rows;

    public Batch(int sequence, List<Row> rows) {
        this.sequence = sequence;
        this.rows = List.copyOf(rows);
    }

    public int getSequence() {
        return sequence;
    }

    public List<Row> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }
}
