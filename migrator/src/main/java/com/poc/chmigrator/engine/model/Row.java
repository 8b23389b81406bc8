package com.poc.chmigrator.engine.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One source row: raw JDBC values in the column order fixed when the cursor opened.
 */
@EqualsAndHashCode
@ToString
public final class Row {

    private final List<Object> values;

    public Row(List<?> values) {
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static Row of(Object... values) {
        List<Object> list = new ArrayList<>(values.length);
        Collections.addAll(list, values);
        return new Row(list);
    }

    public Object get(int index) {
        return values.get(index);
    }

    public int size() {
        return values.size();
    }

    public List<Object> values() {
        return values;
    }
}
