package com.di.retailetl.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One record of a batch: column name to value, untyped at ingress and typed after cleaning.
 *
 * <p>{@code rowId} is the position in the batch and is only meaningful within that batch.
 * Rows are treated as values by the validator and the planner; the cleaner mutates only its
 * own {@link #copy()}.
 */
public final class Row {

    private final int rowId;
    private final Map<String, Object> values;
    private boolean cleaned;

    public Row(int rowId, Map<String, ?> values) {
        this(rowId, values, false);
    }

    private Row(int rowId, Map<String, ?> values, boolean cleaned) {
        this.rowId = rowId;
        this.values = new LinkedHashMap<>(values == null ? Map.of() : values);
        this.cleaned = cleaned;
    }

    public static Row of(int rowId, Map<String, ?> values) {
        return new Row(rowId, values);
    }

    public int getRowId() {
        return rowId;
    }

    public Object get(String column) {
        return values.get(column);
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    public Set<String> columns() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    /** Set once the row has been through the cleaner; such rows pass through a second clean unchanged. */
    public boolean isCleaned() {
        return cleaned;
    }

    public Row copy() {
        return new Row(rowId, values, cleaned);
    }

    public void put(String column, Object value) {
        values.put(column, value);
    }

    public Object remove(String column) {
        return values.remove(column);
    }

    public void markCleaned() {
        this.cleaned = true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Row)) {
            return false;
        }
        Row other = (Row) o;
        return rowId == other.rowId && cleaned == other.cleaned && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowId, values, cleaned);
    }

    @Override
    public String toString() {
        return "Row{rowId=" + rowId + ", cleaned=" + cleaned + ", values=" + values + "}";
    }
}
