package com.market.anomaly.engine.table;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Row-indexed table of trading periods.
 *
 * Each row is keyed by a date; columns hold untyped cells (numbers, strings or
 * {@code null}) so that malformed upstream values survive until preparation
 * decides what to do with them. Column order is insertion order.
 */
public class FeatureTable {

    private final List<LocalDate> index;
    private final Map<String, List<Object>> columns = new LinkedHashMap<>();

    public FeatureTable(List<LocalDate> index) {
        this.index = new ArrayList<>(Objects.requireNonNull(index, "index"));
    }

    public static FeatureTable withIndex(List<LocalDate> index) {
        return new FeatureTable(index);
    }

    /**
     * Adds or replaces a column. Returns this table for chaining.
     */
    public FeatureTable column(String name, List<?> values) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(values, "values");
        if (values.size() != index.size()) {
            throw new IllegalArgumentException(String.format(
                    "Column '%s' has %d values but the table has %d rows", name, values.size(), index.size()));
        }
        columns.put(name, new ArrayList<>(values));
        return this;
    }

    public FeatureTable column(String name, double... values) {
        List<Object> boxed = new ArrayList<>(values.length);
        for (double v : values) boxed.add(v);
        return column(name, boxed);
    }

    /**
     * Sets every row of a column to the same value, creating the column if needed.
     */
    public void fillColumn(String name, Object value) {
        columns.put(name, new ArrayList<>(Collections.nCopies(index.size(), value)));
    }

    public void set(String column, int row, Object value) {
        requireColumn(column).set(row, value);
    }

    public Object get(String column, int row) {
        return requireColumn(column).get(row);
    }

    public double getDouble(String column, int row) {
        return CellValues.toDouble(get(column, row));
    }

    public List<Object> getColumn(String name) {
        return Collections.unmodifiableList(requireColumn(name));
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public List<String> getColumnNames() {
        return List.copyOf(columns.keySet());
    }

    public List<LocalDate> getIndex() {
        return Collections.unmodifiableList(index);
    }

    public LocalDate getDate(int row) {
        return index.get(row);
    }

    public int rowCount() {
        return index.size();
    }

    /**
     * Copies the index and every column; cell objects themselves are shared.
     */
    public FeatureTable copy() {
        FeatureTable copy = new FeatureTable(index);
        columns.forEach(copy::column);
        return copy;
    }

    private List<Object> requireColumn(String name) {
        List<Object> values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("Unknown column '" + name + "'. Available: " + columns.keySet());
        }
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureTable)) return false;
        FeatureTable other = (FeatureTable) o;
        return index.equals(other.index) && columns.equals(other.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, columns);
    }

    @Override
    public String toString() {
        return "FeatureTable{rows=" + index.size() + ", columns=" + columns.keySet() + "}";
    }
}
