package com.market.anomaly.engine.prepare;

import com.market.anomaly.engine.table.CellValues;

import java.util.List;

/**
 * Outcome of converting one feature column to doubles over a set of rows.
 *
 * Conversion is attempted cell by cell; cells that do not hold a finite number
 * are recorded as NaN and counted, never thrown.
 */
public final class ColumnCoercion {

    public enum Status {
        /** Every cell converted. */
        CLEAN,
        /** Some cells could not be converted. */
        PARTIAL,
        /** No cell could be converted. */
        FAILED
    }

    private final String column;
    private final double[] values;
    private final int invalidCount;

    private ColumnCoercion(String column, double[] values, int invalidCount) {
        this.column = column;
        this.values = values;
        this.invalidCount = invalidCount;
    }

    /**
     * Converts {@code cells[rows[i]]} into {@code values[i]}.
     */
    public static ColumnCoercion coerce(String column, List<Object> cells, int[] rows) {
        double[] values = new double[rows.length];
        int invalid = 0;
        for (int i = 0; i < rows.length; i++) {
            values[i] = CellValues.toDouble(cells.get(rows[i]));
            if (Double.isNaN(values[i])) invalid++;
        }
        return new ColumnCoercion(column, values, invalid);
    }

    public Status getStatus() {
        if (invalidCount == 0) return Status.CLEAN;
        if (invalidCount == values.length) return Status.FAILED;
        return Status.PARTIAL;
    }

    public boolean isValid(int i) {
        return !Double.isNaN(values[i]);
    }

    public double valueAt(int i) {
        return values[i];
    }

    public String getColumn() {
        return column;
    }

    public int getInvalidCount() {
        return invalidCount;
    }

    public int size() {
        return values.length;
    }
}
