package com.market.anomaly.engine.table;

/**
 * Numeric interpretation of untyped table cells.
 *
 * A cell is missing when it is {@code null}, a NaN double, or a blank string.
 * Conversion never throws: anything that is not a finite number becomes NaN.
 */
public final class CellValues {

    private CellValues() {}

    public static boolean isMissing(Object cell) {
        if (cell == null) return true;
        if (cell instanceof Number) return Double.isNaN(((Number) cell).doubleValue());
        if (cell instanceof CharSequence) return cell.toString().isBlank();
        return false;
    }

    public static double toDouble(Object cell) {
        if (cell == null) return Double.NaN;
        if (cell instanceof Number) {
            return finiteOrNaN(((Number) cell).doubleValue());
        }
        if (cell instanceof Boolean) {
            return (Boolean) cell ? 1.0 : 0.0;
        }
        if (cell instanceof CharSequence) {
            String text = cell.toString().trim();
            if (text.isEmpty()) return Double.NaN;
            try {
                return finiteOrNaN(Double.parseDouble(text));
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }

    private static double finiteOrNaN(double value) {
        return Double.isFinite(value) ? value : Double.NaN;
    }
}
