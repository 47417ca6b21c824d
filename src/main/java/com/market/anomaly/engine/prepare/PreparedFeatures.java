package com.market.anomaly.engine.prepare;

import java.util.List;

/**
 * Immutable, fully numeric feature matrix produced by {@link FeaturePreparer}.
 *
 * Row {@code i} of the matrix came from row {@code rowPositions[i]} of the source
 * table; column {@code j} is {@code activeFeatures.get(j)}.
 */
public final class PreparedFeatures {

    private final List<String> activeFeatures;
    private final int[] rowPositions;
    private final double[][] matrix;
    private final int[] labels;
    private final int sourceRows;

    PreparedFeatures(List<String> activeFeatures, int[] rowPositions, double[][] matrix,
                     int[] labels, int sourceRows) {
        this.activeFeatures = List.copyOf(activeFeatures);
        this.rowPositions = rowPositions;
        this.matrix = matrix;
        this.labels = labels;
        this.sourceRows = sourceRows;
    }

    public List<String> getActiveFeatures() {
        return activeFeatures;
    }

    public int rowCount() {
        return rowPositions.length;
    }

    public boolean isEmpty() {
        return rowPositions.length == 0;
    }

    public int droppedRowCount() {
        return sourceRows - rowPositions.length;
    }

    public int rowPosition(int i) {
        return rowPositions[i];
    }

    public int[] getRowPositions() {
        return rowPositions.clone();
    }

    public double[][] getMatrix() {
        double[][] copy = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) copy[i] = matrix[i].clone();
        return copy;
    }

    public boolean hasLabels() {
        return labels != null;
    }

    /**
     * @return labels aligned with matrix rows, or {@code null} when prepared for inference
     */
    public int[] getLabels() {
        return labels == null ? null : labels.clone();
    }

    public int positiveCount() {
        if (labels == null) return 0;
        int count = 0;
        for (int label : labels) count += label;
        return count;
    }
}
