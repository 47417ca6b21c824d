package com.market.anomaly.engine.prepare;

import com.market.anomaly.engine.table.CellValues;
import com.market.anomaly.engine.table.FeatureTable;
import com.market.anomaly.engine.table.FeatureVocabulary;
import com.market.anomaly.exception.LabelColumnMissingException;
import com.market.anomaly.exception.NoFeaturesAvailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a loosely typed {@link FeatureTable} into a clean numeric matrix.
 *
 * Steps:
 *   1. Active features = candidate features present in the table, in candidate order.
 *   2. Drop rows with a missing cell in any active feature.
 *   3. Coerce each active column to doubles; drop rows where any coercion failed.
 *   4. When labels are required, drop rows whose label is not numeric.
 */
@Component
public class FeaturePreparer {

    private static final Logger log = LoggerFactory.getLogger(FeaturePreparer.class);

    public PreparedFeatures prepare(FeatureTable table, boolean requireLabel) {
        return prepare(table, FeatureVocabulary.RECOGNIZED, requireLabel);
    }

    /**
     * Prepares the table using only the given candidate features.
     *
     * @throws NoFeaturesAvailableException if none of the candidates is a column of the table
     * @throws LabelColumnMissingException  if {@code requireLabel} is set and the label column is absent
     */
    public PreparedFeatures prepare(FeatureTable table, List<String> candidates, boolean requireLabel) {
        List<String> activeFeatures = resolveActiveFeatures(table, candidates);

        if (requireLabel && !table.hasColumn(FeatureVocabulary.LABEL)) {
            log.error("Label column '{}' not found in the data", FeatureVocabulary.LABEL);
            throw new LabelColumnMissingException(FeatureVocabulary.LABEL);
        }

        // Phase 1: rows with every active feature present
        int[] complete = completeRows(table, activeFeatures);

        // Phase 2: numeric coercion per column
        List<ColumnCoercion> coercions = new ArrayList<>(activeFeatures.size());
        for (String feature : activeFeatures) {
            ColumnCoercion coercion = ColumnCoercion.coerce(feature, table.getColumn(feature), complete);
            if (coercion.getStatus() != ColumnCoercion.Status.CLEAN) {
                log.warn("Column '{}' could not be fully converted to numeric ({} of {} values invalid, status {}). "
                                + "Affected rows will be dropped.",
                        coercion.getColumn(), coercion.getInvalidCount(), coercion.size(), coercion.getStatus());
            }
            coercions.add(coercion);
        }

        ColumnCoercion labelCoercion = requireLabel
                ? ColumnCoercion.coerce(FeatureVocabulary.LABEL, table.getColumn(FeatureVocabulary.LABEL), complete)
                : null;
        if (labelCoercion != null && labelCoercion.getInvalidCount() > 0) {
            log.warn("Label column has {} non-numeric values; those rows are excluded from training",
                    labelCoercion.getInvalidCount());
        }

        List<Integer> kept = new ArrayList<>(complete.length);
        for (int i = 0; i < complete.length; i++) {
            if (allValid(coercions, i) && (labelCoercion == null || labelCoercion.isValid(i))) {
                kept.add(i);
            }
        }

        int n = kept.size();
        int[] positions = new int[n];
        double[][] matrix = new double[n][activeFeatures.size()];
        int[] labels = labelCoercion != null ? new int[n] : null;

        for (int r = 0; r < n; r++) {
            int i = kept.get(r);
            positions[r] = complete[i];
            for (int f = 0; f < coercions.size(); f++) {
                matrix[r][f] = coercions.get(f).valueAt(i);
            }
            if (labels != null) {
                labels[r] = toLabel(labelCoercion.valueAt(i));
            }
        }

        log.debug("Prepared {} of {} rows with features {}", n, table.rowCount(), activeFeatures);
        return new PreparedFeatures(activeFeatures, positions, matrix, labels, table.rowCount());
    }

    public List<String> resolveActiveFeatures(FeatureTable table) {
        return resolveActiveFeatures(table, FeatureVocabulary.RECOGNIZED);
    }

    public List<String> resolveActiveFeatures(FeatureTable table, List<String> candidates) {
        List<String> active = new ArrayList<>();
        for (String candidate : candidates) {
            if (table.hasColumn(candidate)) active.add(candidate);
        }
        if (active.isEmpty()) {
            log.error("No feature columns available for the model. Columns present: {}", table.getColumnNames());
            throw new NoFeaturesAvailableException(table.getColumnNames());
        }
        return List.copyOf(active);
    }

    private static int[] completeRows(FeatureTable table, List<String> features) {
        List<List<Object>> columns = new ArrayList<>(features.size());
        for (String feature : features) columns.add(table.getColumn(feature));

        int[] buffer = new int[table.rowCount()];
        int count = 0;
        for (int row = 0; row < table.rowCount(); row++) {
            boolean complete = true;
            for (List<Object> column : columns) {
                if (CellValues.isMissing(column.get(row))) {
                    complete = false;
                    break;
                }
            }
            if (complete) buffer[count++] = row;
        }
        int[] rows = new int[count];
        System.arraycopy(buffer, 0, rows, 0, count);
        return rows;
    }

    private static boolean allValid(List<ColumnCoercion> coercions, int i) {
        for (ColumnCoercion coercion : coercions) {
            if (!coercion.isValid(i)) return false;
        }
        return true;
    }

    // Truncated toward zero; any non-zero value marks an anomaly
    private static int toLabel(double value) {
        return ((long) value) != 0 ? 1 : 0;
    }
}
