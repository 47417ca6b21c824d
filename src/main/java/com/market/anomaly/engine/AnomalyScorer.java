package com.market.anomaly.engine;

import com.market.anomaly.config.AnomalyModelConfig;
import com.market.anomaly.engine.classifier.AnomalyClassifier;
import com.market.anomaly.engine.prepare.FeaturePreparer;
import com.market.anomaly.engine.prepare.PreparedFeatures;
import com.market.anomaly.engine.table.FeatureTable;
import com.market.anomaly.engine.table.FeatureVocabulary;
import com.market.anomaly.exception.ScoringFailureException;
import com.market.anomaly.model.ScoringOutcome;
import com.market.anomaly.model.ScoringResult;
import com.market.anomaly.model.TrainedModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores a feature table with a trained model.
 *
 * The input table is never modified; the result is a copy with three columns
 * appended (or overwritten):
 *   anomaly_probability  P(anomaly) from the classifier
 *   anomaly_prediction   1.0 / 0.0
 *   anomaly_severity     P(anomaly) * |return| / severityNormalizer
 *
 * Rows removed during preparation keep their previous values for these columns,
 * or NaN when the columns are new. Two fallbacks never throw:
 *   no row survives preparation -> all three columns NaN for every row
 *   inference fails             -> all three columns 0.0 for every row
 */
@Component
public class AnomalyScorer {

    private static final Logger log = LoggerFactory.getLogger(AnomalyScorer.class);

    private final FeaturePreparer preparer;
    private final AnomalyModelConfig config;

    public AnomalyScorer(FeaturePreparer preparer, AnomalyModelConfig config) {
        this.preparer = preparer;
        this.config = config;
    }

    /**
     * @throws com.market.anomaly.exception.NoFeaturesAvailableException if the table carries no recognized
     *         feature column at all
     */
    public ScoringResult score(TrainedModel model, FeatureTable table) {
        log.info("Predicting anomalies for {} rows", table.rowCount());

        // Structural misconfiguration is surfaced, not degraded
        preparer.resolveActiveFeatures(table);

        try {
            return scorePrepared(model, table);
        } catch (RuntimeException e) {
            ScoringFailureException failure = e instanceof ScoringFailureException
                    ? (ScoringFailureException) e
                    : new ScoringFailureException("Inference failed: " + e.getMessage(), e);
            log.error("Failed to predict anomalies; defaulting scored columns to 0 for all {} rows",
                    table.rowCount(), e);

            FeatureTable degraded = table.copy();
            for (String column : FeatureVocabulary.SCORED_COLUMNS) {
                degraded.fillColumn(column, 0.0);
            }
            return ScoringResult.builder()
                    .table(degraded)
                    .outcome(ScoringOutcome.DEGRADED)
                    .failure(failure)
                    .build();
        }
    }

    private ScoringResult scorePrepared(TrainedModel model, FeatureTable table) {
        List<String> missing = new ArrayList<>();
        for (String feature : model.getActiveFeatures()) {
            if (!table.hasColumn(feature)) missing.add(feature);
        }
        if (!missing.isEmpty()) {
            throw new ScoringFailureException("Model was trained on features " + model.getActiveFeatures()
                    + " but the table lacks " + missing);
        }

        PreparedFeatures prepared = preparer.prepare(table, model.getActiveFeatures(), false);
        FeatureTable result = table.copy();

        if (prepared.isEmpty()) {
            log.warn("No valid rows to predict after cleaning ({} rows dropped)", prepared.droppedRowCount());
            for (String column : FeatureVocabulary.SCORED_COLUMNS) {
                result.fillColumn(column, Double.NaN);
            }
            return ScoringResult.builder()
                    .table(result)
                    .outcome(ScoringOutcome.NOTHING_SCORABLE)
                    .activeFeatures(prepared.getActiveFeatures())
                    .build();
        }

        double[][] matrix = prepared.getMatrix();
        AnomalyClassifier classifier = model.getClassifier();
        double[] probabilities = classifier.predictProbability(matrix);
        int[] predictions = classifier.predict(matrix);
        checkOutput(prepared.rowCount(), probabilities, predictions);

        for (String column : FeatureVocabulary.SCORED_COLUMNS) {
            if (!result.hasColumn(column)) result.fillColumn(column, Double.NaN);
        }

        boolean hasReturn = table.hasColumn(FeatureVocabulary.RETURN);
        double normalizer = config.getScoring().getSeverityNormalizer();
        int anomalies = 0;

        for (int i = 0; i < prepared.rowCount(); i++) {
            int row = prepared.rowPosition(i);
            result.set(FeatureVocabulary.PROBABILITY, row, probabilities[i]);
            result.set(FeatureVocabulary.PREDICTION, row, (double) predictions[i]);
            anomalies += predictions[i];

            if (hasReturn) {
                double ret = table.getDouble(FeatureVocabulary.RETURN, row);
                if (!Double.isNaN(ret)) {
                    result.set(FeatureVocabulary.SEVERITY, row, probabilities[i] * Math.abs(ret) / normalizer);
                }
            }
        }

        log.info("Anomalies detected: {} of {} samples", anomalies, prepared.rowCount());
        return ScoringResult.builder()
                .table(result)
                .outcome(ScoringOutcome.SCORED)
                .activeFeatures(prepared.getActiveFeatures())
                .scoredRows(prepared.rowCount())
                .detectedAnomalies(anomalies)
                .build();
    }

    private static void checkOutput(int rows, double[] probabilities, int[] predictions) {
        if (probabilities == null || predictions == null
                || probabilities.length != rows || predictions.length != rows) {
            throw new ScoringFailureException(String.format(
                    "Classifier returned %s probabilities and %s predictions for %d rows",
                    probabilities == null ? "no" : String.valueOf(probabilities.length),
                    predictions == null ? "no" : String.valueOf(predictions.length), rows));
        }
        for (int i = 0; i < rows; i++) {
            double p = probabilities[i];
            if (Double.isNaN(p) || p < 0.0 || p > 1.0) {
                throw new ScoringFailureException("Classifier returned probability " + p + " at row " + i);
            }
            if (predictions[i] != 0 && predictions[i] != 1) {
                throw new ScoringFailureException("Classifier returned class " + predictions[i] + " at row " + i);
            }
        }
    }
}
