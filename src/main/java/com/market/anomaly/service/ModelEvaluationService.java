package com.market.anomaly.service;

import com.market.anomaly.engine.table.FeatureTable;
import com.market.anomaly.engine.table.FeatureVocabulary;
import com.market.anomaly.model.ModelEvaluation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Compares predictions with known labels on a scored table.
 */
@Service
public class ModelEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(ModelEvaluationService.class);

    /**
     * Rows lacking either a label or a prediction are skipped. Ratios with a zero
     * denominator are reported as 0.
     */
    public ModelEvaluation evaluate(FeatureTable scored) {
        log.info("Evaluating anomaly detection model");

        if (!scored.hasColumn(FeatureVocabulary.LABEL) || !scored.hasColumn(FeatureVocabulary.PREDICTION)) {
            log.error("Columns '{}' and '{}' are both required for evaluation",
                    FeatureVocabulary.LABEL, FeatureVocabulary.PREDICTION);
            return ModelEvaluation.failed("Required columns not found: "
                    + FeatureVocabulary.LABEL + ", " + FeatureVocabulary.PREDICTION);
        }

        int tp = 0, fp = 0, tn = 0, fn = 0;
        for (int row = 0; row < scored.rowCount(); row++) {
            double label = scored.getDouble(FeatureVocabulary.LABEL, row);
            double prediction = scored.getDouble(FeatureVocabulary.PREDICTION, row);
            if (Double.isNaN(label) || Double.isNaN(prediction)) continue;

            boolean actual = ((long) label) != 0;
            boolean predicted = ((long) prediction) != 0;
            if (actual && predicted) tp++;
            else if (!actual && predicted) fp++;
            else if (actual) fn++;
            else tn++;
        }

        int evaluated = tp + fp + tn + fn;
        double precision = ratio(tp, tp + fp);
        double recall = ratio(tp, tp + fn);
        double f1 = precision + recall > 0 ? 2 * precision * recall / (precision + recall) : 0.0;

        log.info("Evaluated {} rows: precision={}, recall={}, f1={}",
                evaluated, round(precision), round(recall), round(f1));

        return ModelEvaluation.builder()
                .evaluatedRows(evaluated)
                .precision(precision)
                .recall(recall)
                .f1Score(f1)
                .truePositives(tp)
                .falsePositives(fp)
                .trueNegatives(tn)
                .falseNegatives(fn)
                .actualAnomalies(tp + fn)
                .detectedAnomalies(tp + fp)
                .actualAnomalyPercentage(ratio(tp + fn, evaluated) * 100.0)
                .detectedAnomalyPercentage(ratio(tp + fp, evaluated) * 100.0)
                .build();
    }

    private static double ratio(int numerator, int denominator) {
        return denominator > 0 ? (double) numerator / denominator : 0.0;
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
