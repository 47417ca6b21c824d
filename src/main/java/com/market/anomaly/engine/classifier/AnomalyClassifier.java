package com.market.anomaly.engine.classifier;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Binary classifier over a dense numeric feature matrix.
 *
 * Class 1 is the anomalous class. Implementations are serialized with Jackson
 * as part of a persisted model, so their state must be exposed as JSON properties.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RandomForestClassifier.class, name = "random-forest")
})
public interface AnomalyClassifier {

    /**
     * Fit on {@code features[i]} labelled {@code labels[i]} (0 or 1).
     *
     * @throws IllegalArgumentException if the inputs are empty or of inconsistent shape
     */
    void fit(double[][] features, int[] labels);

    /**
     * @return predicted class (0 or 1) for each row
     */
    int[] predict(double[][] features);

    /**
     * @return probability of the anomalous class for each row, in [0, 1]
     */
    double[] predictProbability(double[][] features);

    /**
     * @return importance weight per feature column, aligned with the training columns
     */
    double[] featureImportances();
}
