package com.market.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.market.anomaly.engine.classifier.AnomalyClassifier;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A fitted classifier together with the ordered feature list it was fitted on.
 *
 * This is also the persisted document: older files may lack
 * {@code featureImportances}, which then loads as {@code null}.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrainedModel {

    public static final int CURRENT_FORMAT_VERSION = 1;

    @Builder.Default
    int formatVersion = CURRENT_FORMAT_VERSION;

    AnomalyClassifier classifier;

    // Order matters: inference presents columns in exactly this order
    List<String> activeFeatures;

    // Feature name -> importance, descending
    Map<String, Double> featureImportances;

    long trainedAt;

    int trainingRows;

    int anomalousRows;

    /**
     * @return the {@code n} most important features, or an empty map when no ranking is stored
     */
    public Map<String, Double> topImportances(int n) {
        Map<String, Double> top = new LinkedHashMap<>();
        if (featureImportances == null) return top;
        for (Map.Entry<String, Double> entry : featureImportances.entrySet()) {
            if (top.size() >= n) break;
            top.put(entry.getKey(), entry.getValue());
        }
        return top;
    }
}
