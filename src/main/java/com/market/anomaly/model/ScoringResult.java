package com.market.anomaly.model;

import com.market.anomaly.engine.table.FeatureTable;
import com.market.anomaly.exception.ScoringFailureException;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ScoringResult {

    FeatureTable table;

    ScoringOutcome outcome;

    // Empty when scoring degraded before preparation finished
    @Builder.Default
    List<String> activeFeatures = List.of();

    int scoredRows;

    int detectedAnomalies;

    // Set only when outcome == DEGRADED
    ScoringFailureException failure;
}
