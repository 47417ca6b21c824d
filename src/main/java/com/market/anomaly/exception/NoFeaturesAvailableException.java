package com.market.anomaly.exception;

import java.util.List;

public class NoFeaturesAvailableException extends AnomalyDetectionException {

    public NoFeaturesAvailableException(List<String> availableColumns) {
        super("No recognized feature columns available for the model. Table columns: " + availableColumns);
    }
}
