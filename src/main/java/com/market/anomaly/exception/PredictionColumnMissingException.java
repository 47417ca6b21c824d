package com.market.anomaly.exception;

public class PredictionColumnMissingException extends AnomalyDetectionException {

    public PredictionColumnMissingException(String predictionColumn) {
        super("Prediction column '" + predictionColumn + "' not found in the data");
    }
}
