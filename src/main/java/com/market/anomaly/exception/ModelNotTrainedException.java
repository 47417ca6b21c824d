package com.market.anomaly.exception;

public class ModelNotTrainedException extends AnomalyDetectionException {

    public ModelNotTrainedException() {
        super("No anomaly model has been trained or loaded");
    }
}
