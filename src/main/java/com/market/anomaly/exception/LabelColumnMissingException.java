package com.market.anomaly.exception;

public class LabelColumnMissingException extends AnomalyDetectionException {

    public LabelColumnMissingException(String labelColumn) {
        super("Label column '" + labelColumn + "' not found in the data");
    }
}
