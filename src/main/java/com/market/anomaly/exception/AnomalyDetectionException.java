package com.market.anomaly.exception;

/**
 * Base type for failures raised by the anomaly scoring engine.
 */
public class AnomalyDetectionException extends RuntimeException {

    public AnomalyDetectionException(String message) {
        super(message);
    }

    public AnomalyDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
