package com.market.anomaly.exception;

/**
 * Fault raised while running inference. Never escapes {@code predict}: the scorer
 * catches it and degrades the output, keeping it on the result for diagnostics.
 */
public class ScoringFailureException extends AnomalyDetectionException {

    public ScoringFailureException(String message) {
        super(message);
    }

    public ScoringFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
