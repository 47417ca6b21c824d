package com.market.anomaly.model;

/**
 * How a scoring call ended.
 */
public enum ScoringOutcome {
    /** At least one row was scored by the classifier. */
    SCORED,
    /** No row survived preparation; scored columns are NaN everywhere. */
    NOTHING_SCORABLE,
    /** Inference failed; scored columns are 0 everywhere. */
    DEGRADED
}
