package com.market.anomaly.engine.table;

import java.util.List;

/**
 * Column names the engine understands.
 *
 * The recognized features are listed in their canonical order. Every preparation
 * presents active features in this order, so a model trained on a subset always
 * sees its columns in the same positions at inference time.
 */
public final class FeatureVocabulary {

    public static final String RETURN = "return";
    public static final String VOLATILITY = "volatility";
    public static final String RSI = "rsi";
    public static final String MACD = "macd";
    public static final String MACD_DIFF = "macd_diff";
    public static final String RELATIVE_VOLUME = "relative_volume";
    public static final String BOLLINGER_BAND_WIDTH = "bollinger_band_width";
    public static final String LOG_RETURN = "log_return";

    public static final List<String> RECOGNIZED = List.of(
            RETURN,
            VOLATILITY,
            RSI,
            MACD,
            MACD_DIFF,
            RELATIVE_VOLUME,
            BOLLINGER_BAND_WIDTH,
            LOG_RETURN
    );

    // Binary training target (0 = normal, 1 = anomalous)
    public static final String LABEL = "anomaly";

    // Columns appended by scoring
    public static final String PROBABILITY = "anomaly_probability";
    public static final String PREDICTION = "anomaly_prediction";
    public static final String SEVERITY = "anomaly_severity";

    public static final List<String> SCORED_COLUMNS = List.of(PROBABILITY, PREDICTION, SEVERITY);

    private FeatureVocabulary() {}
}
