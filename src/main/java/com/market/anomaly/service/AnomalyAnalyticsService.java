package com.market.anomaly.service;

import com.market.anomaly.config.AnomalyModelConfig;
import com.market.anomaly.config.MetricsConfig;
import com.market.anomaly.engine.table.FeatureTable;
import com.market.anomaly.engine.table.FeatureVocabulary;
import com.market.anomaly.exception.PredictionColumnMissingException;
import com.market.anomaly.model.AnomalyEvent;
import com.market.anomaly.model.AnomalyReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Service
public class AnomalyAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyAnalyticsService.class);

    private final AnomalyModelConfig config;
    private final MetricsConfig metrics;

    public AnomalyAnalyticsService(AnomalyModelConfig config, MetricsConfig metrics) {
        this.config = config;
        this.metrics = metrics;
    }

    /**
     * Summarize the rows of a scored table predicted anomalous.
     * Only a missing prediction column is reported as an exception; any other
     * failure produces a report with {@code error} set and zero counts.
     *
     * @throws PredictionColumnMissingException if the table has no prediction column
     */
    public AnomalyReport analyze(FeatureTable scored) {
        log.info("Analyzing detected anomalies");

        if (!scored.hasColumn(FeatureVocabulary.PREDICTION)) {
            log.error("Column '{}' not found in the data", FeatureVocabulary.PREDICTION);
            throw new PredictionColumnMissingException(FeatureVocabulary.PREDICTION);
        }

        try {
            List<Integer> anomalous = new ArrayList<>();
            for (int row = 0; row < scored.rowCount(); row++) {
                if (scored.getDouble(FeatureVocabulary.PREDICTION, row) == 1.0) {
                    anomalous.add(row);
                }
            }

            int total = scored.rowCount();
            Map<Integer, Long> byYear = new TreeMap<>();
            for (int row : anomalous) {
                byYear.merge(scored.getDate(row).getYear(), 1L, Long::sum);
            }

            return AnomalyReport.builder()
                    .totalAnomalies(anomalous.size())
                    .anomalyPercentage(total > 0 ? anomalous.size() * 100.0 / total : 0.0)
                    .anomaliesByYear(byYear)
                    .meanReturn(mean(scored, FeatureVocabulary.RETURN, anomalous))
                    .meanVolatility(mean(scored, FeatureVocabulary.VOLATILITY, anomalous))
                    .topAnomalies(topEvents(scored, anomalous, config.getAnalytics().getTopEvents()))
                    .build();
        } catch (RuntimeException e) {
            log.error("Failed to analyze anomalies", e);
            metrics.recordAnalyticsFailure();
            return AnomalyReport.failed(String.valueOf(e.getMessage()));
        }
    }

    // null when the column is absent or holds no numeric value on the given rows
    private static Double mean(FeatureTable table, String column, List<Integer> rows) {
        if (!table.hasColumn(column)) return null;
        double sum = 0.0;
        int count = 0;
        for (int row : rows) {
            double v = table.getDouble(column, row);
            if (!Double.isNaN(v)) {
                sum += v;
                count++;
            }
        }
        return count > 0 ? sum / count : null;
    }

    private static List<AnomalyEvent> topEvents(FeatureTable table, List<Integer> anomalous, int limit) {
        List<AnomalyEvent> events = new ArrayList<>();
        if (!table.hasColumn(FeatureVocabulary.SEVERITY) || anomalous.isEmpty()) {
            return events;
        }

        // Highest severity first; rows without a severity go last, keeping table order on ties
        List<Integer> ordered = new ArrayList<>(anomalous);
        ordered.sort(Comparator.comparingDouble((Integer row) -> sortKey(table, row)).reversed());

        for (int row : ordered) {
            if (events.size() >= limit) break;
            events.add(AnomalyEvent.builder()
                    .date(table.getDate(row))
                    .returnValue(valueOrNull(table, FeatureVocabulary.RETURN, row))
                    .relativeVolume(valueOrNull(table, FeatureVocabulary.RELATIVE_VOLUME, row))
                    .severity(valueOrNull(table, FeatureVocabulary.SEVERITY, row))
                    .build());
        }
        return events;
    }

    private static double sortKey(FeatureTable table, int row) {
        double severity = table.getDouble(FeatureVocabulary.SEVERITY, row);
        return Double.isNaN(severity) ? Double.NEGATIVE_INFINITY : severity;
    }

    private static Double valueOrNull(FeatureTable table, String column, int row) {
        if (!table.hasColumn(column)) return null;
        double v = table.getDouble(column, row);
        return Double.isNaN(v) ? null : v;
    }
}
