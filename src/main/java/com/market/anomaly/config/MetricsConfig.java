package com.market.anomaly.config;

import com.market.anomaly.model.ScoringOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger activeFeatureCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.activeFeatureCount = registry.gauge("model.active.features", new AtomicInteger(0));
    }

    public void recordTraining(int rows, int anomalousRows, int featureCount) {
        Counter.builder("training.count")
                .register(registry)
                .increment();

        DistributionSummary.builder("training.samples")
                .register(registry)
                .record(rows);

        DistributionSummary.builder("training.anomalous_samples")
                .register(registry)
                .record(anomalousRows);

        activeFeatureCount.set(featureCount);
    }

    public void recordTrainingFailure() {
        Counter.builder("training.failure.count")
                .register(registry)
                .increment();
    }

    public void recordScoring(ScoringOutcome outcome, int scoredRows, int detectedAnomalies) {
        Counter.builder("scoring.outcome.count")
                .tag("outcome", outcome.name())
                .register(registry)
                .increment();

        if (outcome == ScoringOutcome.SCORED) {
            DistributionSummary.builder("scoring.rows")
                    .register(registry)
                    .record(scoredRows);

            Counter.builder("scoring.anomalies.count")
                    .register(registry)
                    .increment(detectedAnomalies);
        }
    }

    public void recordAnalyticsFailure() {
        Counter.builder("analytics.failure.count")
                .register(registry)
                .increment();
    }

    public void updateActiveFeatureCount(int count) {
        activeFeatureCount.set(count);
    }
}
