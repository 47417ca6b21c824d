package com.market.anomaly.testutil;

import com.market.anomaly.engine.classifier.AnomalyClassifier;

import java.util.function.ToDoubleFunction;

/**
 * Deterministic classifier for engine tests: probability is a fixed function of the row.
 */
public class StubClassifier implements AnomalyClassifier {

    private final ToDoubleFunction<double[]> probability;
    private final double[] importances;
    private final RuntimeException failure;
    private RuntimeException fitFailure;

    private int fitCalls;
    private int lastFitRows;

    private StubClassifier(ToDoubleFunction<double[]> probability, double[] importances, RuntimeException failure) {
        this.probability = probability;
        this.importances = importances;
        this.failure = failure;
    }

    public static StubClassifier constant(double p, double... importances) {
        return new StubClassifier(row -> p, importances, null);
    }

    public static StubClassifier of(ToDoubleFunction<double[]> probability, double... importances) {
        return new StubClassifier(probability, importances, null);
    }

    /**
     * Fits normally but throws {@code failure} from every inference call.
     */
    public static StubClassifier failingInference(RuntimeException failure, double... importances) {
        return new StubClassifier(row -> 0.0, importances, failure);
    }

    /**
     * Throws {@code failure} from {@link #fit}.
     */
    public static StubClassifier failingFit(RuntimeException failure) {
        StubClassifier stub = new StubClassifier(row -> 0.0, new double[0], null);
        stub.fitFailure = failure;
        return stub;
    }

    @Override
    public void fit(double[][] features, int[] labels) {
        fitCalls++;
        if (fitFailure != null) throw fitFailure;
        lastFitRows = features.length;
    }

    @Override
    public int[] predict(double[][] features) {
        double[] p = predictProbability(features);
        int[] classes = new int[p.length];
        for (int i = 0; i < p.length; i++) classes[i] = p[i] > 0.5 ? 1 : 0;
        return classes;
    }

    @Override
    public double[] predictProbability(double[][] features) {
        if (failure != null) throw failure;
        double[] p = new double[features.length];
        for (int i = 0; i < features.length; i++) p[i] = probability.applyAsDouble(features[i]);
        return p;
    }

    @Override
    public double[] featureImportances() {
        return importances.clone();
    }

    public int getFitCalls() {
        return fitCalls;
    }

    public int getLastFitRows() {
        return lastFitRows;
    }
}
