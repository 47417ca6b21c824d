package com.market.anomaly.service;

import com.market.anomaly.config.AnomalyModelConfig;
import com.market.anomaly.config.MetricsConfig;
import com.market.anomaly.engine.AnomalyScorer;
import com.market.anomaly.engine.AnomalyTrainer;
import com.market.anomaly.engine.table.FeatureTable;
import com.market.anomaly.engine.table.FeatureVocabulary;
import com.market.anomaly.exception.ModelNotTrainedException;
import com.market.anomaly.model.ScoringOutcome;
import com.market.anomaly.model.ScoringResult;
import com.market.anomaly.model.TrainedModel;
import com.market.anomaly.model.TrainingParameters;
import com.market.anomaly.repository.AnomalyModelRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the current anomaly model and exposes train / predict / persist.
 *
 * One instance serves one caller at a time; there is no internal locking.
 * A failed training or load leaves the previous model in place.
 *
 * Every public entry point carries its own {@code @Observed}: calls between methods
 * of this class bypass the proxy, so only the outermost one is observed.
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final AnomalyTrainer trainer;
    private final AnomalyScorer scorer;
    private final AnomalyModelRepository modelRepository;
    private final AnomalyModelConfig config;
    private final MetricsConfig metrics;

    private volatile TrainedModel currentModel;
    private volatile List<String> activeFeatures = Collections.emptyList();
    private volatile ScoringOutcome lastOutcome;

    public AnomalyDetectionService(AnomalyTrainer trainer,
                                   AnomalyScorer scorer,
                                   AnomalyModelRepository modelRepository,
                                   AnomalyModelConfig config,
                                   MetricsConfig metrics) {
        this.trainer = trainer;
        this.scorer = scorer;
        this.modelRepository = modelRepository;
        this.config = config;
        this.metrics = metrics;
    }

    @Observed(name = "anomaly.train", contextualName = "train-anomaly-model")
    public TrainedModel train(FeatureTable table) {
        return train(table, defaultTrainingParameters());
    }

    /**
     * @return a fresh, mutable copy of the configured training parameters
     */
    public TrainingParameters defaultTrainingParameters() {
        return config.getModel().toParameters();
    }

    /**
     * Train on a labelled table and make the result the current model.
     */
    @Observed(name = "anomaly.train", contextualName = "train-anomaly-model")
    public TrainedModel train(FeatureTable table, TrainingParameters parameters) {
        TrainedModel model;
        try {
            model = trainer.train(table, parameters);
        } catch (RuntimeException e) {
            metrics.recordTrainingFailure();
            throw e;
        }
        replaceModel(model);
        metrics.recordTraining(model.getTrainingRows(), model.getAnomalousRows(), model.getActiveFeatures().size());
        return model;
    }

    /**
     * Score a table with the current model.
     *
     * @throws ModelNotTrainedException if no model has been trained or loaded
     */
    @Observed(name = "anomaly.predict", contextualName = "predict-anomalies")
    public FeatureTable predict(FeatureTable table) {
        return score(table).getTable();
    }

    @Observed(name = "anomaly.predict", contextualName = "predict-anomalies")
    public ScoringResult score(FeatureTable table) {
        TrainedModel model = currentModel;
        if (model == null) {
            log.error("Predict called before any model was trained or loaded");
            throw new ModelNotTrainedException();
        }
        ScoringResult result = scorer.score(model, table);
        if (!result.getActiveFeatures().isEmpty()) {
            activeFeatures = result.getActiveFeatures();
        }
        lastOutcome = result.getOutcome();
        metrics.recordScoring(result.getOutcome(), result.getScoredRows(), result.getDetectedAnomalies());
        return result;
    }

    /**
     * Train on the table, then score the same table. Never throws: any failure
     * yields a copy of the input with all scored columns set to 0.
     */
    @Observed(name = "anomaly.train-and-predict", contextualName = "train-and-predict-anomalies")
    public FeatureTable trainAndPredict(FeatureTable table) {
        try {
            train(table);
            return predict(table);
        } catch (RuntimeException e) {
            log.error("Train-and-predict failed; returning default scores for {} rows", table.rowCount(), e);
            lastOutcome = ScoringOutcome.DEGRADED;
            metrics.recordScoring(ScoringOutcome.DEGRADED, 0, 0);
            FeatureTable fallback = table.copy();
            for (String column : FeatureVocabulary.SCORED_COLUMNS) {
                fallback.fillColumn(column, 0.0);
            }
            return fallback;
        }
    }

    public void saveModel() {
        saveModel(defaultModelPath());
    }

    /**
     * @throws ModelNotTrainedException if there is nothing to save
     */
    public void saveModel(Path path) {
        TrainedModel model = currentModel;
        if (model == null) {
            throw new ModelNotTrainedException();
        }
        modelRepository.save(model, path);
    }

    public TrainedModel loadModel() {
        return loadModel(defaultModelPath());
    }

    /**
     * @throws com.market.anomaly.exception.ModelFileNotFoundException if the file does not exist
     */
    public TrainedModel loadModel(Path path) {
        TrainedModel model = modelRepository.load(path);
        replaceModel(model);
        log.info("Anomaly model loaded from {} with features {}", path, model.getActiveFeatures());
        return model;
    }

    public Optional<TrainedModel> getCurrentModel() {
        return Optional.ofNullable(currentModel);
    }

    /**
     * @return features used by the most recent training, load or successful preparation
     */
    public List<String> getActiveFeatures() {
        return activeFeatures;
    }

    /**
     * @return importance ranking of the current model, or {@code null} when unavailable
     */
    public Map<String, Double> getFeatureImportances() {
        TrainedModel model = currentModel;
        return model == null ? null : model.getFeatureImportances();
    }

    public Optional<ScoringOutcome> getLastOutcome() {
        return Optional.ofNullable(lastOutcome);
    }

    public Path defaultModelPath() {
        return Path.of(config.getStorage().getModelPath());
    }

    private void replaceModel(TrainedModel model) {
        this.currentModel = model;
        this.activeFeatures = model.getActiveFeatures();
        metrics.updateActiveFeatureCount(model.getActiveFeatures().size());
    }
}
