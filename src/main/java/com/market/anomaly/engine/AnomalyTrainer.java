package com.market.anomaly.engine;

import com.market.anomaly.engine.classifier.AnomalyClassifier;
import com.market.anomaly.engine.classifier.RandomForestClassifier;
import com.market.anomaly.engine.prepare.FeaturePreparer;
import com.market.anomaly.engine.prepare.PreparedFeatures;
import com.market.anomaly.engine.table.FeatureTable;
import com.market.anomaly.engine.table.FeatureVocabulary;
import com.market.anomaly.exception.LabelColumnMissingException;
import com.market.anomaly.model.TrainedModel;
import com.market.anomaly.model.TrainingParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Fits an {@link AnomalyClassifier} on a labelled feature table.
 */
@Component
public class AnomalyTrainer {

    private static final Logger log = LoggerFactory.getLogger(AnomalyTrainer.class);

    private final FeaturePreparer preparer;
    private final Function<TrainingParameters, AnomalyClassifier> classifierFactory;

    @Autowired
    public AnomalyTrainer(FeaturePreparer preparer) {
        this(preparer, AnomalyTrainer::randomForest);
    }

    public AnomalyTrainer(FeaturePreparer preparer,
                          Function<TrainingParameters, AnomalyClassifier> classifierFactory) {
        this.preparer = preparer;
        this.classifierFactory = classifierFactory;
    }

    /**
     * Train a new model. Nothing is retained on failure; the caller keeps whatever
     * model it had before.
     *
     * @throws LabelColumnMissingException if the table has no label column
     * @throws com.market.anomaly.exception.NoFeaturesAvailableException if no recognized feature is present
     * @throws IllegalArgumentException if fitting fails (for example no usable rows remain)
     */
    public TrainedModel train(FeatureTable table, TrainingParameters parameters) {
        log.info("Training anomaly detection model on {} rows...", table.rowCount());

        if (!table.hasColumn(FeatureVocabulary.LABEL)) {
            log.error("Column '{}' not found in the data", FeatureVocabulary.LABEL);
            throw new LabelColumnMissingException(FeatureVocabulary.LABEL);
        }

        PreparedFeatures prepared = preparer.prepare(table, true);
        List<String> features = prepared.getActiveFeatures();
        int[] labels = prepared.getLabels();

        AnomalyClassifier classifier = classifierFactory.apply(parameters);
        Map<String, Double> ranking;
        try {
            classifier.fit(prepared.getMatrix(), labels);
            ranking = rankImportances(features, classifier.featureImportances());
        } catch (RuntimeException e) {
            log.error("Failed to train anomaly model on {} prepared rows with features {}",
                    prepared.rowCount(), features, e);
            throw e;
        }

        int anomalous = prepared.positiveCount();
        log.info("Model trained on {} samples ({} dropped). Class distribution: normal={}, anomalous={}",
                prepared.rowCount(), prepared.droppedRowCount(), prepared.rowCount() - anomalous, anomalous);

        TrainedModel model = TrainedModel.builder()
                .classifier(classifier)
                .activeFeatures(features)
                .featureImportances(ranking)
                .trainedAt(System.currentTimeMillis())
                .trainingRows(prepared.rowCount())
                .anomalousRows(anomalous)
                .build();

        log.info("Top 3 important features: {}", model.topImportances(3));
        return model;
    }

    static Map<String, Double> rankImportances(List<String> features, double[] importances) {
        if (importances.length != features.size()) {
            throw new IllegalStateException(String.format(
                    "Classifier reported %d importances for %d features", importances.length, features.size()));
        }
        List<Integer> order = new ArrayList<>(features.size());
        for (int i = 0; i < features.size(); i++) order.add(i);
        // Stable sort: ties keep vocabulary order
        order.sort(Comparator.comparingDouble((Integer i) -> importances[i]).reversed());

        Map<String, Double> ranking = new LinkedHashMap<>();
        for (int i : order) {
            ranking.put(features.get(i), importances[i]);
        }
        return ranking;
    }

    private static AnomalyClassifier randomForest(TrainingParameters p) {
        return new RandomForestClassifier(p.getNumTrees(), p.getMaxDepth(), p.getMinSamplesSplit(),
                p.getRandomSeed(), p.getDecisionThreshold());
    }
}
