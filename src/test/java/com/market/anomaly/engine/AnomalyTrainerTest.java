package com.market.anomaly.engine;

import com.market.anomaly.engine.prepare.FeaturePreparer;
import com.market.anomaly.engine.table.FeatureTable;
import com.market.anomaly.engine.table.FeatureVocabulary;
import com.market.anomaly.exception.LabelColumnMissingException;
import com.market.anomaly.exception.NoFeaturesAvailableException;
import com.market.anomaly.model.TrainedModel;
import com.market.anomaly.model.TrainingParameters;
import com.market.anomaly.testutil.StubClassifier;
import com.market.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnomalyTrainerTest {

    private final FeaturePreparer preparer = new FeaturePreparer();

    @Test
    void train_withoutLabelColumn_throwsBeforeFitting() {
        StubClassifier stub = StubClassifier.constant(0.0);
        AnomalyTrainer trainer = new AnomalyTrainer(preparer, p -> stub);
        FeatureTable table = FeatureTable.withIndex(TestDataFactory.dates(3))
                .column(FeatureVocabulary.RETURN, 1.0, 2.0, 3.0);

        assertThatThrownBy(() -> trainer.train(table, TrainingParameters.builder().build()))
                .isInstanceOf(LabelColumnMissingException.class)
                .hasMessageContaining(FeatureVocabulary.LABEL);
        assertThat(stub.getFitCalls()).isZero();
    }

    @Test
    void train_noRecognizedFeatures_throws() {
        AnomalyTrainer trainer = new AnomalyTrainer(preparer, p -> StubClassifier.constant(0.0));
        FeatureTable table = FeatureTable.withIndex(TestDataFactory.dates(2))
                .column("close", 10.0, 11.0)
                .column(FeatureVocabulary.LABEL, 0.0, 1.0);

        assertThatThrownBy(() -> trainer.train(table, TrainingParameters.builder().build()))
                .isInstanceOf(NoFeaturesAvailableException.class);
    }

    @Test
    void train_ranksImportancesDescending() {
        StubClassifier stub = StubClassifier.constant(0.0, 0.1, 0.6, 0.3);
        AnomalyTrainer trainer = new AnomalyTrainer(preparer, p -> stub);
        FeatureTable table = FeatureTable.withIndex(TestDataFactory.dates(4))
                .column(FeatureVocabulary.RETURN, 0.1, -0.2, 5.0, 0.3)
                .column(FeatureVocabulary.VOLATILITY, 1.0, 1.1, 4.0, 0.9)
                .column(FeatureVocabulary.RSI, 45.0, 50.0, 80.0, 55.0)
                .column(FeatureVocabulary.LABEL, 0.0, 0.0, 1.0, 0.0);

        TrainedModel model = trainer.train(table, TrainingParameters.builder().build());

        assertThat(model.getActiveFeatures())
                .containsExactly(FeatureVocabulary.RETURN, FeatureVocabulary.VOLATILITY, FeatureVocabulary.RSI);
        assertThat(model.getFeatureImportances().keySet())
                .containsExactly(FeatureVocabulary.VOLATILITY, FeatureVocabulary.RSI, FeatureVocabulary.RETURN);
        assertThat(model.getTrainingRows()).isEqualTo(4);
        assertThat(model.getAnomalousRows()).isEqualTo(1);
        assertThat(stub.getLastFitRows()).isEqualTo(4);
    }

    @Test
    void train_fitFailure_propagates() {
        StubClassifier failing = StubClassifier.failingFit(new IllegalArgumentException("cannot fit"));
        AnomalyTrainer trainer = new AnomalyTrainer(preparer, p -> failing);

        assertThatThrownBy(() -> trainer.train(TestDataFactory.labelledMarketTable(), TrainingParameters.builder().build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("fit");
    }

    @Test
    void train_allRowsDropped_failsInsteadOfReturningModel() {
        AnomalyTrainer trainer = new AnomalyTrainer(preparer);
        FeatureTable table = FeatureTable.withIndex(TestDataFactory.dates(2))
                .column(FeatureVocabulary.RETURN, List.of("n/a", "n/a"))
                .column(FeatureVocabulary.LABEL, 0.0, 1.0);

        assertThatThrownBy(() -> trainer.train(table, TestDataFactory.smallForest()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void train_realForest_onMarketTable() {
        AnomalyTrainer trainer = new AnomalyTrainer(preparer);

        TrainedModel model = trainer.train(TestDataFactory.labelledMarketTable(), TestDataFactory.smallForest());

        assertThat(model.getActiveFeatures()).containsExactlyElementsOf(FeatureVocabulary.RECOGNIZED);
        assertThat(model.getFeatureImportances()).hasSize(8);
        assertThat(model.getFeatureImportances().values().stream().mapToDouble(Double::doubleValue).sum())
                .isBetween(0.999, 1.001);
        assertThat(model.topImportances(3)).hasSize(3);
        assertThat(model.getAnomalousRows()).isEqualTo(5);
    }

    @Test
    void rankImportances_lengthMismatch_throws() {
        assertThatThrownBy(() -> AnomalyTrainer.rankImportances(List.of("a", "b"), new double[]{1.0}))
                .isInstanceOf(IllegalStateException.class);
    }
}
