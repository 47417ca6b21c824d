package com.market.anomaly.service;

import com.market.anomaly.config.AnomalyModelConfig;
import com.market.anomaly.config.MetricsConfig;
import com.market.anomaly.engine.AnomalyScorer;
import com.market.anomaly.engine.AnomalyTrainer;
import com.market.anomaly.engine.prepare.FeaturePreparer;
import com.market.anomaly.engine.table.FeatureTable;
import com.market.anomaly.engine.table.FeatureVocabulary;
import com.market.anomaly.exception.LabelColumnMissingException;
import com.market.anomaly.exception.ModelFileNotFoundException;
import com.market.anomaly.exception.ModelNotTrainedException;
import com.market.anomaly.model.ScoringOutcome;
import com.market.anomaly.model.TrainedModel;
import com.market.anomaly.repository.AnomalyModelRepository;
import com.market.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnomalyDetectionServiceTest {

    @Mock
    private AnomalyModelRepository modelRepository;

    @Mock
    private MetricsConfig metrics;

    private AnomalyDetectionService service;

    @BeforeEach
    void setUp() {
        AnomalyModelConfig config = TestDataFactory.smallForestConfig();
        FeaturePreparer preparer = new FeaturePreparer();
        service = new AnomalyDetectionService(new AnomalyTrainer(preparer),
                new AnomalyScorer(preparer, config), modelRepository, config, metrics);
    }

    @Test
    void predict_beforeTraining_throwsModelNotTrained() {
        assertThatThrownBy(() -> service.predict(TestDataFactory.labelledMarketTable()))
                .isInstanceOf(ModelNotTrainedException.class);
        assertThat(service.getActiveFeatures()).isEmpty();
        assertThat(service.getFeatureImportances()).isNull();
    }

    @Test
    void trainThenPredict_appendsScoredColumns() {
        FeatureTable table = TestDataFactory.labelledMarketTable();

        TrainedModel model = service.train(table);
        FeatureTable scored = service.predict(table);

        assertThat(service.getActiveFeatures()).isEqualTo(model.getActiveFeatures());
        assertThat(service.getFeatureImportances()).hasSize(8);
        assertThat(scored.getColumnNames()).containsAll(FeatureVocabulary.SCORED_COLUMNS);
        assertThat(service.getLastOutcome()).contains(ScoringOutcome.SCORED);
        verify(metrics).recordTraining(100, 5, 8);
        verify(metrics).recordScoring(eq(ScoringOutcome.SCORED), eq(100), anyInt());
    }

    @Test
    void train_failure_keepsPreviousModel() {
        TrainedModel first = service.train(TestDataFactory.labelledMarketTable());
        FeatureTable unlabelled = FeatureTable.withIndex(TestDataFactory.dates(2))
                .column(FeatureVocabulary.RSI, 40.0, 60.0);

        assertThatThrownBy(() -> service.train(unlabelled))
                .isInstanceOf(LabelColumnMissingException.class);

        assertThat(service.getCurrentModel()).containsSame(first);
        verify(metrics).recordTrainingFailure();
    }

    @Test
    void trainAndPredict_failure_returnsZeroFilledCopy() {
        FeatureTable unlabelled = FeatureTable.withIndex(TestDataFactory.dates(3))
                .column(FeatureVocabulary.RSI, 40.0, 50.0, 60.0);

        FeatureTable result = service.trainAndPredict(unlabelled);

        for (String column : FeatureVocabulary.SCORED_COLUMNS) {
            assertThat(result.getColumn(column)).containsExactly(0.0, 0.0, 0.0);
        }
        assertThat(unlabelled.hasColumn(FeatureVocabulary.PROBABILITY)).isFalse();
        assertThat(service.getLastOutcome()).contains(ScoringOutcome.DEGRADED);
        assertThat(service.getCurrentModel()).isEmpty();
    }

    @Test
    void trainAndPredict_success_scoresEveryRow() {
        FeatureTable result = service.trainAndPredict(TestDataFactory.labelledMarketTable());

        assertThat(result.getColumn(FeatureVocabulary.PREDICTION)).doesNotContainNull();
        assertThat(service.getLastOutcome()).contains(ScoringOutcome.SCORED);
    }

    @Test
    void predict_nothingScorable_recordsOutcome() {
        service.train(TestDataFactory.labelledMarketTable());
        FeatureTable table = FeatureTable.withIndex(TestDataFactory.dates(2))
                .column(FeatureVocabulary.RSI, List.of("n/a", "n/a"));

        FeatureTable result = service.predict(table);

        assertThat(result.getDouble(FeatureVocabulary.PROBABILITY, 0)).isNaN();
        assertThat(service.getLastOutcome()).contains(ScoringOutcome.NOTHING_SCORABLE);
    }

    @Test
    void saveModel_withoutModel_throws() {
        assertThatThrownBy(() -> service.saveModel())
                .isInstanceOf(ModelNotTrainedException.class);
        verify(modelRepository, never()).save(any(), any());
    }

    @Test
    void saveModel_defaultsToConfiguredPath() {
        TrainedModel model = service.train(TestDataFactory.labelledMarketTable());

        service.saveModel();

        verify(modelRepository).save(model, Path.of("data/anomaly-model.json"));
    }

    @Test
    void loadModel_replacesCurrentModel() {
        TrainedModel trained = service.train(TestDataFactory.labelledMarketTable());
        TrainedModel stored = TrainedModel.builder()
                .classifier(trained.getClassifier())
                .activeFeatures(List.of(FeatureVocabulary.RETURN))
                .build();
        Path path = Path.of("models/m.json");
        when(modelRepository.load(path)).thenReturn(stored);

        service.loadModel(path);

        assertThat(service.getCurrentModel()).containsSame(stored);
        assertThat(service.getActiveFeatures()).containsExactly(FeatureVocabulary.RETURN);
        assertThat(service.getFeatureImportances()).isNull();
    }

    @Test
    void loadModel_missingFile_keepsCurrentModel() {
        TrainedModel trained = service.train(TestDataFactory.labelledMarketTable());
        Path path = Path.of("missing.json");
        when(modelRepository.load(path)).thenThrow(new ModelFileNotFoundException(path));

        assertThatThrownBy(() -> service.loadModel(path))
                .isInstanceOf(ModelFileNotFoundException.class);
        assertThat(service.getCurrentModel()).containsSame(trained);
    }
}
