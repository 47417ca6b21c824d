package com.market.anomaly.controller;

import com.market.anomaly.dataset.FeatureTableCsvReader;
import com.market.anomaly.exception.LabelColumnMissingException;
import com.market.anomaly.exception.ModelFileNotFoundException;
import com.market.anomaly.exception.ModelNotTrainedException;
import com.market.anomaly.model.TrainedModel;
import com.market.anomaly.model.TrainingParameters;
import com.market.anomaly.service.AnomalyDetectionService;
import com.market.anomaly.testutil.StubClassifier;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ModelController.class)
@Import(FeatureTableCsvReader.class)
class ModelControllerTest {

    private static final String CSV = "date,return,rsi,anomaly\n2024-01-02,0.5,50,0\n2024-01-03,9.0,80,1\n";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnomalyDetectionService detectionService;

    private static TrainedModel model() {
        Map<String, Double> importances = new LinkedHashMap<>();
        importances.put("return", 0.7);
        importances.put("rsi", 0.3);
        return TrainedModel.builder()
                .classifier(StubClassifier.constant(0.0, 0.7, 0.3))
                .activeFeatures(List.of("return", "rsi"))
                .featureImportances(importances)
                .trainingRows(2)
                .anomalousRows(1)
                .build();
    }

    @Test
    void train_success_returnsMetadata() throws Exception {
        when(detectionService.defaultTrainingParameters()).thenReturn(TrainingParameters.builder().build());
        when(detectionService.train(any(), any())).thenReturn(model());

        mockMvc.perform(post("/api/v1/models/train").contentType("text/csv").content(CSV)
                        .param("numTrees", "25"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeFeatures[0]").value("return"))
                .andExpect(jsonPath("$.featureImportances['return']").value(0.7))
                .andExpect(jsonPath("$.anomalousRows").value(1));

        ArgumentCaptor<TrainingParameters> parameters = ArgumentCaptor.forClass(TrainingParameters.class);
        verify(detectionService).train(any(), parameters.capture());
        assertThat(parameters.getValue().getNumTrees()).isEqualTo(25);
        assertThat(parameters.getValue().getMaxDepth()).isEqualTo(10);
    }

    @Test
    void train_missingLabel_badRequest() throws Exception {
        when(detectionService.defaultTrainingParameters()).thenReturn(TrainingParameters.builder().build());
        when(detectionService.train(any(), any())).thenThrow(new LabelColumnMissingException("anomaly"));

        mockMvc.perform(post("/api/v1/models/train").contentType("text/csv").content(CSV))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void train_malformedCsv_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/models/train").contentType("text/csv").content("date,rsi\nnot-a-date,1\n"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void getModelMetadata_found() throws Exception {
        when(detectionService.getCurrentModel()).thenReturn(Optional.of(model()));

        mockMvc.perform(get("/api/v1/models"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.trainingRows").value(2));
    }

    @Test
    void getModelMetadata_notFound() throws Exception {
        when(detectionService.getCurrentModel()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/models"))
                .andExpect(status().isNotFound());
    }

    @Test
    void save_withoutModel_conflict() throws Exception {
        when(detectionService.defaultModelPath()).thenReturn(Path.of("data/anomaly-model.json"));
        doThrow(new ModelNotTrainedException()).when(detectionService).saveModel(any(Path.class));

        mockMvc.perform(post("/api/v1/models/save"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void save_ioFailure_internalError() throws Exception {
        doThrow(new UncheckedIOException("disk full", new IOException("disk full")))
                .when(detectionService).saveModel(any(Path.class));

        mockMvc.perform(post("/api/v1/models/save").param("path", "out/model.json"))
                .andExpect(status().isInternalServerError());
    }

    @Test
    void save_explicitPath() throws Exception {
        mockMvc.perform(post("/api/v1/models/save").param("path", "out/model.json"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("saved"));

        verify(detectionService).saveModel(Path.of("out/model.json"));
    }

    @Test
    void load_missingFile_notFound() throws Exception {
        when(detectionService.loadModel(any(Path.class)))
                .thenThrow(new ModelFileNotFoundException(Path.of("absent.json")));

        mockMvc.perform(post("/api/v1/models/load").param("path", "absent.json"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value(containsString("absent.json")))
                .andExpect(jsonPath("$.path").value("absent.json"));
    }

    @Test
    void load_success_returnsMetadata() throws Exception {
        when(detectionService.loadModel(any(Path.class))).thenReturn(model());

        mockMvc.perform(post("/api/v1/models/load").param("path", "models/m.json"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeFeatures.length()").value(2));
    }
}
