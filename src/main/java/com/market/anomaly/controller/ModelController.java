package com.market.anomaly.controller;

import com.market.anomaly.dataset.FeatureTableCsvReader;
import com.market.anomaly.engine.table.FeatureTable;
import com.market.anomaly.exception.LabelColumnMissingException;
import com.market.anomaly.exception.ModelFileNotFoundException;
import com.market.anomaly.exception.ModelNotTrainedException;
import com.market.anomaly.exception.NoFeaturesAvailableException;
import com.market.anomaly.model.TrainedModel;
import com.market.anomaly.model.TrainingParameters;
import com.market.anomaly.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/models")
@Tag(name = "Models", description = "Anomaly model training, persistence and metadata")
public class ModelController {

    private final AnomalyDetectionService detectionService;
    private final FeatureTableCsvReader csvReader;

    public ModelController(AnomalyDetectionService detectionService,
                           FeatureTableCsvReader csvReader) {
        this.detectionService = detectionService;
        this.csvReader = csvReader;
    }

    @Operation(summary = "Train the anomaly model",
            description = "Trains a class-balanced random forest on a labelled feature CSV. The first column is the date; " +
                    "column 'anomaly' holds the 0/1 label. The trained model replaces the current one.")
    @PostMapping(value = "/train", consumes = "text/csv")
    public ResponseEntity<Map<String, Object>> train(
            @RequestBody String csv,
            @Parameter(description = "Number of trees", example = "100")
            @RequestParam(required = false) Integer numTrees,
            @Parameter(description = "Maximum tree depth", example = "10")
            @RequestParam(required = false) Integer maxDepth) {
        try {
            FeatureTable table = csvReader.read(csv);
            TrainingParameters parameters = detectionService.defaultTrainingParameters();
            if (numTrees != null) parameters.setNumTrees(numTrees);
            if (maxDepth != null) parameters.setMaxDepth(maxDepth);

            TrainedModel model = detectionService.train(table, parameters);
            return ResponseEntity.ok(metadata(model));
        } catch (LabelColumnMissingException | NoFeaturesAvailableException | IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @Operation(summary = "Get current model metadata",
            description = "Returns the active features, importance ranking and training statistics of the current model.")
    @GetMapping
    public ResponseEntity<?> getModelMetadata() {
        return detectionService.getCurrentModel()
                .<ResponseEntity<?>>map(model -> ResponseEntity.ok(metadata(model)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @Operation(summary = "Save the current model",
            description = "Writes the current model as one JSON document. Missing directories are created.")
    @PostMapping("/save")
    public ResponseEntity<Map<String, Object>> save(
            @Parameter(description = "Target file; defaults to anomaly.storage.model-path")
            @RequestParam(required = false) String path) {
        Path target = path != null ? Path.of(path) : detectionService.defaultModelPath();
        try {
            detectionService.saveModel(target);
            return ResponseEntity.ok(Map.of("status", "saved", "path", target.toString()));
        } catch (ModelNotTrainedException e) {
            return ResponseEntity.status(409).body(Map.of("error", e.getMessage()));
        } catch (UncheckedIOException e) {
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Load a saved model",
            description = "Restores a model written by /save and makes it the current model.")
    @PostMapping("/load")
    public ResponseEntity<Map<String, Object>> load(
            @Parameter(description = "Model file; defaults to anomaly.storage.model-path")
            @RequestParam(required = false) String path) {
        Path source = path != null ? Path.of(path) : detectionService.defaultModelPath();
        try {
            TrainedModel model = detectionService.loadModel(source);
            return ResponseEntity.ok(metadata(model));
        } catch (ModelFileNotFoundException e) {
            return ResponseEntity.status(404).body(Map.of("error", e.getMessage(), "path", e.getPath().toString()));
        } catch (UncheckedIOException e) {
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    private static Map<String, Object> metadata(TrainedModel model) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("activeFeatures", model.getActiveFeatures());
        metadata.put("featureImportances", model.getFeatureImportances());
        metadata.put("trainingRows", model.getTrainingRows());
        metadata.put("anomalousRows", model.getAnomalousRows());
        metadata.put("trainedAt", model.getTrainedAt());
        return metadata;
    }
}
