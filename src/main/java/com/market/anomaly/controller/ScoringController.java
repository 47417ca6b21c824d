package com.market.anomaly.controller;

import com.market.anomaly.dataset.FeatureTableCsvReader;
import com.market.anomaly.dataset.FeatureTableCsvWriter;
import com.market.anomaly.engine.table.FeatureTable;
import com.market.anomaly.exception.ModelNotTrainedException;
import com.market.anomaly.exception.NoFeaturesAvailableException;
import com.market.anomaly.model.ScoringOutcome;
import com.market.anomaly.model.ScoringResult;
import com.market.anomaly.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/scoring")
@Tag(name = "Scoring", description = "Anomaly probability, prediction and severity for feature tables")
public class ScoringController {

    public static final String OUTCOME_HEADER = "X-Scoring-Outcome";
    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final AnomalyDetectionService detectionService;
    private final FeatureTableCsvReader csvReader;
    private final FeatureTableCsvWriter csvWriter;

    public ScoringController(AnomalyDetectionService detectionService,
                             FeatureTableCsvReader csvReader,
                             FeatureTableCsvWriter csvWriter) {
        this.detectionService = detectionService;
        this.csvReader = csvReader;
        this.csvWriter = csvWriter;
    }

    @Operation(summary = "Score a feature table",
            description = "Returns the input CSV with anomaly_probability, anomaly_prediction and anomaly_severity appended. " +
                    "The X-Scoring-Outcome header tells SCORED, NOTHING_SCORABLE (columns empty) and DEGRADED (columns 0) apart.")
    @PostMapping(value = "/predict", consumes = "text/csv", produces = "text/csv")
    public ResponseEntity<String> predict(@RequestBody String csv) {
        try {
            ScoringResult result = detectionService.score(csvReader.read(csv));
            return ResponseEntity.ok()
                    .header(OUTCOME_HEADER, result.getOutcome().name())
                    .contentType(TEXT_CSV)
                    .body(csvWriter.write(result.getTable()));
        } catch (ModelNotTrainedException e) {
            return ResponseEntity.status(409).contentType(MediaType.TEXT_PLAIN).body(e.getMessage());
        } catch (NoFeaturesAvailableException | IllegalArgumentException e) {
            return ResponseEntity.badRequest().contentType(MediaType.TEXT_PLAIN).body(String.valueOf(e.getMessage()));
        }
    }

    @Operation(summary = "Train on a labelled table and score it",
            description = "Trains a new model and scores the same rows. Failures never surface: every scored column is 0 instead.")
    @PostMapping(value = "/train-and-predict", consumes = "text/csv", produces = "text/csv")
    public ResponseEntity<String> trainAndPredict(@RequestBody String csv) {
        FeatureTable table;
        try {
            table = csvReader.read(csv);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().contentType(MediaType.TEXT_PLAIN).body(String.valueOf(e.getMessage()));
        }
        FeatureTable scored = detectionService.trainAndPredict(table);
        ScoringOutcome outcome = detectionService.getLastOutcome().orElse(ScoringOutcome.DEGRADED);
        return ResponseEntity.ok()
                .header(OUTCOME_HEADER, outcome.name())
                .contentType(TEXT_CSV)
                .body(csvWriter.write(scored));
    }
}
