package com.market.anomaly.controller;

import com.market.anomaly.dataset.FeatureTableCsvReader;
import com.market.anomaly.exception.PredictionColumnMissingException;
import com.market.anomaly.model.AnomalyReport;
import com.market.anomaly.model.ModelEvaluation;
import com.market.anomaly.service.AnomalyAnalyticsService;
import com.market.anomaly.service.ModelEvaluationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/analytics")
@Tag(name = "Analytics", description = "Summaries and quality metrics for scored tables")
public class AnalyticsController {

    private final AnomalyAnalyticsService analyticsService;
    private final ModelEvaluationService evaluationService;
    private final FeatureTableCsvReader csvReader;

    public AnalyticsController(AnomalyAnalyticsService analyticsService,
                               ModelEvaluationService evaluationService,
                               FeatureTableCsvReader csvReader) {
        this.analyticsService = analyticsService;
        this.evaluationService = evaluationService;
        this.csvReader = csvReader;
    }

    @Operation(summary = "Summarize detected anomalies",
            description = "Counts, yearly breakdown, mean return/volatility and the five most severe anomalies of a scored CSV.")
    @PostMapping(value = "/report", consumes = "text/csv")
    public ResponseEntity<?> report(@RequestBody String csv) {
        try {
            AnomalyReport report = analyticsService.analyze(csvReader.read(csv));
            return ResponseEntity.ok(report);
        } catch (PredictionColumnMissingException | IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @Operation(summary = "Evaluate predictions against labels",
            description = "Precision, recall, F1 and confusion matrix for a scored CSV that also carries the 'anomaly' label.")
    @PostMapping(value = "/evaluation", consumes = "text/csv")
    public ResponseEntity<?> evaluate(@RequestBody String csv) {
        try {
            ModelEvaluation evaluation = evaluationService.evaluate(csvReader.read(csv));
            return ResponseEntity.ok(evaluation);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }
}
