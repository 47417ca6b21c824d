package com.market.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Classification quality of predictions against known labels")
public class ModelEvaluation {

    @Schema(description = "Failure message when evaluation was not possible; null otherwise")
    private String error;

    @Schema(description = "Rows with both a label and a prediction", example = "250")
    private int evaluatedRows;

    private double precision;
    private double recall;
    private double f1Score;

    private int truePositives;
    private int falsePositives;
    private int trueNegatives;
    private int falseNegatives;

    @Schema(description = "Rows labelled anomalous", example = "12")
    private int actualAnomalies;

    @Schema(description = "Rows predicted anomalous", example = "15")
    private int detectedAnomalies;

    private double actualAnomalyPercentage;
    private double detectedAnomalyPercentage;

    public static ModelEvaluation failed(String error) {
        return ModelEvaluation.builder().error(error).build();
    }
}
