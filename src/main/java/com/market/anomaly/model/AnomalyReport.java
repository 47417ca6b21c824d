package com.market.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Summary of the anomalies detected in a scored table")
public class AnomalyReport {

    @Schema(description = "Failure message when the analysis could not be completed; null otherwise")
    private String error;

    @Schema(description = "Number of rows predicted anomalous", example = "12")
    private int totalAnomalies;

    @Schema(description = "Anomalous rows as a percentage of all rows", example = "4.8")
    private double anomalyPercentage;

    @Schema(description = "Anomaly count per calendar year")
    private Map<Integer, Long> anomaliesByYear;

    @Schema(description = "Mean return over anomalous rows; null when unavailable")
    private Double meanReturn;

    @Schema(description = "Mean volatility over anomalous rows; null when unavailable")
    private Double meanVolatility;

    @Schema(description = "Most severe anomalies, highest severity first")
    private List<AnomalyEvent> topAnomalies;

    public static AnomalyReport failed(String error) {
        return AnomalyReport.builder()
                .error(error)
                .totalAnomalies(0)
                .anomalyPercentage(0.0)
                .anomaliesByYear(Collections.emptyMap())
                .topAnomalies(Collections.emptyList())
                .build();
    }

    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }
}
