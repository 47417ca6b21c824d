package com.market.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A single detected anomaly, summarized for alerting")
public class AnomalyEvent {

    @Schema(description = "Trading day", example = "2024-03-05")
    private LocalDate date;

    @JsonProperty("return")
    @Schema(description = "Period return, null when the column is absent or not numeric", example = "-7.4")
    private Double returnValue;

    @Schema(description = "Relative volume, null when the column is absent or not numeric", example = "3.1")
    private Double relativeVolume;

    @Schema(description = "Anomaly severity", example = "1.32")
    private Double severity;
}
