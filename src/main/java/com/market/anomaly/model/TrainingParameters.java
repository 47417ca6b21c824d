package com.market.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingParameters {

    @Builder.Default
    private int numTrees = 100;

    @Builder.Default
    private int maxDepth = 10;

    @Builder.Default
    private int minSamplesSplit = 2;

    @Builder.Default
    private long randomSeed = 42L;

    @Builder.Default
    private double decisionThreshold = 0.5;
}
