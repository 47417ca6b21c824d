package com.market.anomaly.config;

import com.market.anomaly.model.TrainingParameters;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly")
public class AnomalyModelConfig {

    private Model model = new Model();

    private Scoring scoring = new Scoring();

    private Analytics analytics = new Analytics();

    private Storage storage = new Storage();

    @Data
    public static class Model {
        // Ensemble size
        private int numTrees = 100;
        private int maxDepth = 10;
        private int minSamplesSplit = 2;
        private long randomSeed = 42;
        // Anomalous when P(anomaly) is strictly above this
        private double decisionThreshold = 0.5;

        public TrainingParameters toParameters() {
            return TrainingParameters.builder()
                    .numTrees(numTrees)
                    .maxDepth(maxDepth)
                    .minSamplesSplit(minSamplesSplit)
                    .randomSeed(randomSeed)
                    .decisionThreshold(decisionThreshold)
                    .build();
        }
    }

    @Data
    public static class Scoring {
        // severity = P(anomaly) * |return| / severityNormalizer
        private double severityNormalizer = 5.0;
    }

    @Data
    public static class Analytics {
        private int topEvents = 5;
    }

    @Data
    public static class Storage {
        private String modelPath = "data/anomaly-model.json";
        // Load modelPath at startup when the file exists
        private boolean loadOnStartup = false;
    }
}
