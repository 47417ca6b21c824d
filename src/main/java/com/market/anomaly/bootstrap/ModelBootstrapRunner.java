package com.market.anomaly.bootstrap;

import com.market.anomaly.config.AnomalyModelConfig;
import com.market.anomaly.repository.AnomalyModelRepository;
import com.market.anomaly.service.AnomalyDetectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Restores the persisted model at startup when
 * {@code anomaly.storage.load-on-startup} is set and the file exists.
 */
@Component
public class ModelBootstrapRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ModelBootstrapRunner.class);

    private final AnomalyModelConfig config;
    private final AnomalyModelRepository modelRepository;
    private final AnomalyDetectionService detectionService;

    public ModelBootstrapRunner(AnomalyModelConfig config,
                                AnomalyModelRepository modelRepository,
                                AnomalyDetectionService detectionService) {
        this.config = config;
        this.modelRepository = modelRepository;
        this.detectionService = detectionService;
    }

    @Override
    public void run(String... args) {
        if (!config.getStorage().isLoadOnStartup()) {
            return;
        }
        Path path = detectionService.defaultModelPath();
        if (!modelRepository.exists(path)) {
            log.warn("No saved anomaly model at {}; train one via POST /api/v1/models/train", path);
            return;
        }
        detectionService.loadModel(path);
    }
}
