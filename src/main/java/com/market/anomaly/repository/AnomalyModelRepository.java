package com.market.anomaly.repository;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.market.anomaly.exception.ModelFileNotFoundException;
import com.market.anomaly.model.TrainedModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Stores a {@link TrainedModel} as a single JSON document on the local filesystem.
 *
 * The document holds the classifier state, the ordered active features and the
 * importance ranking. Writes go straight to the target file; there is no
 * temp-file-and-rename step.
 */
@Repository
public class AnomalyModelRepository {

    private static final Logger log = LoggerFactory.getLogger(AnomalyModelRepository.class);

    private final ObjectMapper objectMapper;

    public AnomalyModelRepository() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @throws UncheckedIOException if the directory cannot be created or the file cannot be written
     */
    public void save(TrainedModel model, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), model);
            log.info("Saved anomaly model to {}: {} features, {} training rows",
                    path, model.getActiveFeatures().size(), model.getTrainingRows());
        } catch (IOException e) {
            log.error("Failed to save anomaly model to {}", path, e);
            throw new UncheckedIOException("Failed to save anomaly model to " + path, e);
        }
    }

    /**
     * @throws ModelFileNotFoundException if {@code path} does not exist
     * @throws UncheckedIOException       if the file cannot be read or is not a model document
     */
    public TrainedModel load(Path path) {
        if (!Files.exists(path)) {
            log.error("Model file {} does not exist", path);
            throw new ModelFileNotFoundException(path);
        }

        try {
            log.info("Loading anomaly model from {}", path);
            TrainedModel model = objectMapper.readValue(path.toFile(), TrainedModel.class);
            if (model.getClassifier() == null || model.getActiveFeatures() == null
                    || model.getActiveFeatures().isEmpty()) {
                throw new IOException("Model document is missing the classifier or its feature list");
            }
            if (model.getFeatureImportances() == null) {
                log.info("Model file {} carries no feature importance ranking", path);
            }
            return model;
        } catch (IOException e) {
            log.error("Failed to load anomaly model from {}", path, e);
            throw new UncheckedIOException("Failed to load anomaly model from " + path, e);
        }
    }

    public boolean exists(Path path) {
        return Files.isRegularFile(path);
    }
}
