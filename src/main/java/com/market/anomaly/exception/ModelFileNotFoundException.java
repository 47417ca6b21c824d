package com.market.anomaly.exception;

import java.nio.file.Path;

public class ModelFileNotFoundException extends AnomalyDetectionException {

    private final Path path;

    public ModelFileNotFoundException(Path path) {
        super("Model file " + path + " does not exist");
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
