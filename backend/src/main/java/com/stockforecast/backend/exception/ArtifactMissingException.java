package com.stockforecast.backend.exception;

import java.nio.file.Path;

public class ArtifactMissingException extends ForecastException {

    private final Path path;

    public ArtifactMissingException(String what, Path path) {
        super(ErrorKind.ARTIFACT_MISSING, what + " not found: " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
