package com.stockforecast.backend.exception;

public class ArtifactCorruptException extends ForecastException {
    public ArtifactCorruptException(String message) {
        super(ErrorKind.ARTIFACT_CORRUPT, message);
    }

    public ArtifactCorruptException(String message, Throwable cause) {
        super(ErrorKind.ARTIFACT_CORRUPT, message, cause);
    }
}
