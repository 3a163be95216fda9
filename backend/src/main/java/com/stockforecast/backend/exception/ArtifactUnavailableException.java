package com.stockforecast.backend.exception;

public class ArtifactUnavailableException extends ForecastException {
    public ArtifactUnavailableException(String message) {
        super(ErrorKind.ARTIFACT_UNAVAILABLE, message);
    }

    public ArtifactUnavailableException(String message, Throwable cause) {
        super(ErrorKind.ARTIFACT_UNAVAILABLE, message, cause);
    }
}
