package com.stockforecast.backend.exception;

public enum ErrorKind {
    NOT_FITTED,
    INVALID_PRICE,
    ARTIFACT_MISSING,
    ARTIFACT_CORRUPT,
    ARTIFACT_UNAVAILABLE,
    MODEL_NOT_FOUND,
    INSUFFICIENT_DATA,
    PREDICTION_FAILED
}
