package com.stockforecast.backend.exception;

/**
 * Base type for every failure raised by the forecast serving core.
 * The {@link ErrorKind} is the stable identifier exposed to callers.
 */
public abstract class ForecastException extends RuntimeException {

    private final ErrorKind errorKind;

    protected ForecastException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    protected ForecastException(ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }
}
