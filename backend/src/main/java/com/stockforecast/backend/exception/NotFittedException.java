package com.stockforecast.backend.exception;

public class NotFittedException extends ForecastException {
    public NotFittedException(String message) {
        super(ErrorKind.NOT_FITTED, message);
    }
}
