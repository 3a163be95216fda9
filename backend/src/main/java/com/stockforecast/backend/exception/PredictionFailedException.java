package com.stockforecast.backend.exception;

public class PredictionFailedException extends ForecastException {

    private final String symbol;

    public PredictionFailedException(String symbol, Throwable cause) {
        super(ErrorKind.PREDICTION_FAILED, "Prediction failed for " + symbol + ": " + cause.getMessage(), cause);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
