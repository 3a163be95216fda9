package com.stockforecast.backend.exception;

import java.util.List;

public class ModelNotFoundException extends ForecastException {

    private final String symbol;
    private final List<String> availableSymbols;

    public ModelNotFoundException(String symbol, List<String> availableSymbols) {
        this(symbol, availableSymbols, "No model found for symbol '" + symbol + "'", null);
    }

    public ModelNotFoundException(String symbol, List<String> availableSymbols, String reason, Throwable cause) {
        super(ErrorKind.MODEL_NOT_FOUND, reason + ". Available: " + availableSymbols, cause);
        this.symbol = symbol;
        this.availableSymbols = List.copyOf(availableSymbols);
    }

    public String getSymbol() {
        return symbol;
    }

    public List<String> getAvailableSymbols() {
        return availableSymbols;
    }
}
