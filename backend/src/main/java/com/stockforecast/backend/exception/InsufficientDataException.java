package com.stockforecast.backend.exception;

public class InsufficientDataException extends ForecastException {

    private final String symbol;
    private final int requiredLength;
    private final int actualLength;

    public InsufficientDataException(String symbol, int requiredLength, int actualLength) {
        super(ErrorKind.INSUFFICIENT_DATA,
                "Need at least " + requiredLength + " recent prices for " + symbol + ", got " + actualLength);
        this.symbol = symbol;
        this.requiredLength = requiredLength;
        this.actualLength = actualLength;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getRequiredLength() {
        return requiredLength;
    }

    public int getActualLength() {
        return actualLength;
    }
}
