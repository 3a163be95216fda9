package com.stockforecast.backend.exception;

public class InvalidPriceException extends ForecastException {

    private final double price;
    private final int position;

    public InvalidPriceException(double price, int position, String reason) {
        super(ErrorKind.INVALID_PRICE, "Invalid price " + price + " at position " + position + ": " + reason);
        this.price = price;
        this.position = position;
    }

    public double getPrice() {
        return price;
    }

    public int getPosition() {
        return position;
    }
}
