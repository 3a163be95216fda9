package com.stockforecast.backend.forecast.batch;

import java.util.List;

/**
 * Supplies the recent price history for one symbol of a batch. Any exception thrown here is
 * recorded against that symbol only.
 */
@FunctionalInterface
public interface PriceProvider {

    List<Double> recentPrices(String symbol);

    static PriceProvider shared(List<Double> prices) {
        return symbol -> prices;
    }
}
