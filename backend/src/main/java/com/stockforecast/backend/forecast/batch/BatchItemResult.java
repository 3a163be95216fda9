package com.stockforecast.backend.forecast.batch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.stockforecast.backend.forecast.prediction.PredictionResult;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One slot of a batch: exactly one of {@code result} and {@code error} is set.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchItemResult {
    String symbol;
    PredictionResult result;
    ErrorRecord error;

    public static BatchItemResult success(String symbol, PredictionResult result) {
        return new BatchItemResult(symbol, result, null);
    }

    public static BatchItemResult failure(ErrorRecord error) {
        return new BatchItemResult(error.getSymbol(), null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
