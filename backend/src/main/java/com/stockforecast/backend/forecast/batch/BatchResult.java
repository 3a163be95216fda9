package com.stockforecast.backend.forecast.batch;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class BatchResult {
    /** One slot per requested symbol, in request order. */
    List<BatchItemResult> results;
    int successCount;
    int failureCount;
    double totalDurationMs;
}
