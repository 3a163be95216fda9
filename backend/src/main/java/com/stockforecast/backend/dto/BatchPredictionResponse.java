package com.stockforecast.backend.dto;

import com.stockforecast.backend.forecast.batch.BatchItemResult;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class BatchPredictionResponse {
    int totalSymbols;
    int successful;
    int failed;
    int concurrency;
    List<BatchItemResult> results;
    double totalExecutionTimeMs;
    Instant timestamp;
}
