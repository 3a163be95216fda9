package com.stockforecast.backend.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class HealthResponse {
    /** healthy when at least one symbol can be served, degraded otherwise. */
    String status;
    String modelVersion;
    int specificModels;
    boolean generalModelLoaded;
    int generalModelSymbols;
    int totalCoverage;
    int cacheSize;
    int cacheCapacity;
    Instant timestamp;
}
