package com.stockforecast.backend.forecast.registry;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RegistryStats {
    long totalRequests;
    long cacheHits;
    long cacheMisses;
    long specificRequests;
    long generalRequests;
    long modelsLoaded;
    long notFound;
    long loadFailures;
    long evictions;
    /** cacheHits / max(1, totalRequests), in [0, 1]. */
    double hitRate;
    int cacheSize;
    int cacheCapacity;
    int specificModels;
    int generalModelSymbols;
    int totalCoverage;
    boolean generalModelLoaded;
}
