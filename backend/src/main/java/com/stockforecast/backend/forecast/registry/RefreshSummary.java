package com.stockforecast.backend.forecast.registry;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class RefreshSummary {
    int specificModels;
    int generalModelSymbols;
    int totalCoverage;
    boolean generalReloaded;
    /** Reason the general artifact could not be reloaded; null when it was or when no pool is configured. */
    String generalError;
    /** Cache keys dropped because their artifact changed on disk or disappeared from the index. */
    List<String> invalidatedKeys;
    List<String> specificSymbols;
    Instant refreshedAt;
}
