package com.stockforecast.backend.dto;

import com.stockforecast.backend.forecast.registry.RegistryStats;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class StatsResponse {
    RegistryStats registry;
    List<String> cachedSymbols;
    String modelVersion;
    Instant timestamp;
}
