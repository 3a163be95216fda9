package com.stockforecast.backend.forecast.registry;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SectorCoverage {
    int totalStocks;
    int trainedModels;
    List<String> availableStocks;
    List<String> missingStocks;
}
