package com.stockforecast.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.stockforecast.backend.forecast.registry.SectorCoverage;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelsAvailableResponse {
    List<String> specificModels;
    int specificModelCount;
    int generalModelSymbols;
    int totalCoverage;
    List<String> allSymbols;
    List<String> cachedSymbols;
    int cacheCapacity;
    Map<String, SectorCoverage> sectors;
}
