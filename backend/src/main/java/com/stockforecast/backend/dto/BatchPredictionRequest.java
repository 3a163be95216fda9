package com.stockforecast.backend.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchPredictionRequest {

    @NotEmpty
    @Size(max = 100)
    private List<@NotBlank String> symbols;

    private String horizon;

    /** Series used for every symbol without its own entry in {@link #pricesBySymbol}. */
    @JsonAlias("recent_prices")
    private List<Double> recentPrices;

    @JsonAlias("prices_by_symbol")
    private Map<String, List<Double>> pricesBySymbol;

    @Min(1)
    @Max(64)
    @JsonAlias("max_concurrency")
    private Integer maxConcurrency;
}
