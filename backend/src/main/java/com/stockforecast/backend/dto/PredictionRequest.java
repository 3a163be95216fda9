package com.stockforecast.backend.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictionRequest {

    @NotBlank
    private String symbol;

    /** One of 1d, 5d, 10d, 30d; defaults to 10d. */
    private String horizon;

    @NotEmpty
    @JsonAlias("recent_prices")
    private List<@NotNull Double> recentPrices;
}
