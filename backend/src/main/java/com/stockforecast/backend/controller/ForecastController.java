package com.stockforecast.backend.controller;

import com.stockforecast.backend.config.ForecastProperties;
import com.stockforecast.backend.dto.BatchPredictionRequest;
import com.stockforecast.backend.dto.BatchPredictionResponse;
import com.stockforecast.backend.dto.CacheClearResponse;
import com.stockforecast.backend.dto.HealthResponse;
import com.stockforecast.backend.dto.ModelsAvailableResponse;
import com.stockforecast.backend.dto.PredictionRequest;
import com.stockforecast.backend.dto.StatsResponse;
import com.stockforecast.backend.forecast.batch.BatchPredictionCoordinator;
import com.stockforecast.backend.forecast.batch.BatchResult;
import com.stockforecast.backend.forecast.batch.PriceProvider;
import com.stockforecast.backend.forecast.prediction.Horizon;
import com.stockforecast.backend.forecast.prediction.PredictionResult;
import com.stockforecast.backend.forecast.prediction.PredictionService;
import com.stockforecast.backend.forecast.registry.ModelInfo;
import com.stockforecast.backend.forecast.registry.ModelRegistry;
import com.stockforecast.backend.forecast.registry.RefreshSummary;
import com.stockforecast.backend.forecast.registry.RegistryStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v4")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Forecast")
public class ForecastController {

    private final PredictionService predictionService;
    private final BatchPredictionCoordinator batchCoordinator;
    private final ModelRegistry modelRegistry;
    private final ForecastProperties properties;

    @PostMapping("/predict")
    @Operation(summary = "Predict the next price of one symbol",
            description = "Uses the symbol's dedicated model when one exists, otherwise the shared general model")
    @ApiResponse(responseCode = "200", description = "Prediction produced")
    @ApiResponse(responseCode = "400", description = "Too few recent prices or invalid request")
    @ApiResponse(responseCode = "404", description = "No model covers the symbol")
    public ResponseEntity<PredictionResult> predict(@Valid @RequestBody PredictionRequest request) {
        Horizon horizon = Horizon.fromTag(request.getHorizon());
        return ResponseEntity.ok(predictionService.predict(request.getSymbol(), horizon, request.getRecentPrices()));
    }

    @PostMapping("/predict/batch")
    @Operation(summary = "Predict several symbols concurrently",
            description = "Failures are reported per symbol; the call itself only fails on an invalid request")
    @ApiResponse(responseCode = "200")
    public ResponseEntity<BatchPredictionResponse> predictBatch(@Valid @RequestBody BatchPredictionRequest request) {
        List<String> symbols = request.getSymbols();
        if (symbols.size() > properties.getBatch().getMaxSymbols()) {
            throw new IllegalArgumentException("At most " + properties.getBatch().getMaxSymbols()
                    + " symbols per batch, got " + symbols.size());
        }
        Horizon horizon = Horizon.fromTag(request.getHorizon());
        int requested = request.getMaxConcurrency() != null
                ? request.getMaxConcurrency()
                : properties.getBatch().getMaxConcurrency();

        BatchResult result = batchCoordinator.predictBatch(symbols, horizon, priceProviderFor(request), requested);
        return ResponseEntity.ok(BatchPredictionResponse.builder()
                .totalSymbols(symbols.size())
                .successful(result.getSuccessCount())
                .failed(result.getFailureCount())
                .concurrency(batchCoordinator.effectiveConcurrency(requested, symbols.size()))
                .results(result.getResults())
                .totalExecutionTimeMs(result.getTotalDurationMs())
                .timestamp(Instant.now())
                .build());
    }

    @GetMapping("/models/available")
    @Operation(summary = "List symbols with a trained model")
    public ResponseEntity<ModelsAvailableResponse> availableModels(
            @RequestParam(name = "includeSectors", defaultValue = "false") boolean includeSectors) {
        RegistryStats stats = modelRegistry.stats();
        List<String> specific = modelRegistry.availableSymbols();
        return ResponseEntity.ok(ModelsAvailableResponse.builder()
                .specificModels(specific)
                .specificModelCount(specific.size())
                .generalModelSymbols(stats.getGeneralModelSymbols())
                .totalCoverage(stats.getTotalCoverage())
                .allSymbols(modelRegistry.allAvailableSymbols())
                .cachedSymbols(modelRegistry.cachedSymbols())
                .cacheCapacity(stats.getCacheCapacity())
                .sectors(includeSectors ? modelRegistry.modelsBySector(properties.getSectors()) : null)
                .build());
    }

    @GetMapping("/models/{symbol}")
    @Operation(summary = "Describe the model serving a symbol")
    public ResponseEntity<ModelInfo> modelInfo(@PathVariable String symbol) {
        return ResponseEntity.ok(modelRegistry.modelInfo(symbol));
    }

    @GetMapping("/stats")
    @Operation(summary = "Registry counters and cache state")
    public ResponseEntity<StatsResponse> stats() {
        return ResponseEntity.ok(StatsResponse.builder()
                .registry(modelRegistry.stats())
                .cachedSymbols(modelRegistry.cachedSymbols())
                .modelVersion(properties.getModelVersion())
                .timestamp(Instant.now())
                .build());
    }

    @PostMapping("/cache/clear")
    @Operation(summary = "Drop cached specific models and reset counters")
    public ResponseEntity<CacheClearResponse> clearCache() {
        int cleared = modelRegistry.cachedSymbols().size();
        modelRegistry.clearCache();
        return ResponseEntity.ok(CacheClearResponse.builder()
                .message("Model cache cleared")
                .clearedEntries(cleared)
                .build());
    }

    @PostMapping("/refresh")
    @Operation(summary = "Rescan artifact directories",
            description = "Picks up newly trained models and drops cached models whose files changed")
    public ResponseEntity<RefreshSummary> refresh() {
        RefreshSummary summary = modelRegistry.refresh();
        log.info("Registry refreshed via API: specific={} general={} invalidated={}",
                summary.getSpecificModels(), summary.getGeneralModelSymbols(), summary.getInvalidatedKeys().size());
        return ResponseEntity.ok(summary);
    }

    @GetMapping("/health")
    @Operation(summary = "Serving health")
    public ResponseEntity<HealthResponse> health() {
        RegistryStats stats = modelRegistry.stats();
        return ResponseEntity.ok(HealthResponse.builder()
                .status(stats.getTotalCoverage() > 0 ? "healthy" : "degraded")
                .modelVersion(properties.getModelVersion())
                .specificModels(stats.getSpecificModels())
                .generalModelLoaded(stats.isGeneralModelLoaded())
                .generalModelSymbols(stats.getGeneralModelSymbols())
                .totalCoverage(stats.getTotalCoverage())
                .cacheSize(stats.getCacheSize())
                .cacheCapacity(stats.getCacheCapacity())
                .timestamp(Instant.now())
                .build());
    }

    private PriceProvider priceProviderFor(BatchPredictionRequest request) {
        Map<String, List<Double>> bySymbol = new HashMap<>();
        if (request.getPricesBySymbol() != null) {
            request.getPricesBySymbol().forEach((symbol, prices) -> bySymbol.put(ModelRegistry.normalizeSymbol(symbol), prices));
        }
        List<Double> shared = request.getRecentPrices() != null ? request.getRecentPrices() : List.of();
        if (bySymbol.isEmpty()) {
            return PriceProvider.shared(shared);
        }
        return symbol -> bySymbol.getOrDefault(ModelRegistry.normalizeSymbol(symbol), shared);
    }
}
