package com.stockforecast.backend.controller;

import com.stockforecast.backend.config.ForecastProperties;
import com.stockforecast.backend.exception.InsufficientDataException;
import com.stockforecast.backend.exception.InvalidPriceException;
import com.stockforecast.backend.exception.ModelNotFoundException;
import com.stockforecast.backend.exception.PredictionFailedException;
import com.stockforecast.backend.forecast.artifact.ArtifactKind;
import com.stockforecast.backend.forecast.batch.BatchItemResult;
import com.stockforecast.backend.forecast.batch.BatchPredictionCoordinator;
import com.stockforecast.backend.forecast.batch.BatchResult;
import com.stockforecast.backend.forecast.batch.ErrorRecord;
import com.stockforecast.backend.forecast.batch.PriceProvider;
import com.stockforecast.backend.forecast.prediction.Horizon;
import com.stockforecast.backend.forecast.prediction.PredictionResult;
import com.stockforecast.backend.forecast.prediction.PredictionService;
import com.stockforecast.backend.forecast.registry.ModelInfo;
import com.stockforecast.backend.forecast.registry.ModelRegistry;
import com.stockforecast.backend.forecast.registry.RegistryStats;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ForecastController.class)
@Import(ForecastProperties.class)
class ForecastControllerTest {

    private static final String PRICES = "[" + "100.0,".repeat(59) + "101.5]";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PredictionService predictionService;

    @MockBean
    private BatchPredictionCoordinator batchCoordinator;

    @MockBean
    private ModelRegistry modelRegistry;

    @Test
    void predictReturnsResult() throws Exception {
        when(predictionService.predict(eq("SCOM"), eq(Horizon.FIVE_DAYS), anyList())).thenReturn(PredictionResult.builder()
                .symbol("SCOM")
                .horizon(Horizon.FIVE_DAYS)
                .prediction(102.25)
                .lastPrice(101.5)
                .change(0.75)
                .changePercent(0.74)
                .modelKind(ArtifactKind.SPECIFIC)
                .cached(true)
                .modelVersion("v4_log_specific")
                .timestamp(Instant.parse("2024-06-03T10:15:30Z"))
                .build());

        mockMvc.perform(post("/api/v4/predict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\":\"SCOM\",\"horizon\":\"5d\",\"recentPrices\":" + PRICES + "}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.symbol").value("SCOM"))
                .andExpect(jsonPath("$.horizon").value("5d"))
                .andExpect(jsonPath("$.modelKind").value("specific"))
                .andExpect(jsonPath("$.prediction").value(102.25))
                .andExpect(jsonPath("$.cached").value(true));
    }

    @Test
    void unknownSymbolIsNotFoundWithCorrelationId() throws Exception {
        when(predictionService.predict(eq("ZZZ"), any(), anyList()))
                .thenThrow(new ModelNotFoundException("ZZZ", List.of("KCB", "SCOM")));

        mockMvc.perform(post("/api/v4/predict")
                        .header("X-Correlation-Id", "corr-42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\":\"ZZZ\",\"recentPrices\":" + PRICES + "}"))
                .andExpect(status().isNotFound())
                .andExpect(header().string("X-Correlation-Id", "corr-42"))
                .andExpect(jsonPath("$.errorKind").value("MODEL_NOT_FOUND"))
                .andExpect(jsonPath("$.correlationId").value("corr-42"))
                .andExpect(jsonPath("$.details[0].issue").value("ZZZ"));
    }

    @Test
    void insufficientDataIsBadRequest() throws Exception {
        when(predictionService.predict(eq("SCOM"), any(), anyList()))
                .thenThrow(new InsufficientDataException("SCOM", 60, 3));

        mockMvc.perform(post("/api/v4/predict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\":\"SCOM\",\"recentPrices\":[1.0,2.0,3.0]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorKind").value("INSUFFICIENT_DATA"));
    }

    @Test
    void invalidPriceIsReportedAsPredictionFailure() throws Exception {
        when(predictionService.predict(eq("SCOM"), any(), anyList()))
                .thenThrow(new PredictionFailedException("SCOM", new InvalidPriceException(-1.0, 4, "must be positive")));

        mockMvc.perform(post("/api/v4/predict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\":\"SCOM\",\"recentPrices\":" + PRICES + "}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.errorKind").value("PREDICTION_FAILED"));
    }

    @Test
    void blankSymbolFailsValidation() throws Exception {
        mockMvc.perform(post("/api/v4/predict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\":\" \",\"recentPrices\":" + PRICES + "}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorKind").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details[0].field").value("symbol"));
    }

    @Test
    void unsupportedHorizonIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v4/predict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\":\"SCOM\",\"horizon\":\"7d\",\"recentPrices\":" + PRICES + "}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unsupported horizon: 7d (expected 1d, 5d, 10d or 30d)"));
    }

    @Test
    void batchReportsPerSymbolOutcome() throws Exception {
        PredictionResult ok = PredictionResult.builder()
                .symbol("SCOM")
                .horizon(Horizon.TEN_DAYS)
                .prediction(20.0)
                .modelKind(ArtifactKind.GENERAL)
                .build();
        ErrorRecord error = ErrorRecord.builder().symbol("ZZZ").errorKind("MODEL_NOT_FOUND").message("No model").build();
        when(batchCoordinator.predictBatch(eq(List.of("SCOM", "ZZZ")), eq(Horizon.TEN_DAYS), any(PriceProvider.class), eq(2)))
                .thenReturn(BatchResult.builder()
                        .results(List.of(BatchItemResult.success("SCOM", ok), BatchItemResult.failure(error)))
                        .successCount(1)
                        .failureCount(1)
                        .totalDurationMs(12.5)
                        .build());
        when(batchCoordinator.effectiveConcurrency(anyInt(), anyInt())).thenReturn(2);

        mockMvc.perform(post("/api/v4/predict/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbols\":[\"SCOM\",\"ZZZ\"],\"recentPrices\":" + PRICES + ",\"maxConcurrency\":2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalSymbols").value(2))
                .andExpect(jsonPath("$.successful").value(1))
                .andExpect(jsonPath("$.failed").value(1))
                .andExpect(jsonPath("$.results[0].result.modelKind").value("general"))
                .andExpect(jsonPath("$.results[1].error.errorKind").value("MODEL_NOT_FOUND"));
    }

    @Test
    void batchPrefersPerSymbolPrices() throws Exception {
        when(batchCoordinator.predictBatch(anyList(), any(), any(PriceProvider.class), anyInt()))
                .thenReturn(BatchResult.builder().results(List.of()).build());

        mockMvc.perform(post("/api/v4/predict/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbols\":[\"scom\",\"KCB\"],\"recentPrices\":[1.0],"
                                + "\"pricesBySymbol\":{\"SCOM\":[2.0,3.0]}}"))
                .andExpect(status().isOk());

        ArgumentCaptor<PriceProvider> provider = ArgumentCaptor.forClass(PriceProvider.class);
        verify(batchCoordinator).predictBatch(eq(List.of("scom", "KCB")), eq(Horizon.TEN_DAYS), provider.capture(), eq(4));
        assertThat(provider.getValue().recentPrices("scom")).containsExactly(2.0, 3.0);
        assertThat(provider.getValue().recentPrices("KCB")).containsExactly(1.0);
    }

    @Test
    void emptyBatchFailsValidation() throws Exception {
        mockMvc.perform(post("/api/v4/predict/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbols\":[]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void modelInfoForUnknownSymbol() throws Exception {
        when(modelRegistry.modelInfo("ZZZ")).thenReturn(ModelInfo.builder().symbol("ZZZ").available(false).build());

        mockMvc.perform(get("/api/v4/models/ZZZ"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.symbol").value("ZZZ"))
                .andExpect(jsonPath("$.available").value(false));
    }

    @Test
    void healthIsDegradedWithoutCoverage() throws Exception {
        when(modelRegistry.stats()).thenReturn(RegistryStats.builder().cacheCapacity(20).build());

        mockMvc.perform(get("/api/v4/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("degraded"))
                .andExpect(jsonPath("$.cacheCapacity").value(20));
    }

    @Test
    void clearCacheReportsClearedEntries() throws Exception {
        when(modelRegistry.cachedSymbols()).thenReturn(List.of("SCOM", "KCB"));

        mockMvc.perform(post("/api/v4/cache/clear"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.clearedEntries").value(2));
        verify(modelRegistry).clearCache();
    }
}
