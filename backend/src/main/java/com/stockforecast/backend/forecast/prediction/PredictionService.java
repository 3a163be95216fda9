package com.stockforecast.backend.forecast.prediction;

import com.stockforecast.backend.config.ForecastProperties;
import com.stockforecast.backend.exception.ForecastException;
import com.stockforecast.backend.exception.InsufficientDataException;
import com.stockforecast.backend.exception.PredictionFailedException;
import com.stockforecast.backend.forecast.artifact.ArtifactMetadata;
import com.stockforecast.backend.forecast.registry.ModelRegistry;
import com.stockforecast.backend.forecast.registry.RoutedArtifact;
import com.stockforecast.backend.forecast.scaler.PriceScaler;
import com.stockforecast.backend.service.MetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Single-symbol pipeline: validate, route, scale the trailing window, infer, inverse-scale, clamp.
 * Holds no caching logic of its own and never retries.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PredictionService {

    private final ModelRegistry modelRegistry;
    private final ForecastProperties properties;
    private final MetricsService metricsService;

    public PredictionResult predict(String rawSymbol, Horizon horizon, List<Double> recentPrices) {
        String symbol = ModelRegistry.normalizeSymbol(rawSymbol);
        Horizon tag = horizon != null ? horizon : Horizon.DEFAULT;
        try {
            return run(symbol, tag, recentPrices);
        } catch (ForecastException e) {
            metricsService.recordPredictionFailure(e.getErrorKind().name());
            throw e;
        }
    }

    private PredictionResult run(String symbol, Horizon horizon, List<Double> recentPrices) {
        int supplied = recentPrices == null ? 0 : recentPrices.size();
        requireLength(symbol, properties.getWindowLength(), supplied);

        long started = System.nanoTime();
        RoutedArtifact routed = modelRegistry.loadModel(symbol);
        int window = routed.getHandle().windowLength();
        requireLength(symbol, window, supplied);

        try {
            double[] prices = trailingWindow(recentPrices, window);
            double[] scaled = PriceScaler.transform(routed.getScaler(), prices);
            double scaledForecast = routed.predict(scaled);
            double raw = PriceScaler.inverseTransform(routed.getScaler(), scaledForecast);
            if (!Double.isFinite(raw)) {
                throw new IllegalStateException("model produced a non-finite forecast (scaled=" + scaledForecast + ")");
            }

            boolean clamped = raw < 0.0;
            double prediction = clamped ? 0.0 : raw;
            if (clamped) {
                metricsService.recordClamp();
                log.warn("Negative forecast clamped to 0 for {} ({} model): raw={}", symbol, routed.getKind().getLabel(), raw);
            }

            double lastPrice = prices[prices.length - 1];
            double change = prediction - lastPrice;
            double changePercent = lastPrice == 0.0 ? 0.0 : change / lastPrice * 100.0;
            long elapsed = System.nanoTime() - started;
            metricsService.recordPrediction(routed.getKind(), routed.isCacheHit(), elapsed);

            ArtifactMetadata metadata = routed.getHandle().getMetadata();
            PredictionResult result = PredictionResult.builder()
                    .symbol(symbol)
                    .horizon(horizon)
                    .prediction(prediction)
                    .lastPrice(lastPrice)
                    .change(change)
                    .changePercent(changePercent)
                    .modelKind(routed.getKind())
                    .cached(routed.isCacheHit())
                    .clamped(clamped)
                    .executionTimeMs(elapsed / 1_000_000.0)
                    .validationMape(metadata != null ? metadata.getTestMape() : null)
                    .modelVersion(properties.getModelVersion() + "_" + routed.getKind().getLabel())
                    .timestamp(Instant.now())
                    .build();
            log.info("Prediction: {} @ {} = {} (kind={}, cached={}, time={}ms)",
                    symbol, horizon.getTag(), String.format("%.4f", prediction), routed.getKind().getLabel(),
                    routed.isCacheHit(), String.format("%.3f", result.getExecutionTimeMs()));
            return result;
        } catch (RuntimeException e) {
            log.error("Prediction error for {}: {}", symbol, e.getMessage());
            throw new PredictionFailedException(symbol, e);
        }
    }

    private static void requireLength(String symbol, int required, int supplied) {
        if (supplied < required) {
            throw new InsufficientDataException(symbol, required, supplied);
        }
    }

    private static double[] trailingWindow(List<Double> prices, int window) {
        double[] values = new double[window];
        int offset = prices.size() - window;
        for (int i = 0; i < window; i++) {
            Double value = prices.get(offset + i);
            if (value == null) {
                throw new IllegalArgumentException("price at position " + (offset + i) + " is missing");
            }
            values[i] = value;
        }
        return values;
    }
}
