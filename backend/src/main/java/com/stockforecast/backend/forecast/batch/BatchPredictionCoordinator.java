package com.stockforecast.backend.forecast.batch;

import com.stockforecast.backend.config.ForecastProperties;
import com.stockforecast.backend.exception.ErrorKind;
import com.stockforecast.backend.exception.ForecastException;
import com.stockforecast.backend.forecast.prediction.Horizon;
import com.stockforecast.backend.forecast.prediction.PredictionService;
import com.stockforecast.backend.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans a batch out over {@link PredictionService} with at most {@code maxConcurrency} predictions
 * in flight. Each worker pulls the next pending slot, so no thread blocks waiting for a permit.
 */
@Service
@Slf4j
public class BatchPredictionCoordinator {

    private final PredictionService predictionService;
    private final Executor predictionExecutor;
    private final ForecastProperties properties;
    private final MetricsService metricsService;

    public BatchPredictionCoordinator(PredictionService predictionService,
                                      @Qualifier("predictionExecutor") Executor predictionExecutor,
                                      ForecastProperties properties,
                                      MetricsService metricsService) {
        this.predictionService = predictionService;
        this.predictionExecutor = predictionExecutor;
        this.properties = properties;
        this.metricsService = metricsService;
    }

    public BatchResult predictBatch(List<String> symbols, Horizon horizon, PriceProvider priceProvider, int maxConcurrency) {
        long started = System.nanoTime();
        int total = symbols.size();
        BatchItemResult[] slots = new BatchItemResult[total];
        int workers = effectiveConcurrency(maxConcurrency, total);
        AtomicInteger cursor = new AtomicInteger();

        List<CompletableFuture<Void>> futures = new ArrayList<>(workers);
        for (int w = 0; w < workers; w++) {
            Runnable worker = () -> drain(symbols, horizon, priceProvider, cursor, slots);
            try {
                futures.add(CompletableFuture.runAsync(worker, predictionExecutor));
            } catch (RejectedExecutionException e) {
                log.warn("Prediction executor saturated, running batch worker on caller thread");
                worker.run();
            }
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<BatchItemResult> results = Arrays.asList(slots);
        int successCount = (int) results.stream().filter(BatchItemResult::isSuccess).count();
        double durationMs = (System.nanoTime() - started) / 1_000_000.0;
        metricsService.recordBatch();
        log.info("Batch prediction: {}/{} successful in {}ms (concurrency={})",
                successCount, total, String.format("%.3f", durationMs), workers);
        return BatchResult.builder()
                .results(List.copyOf(results))
                .successCount(successCount)
                .failureCount(total - successCount)
                .totalDurationMs(durationMs)
                .build();
    }

    public int effectiveConcurrency(int requested, int total) {
        int bounded = Math.min(Math.max(1, requested), Math.max(1, properties.getBatch().getMaxConcurrencyLimit()));
        return Math.max(1, Math.min(bounded, total));
    }

    private void drain(List<String> symbols, Horizon horizon, PriceProvider priceProvider,
                       AtomicInteger cursor, BatchItemResult[] slots) {
        int index;
        while ((index = cursor.getAndIncrement()) < slots.length) {
            slots[index] = predictOne(symbols.get(index), horizon, priceProvider);
        }
    }

    private BatchItemResult predictOne(String symbol, Horizon horizon, PriceProvider priceProvider) {
        try {
            List<Double> prices = priceProvider.recentPrices(symbol);
            return BatchItemResult.success(symbol, predictionService.predict(symbol, horizon, prices));
        } catch (ForecastException e) {
            log.warn("Batch item {} failed ({}): {}", symbol, e.getErrorKind(), e.getMessage());
            return BatchItemResult.failure(ErrorRecord.builder()
                    .symbol(symbol)
                    .errorKind(e.getErrorKind().name())
                    .message(e.getMessage())
                    .build());
        } catch (RuntimeException e) {
            log.warn("Batch item {} failed unexpectedly: {}", symbol, e.toString());
            return BatchItemResult.failure(ErrorRecord.builder()
                    .symbol(symbol)
                    .errorKind(ErrorKind.PREDICTION_FAILED.name())
                    .message(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build());
        }
    }
}
