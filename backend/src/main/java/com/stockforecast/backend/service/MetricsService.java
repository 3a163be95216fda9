package com.stockforecast.backend.service;

import com.stockforecast.backend.forecast.artifact.ArtifactKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private Counter evictionsCounter;
    private Counter clampedCounter;
    private Counter batchesCounter;

    @PostConstruct
    public void init() {
        evictionsCounter = Counter.builder("forecast.cache.evictions").register(meterRegistry);
        clampedCounter = Counter.builder("forecast.predictions.clamped").register(meterRegistry);
        batchesCounter = Counter.builder("forecast.batches").register(meterRegistry);
    }

    public void recordArtifactLoad(ArtifactKind kind) {
        Counter.builder("forecast.artifacts.loaded")
                .tag("kind", kind.getLabel())
                .register(meterRegistry)
                .increment();
    }

    public void recordEviction() {
        if (evictionsCounter != null) {
            evictionsCounter.increment();
        }
    }

    public void recordPrediction(ArtifactKind kind, boolean cached, long elapsedNanos) {
        Counter.builder("forecast.predictions")
                .tag("kind", kind.getLabel())
                .tag("cached", String.valueOf(cached))
                .register(meterRegistry)
                .increment();
        Timer.builder("forecast.prediction.latency")
                .tag("kind", kind.getLabel())
                .register(meterRegistry)
                .record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public void recordPredictionFailure(String errorKind) {
        Counter.builder("forecast.predictions.failed")
                .tag("errorKind", errorKind)
                .register(meterRegistry)
                .increment();
    }

    public void recordClamp() {
        if (clampedCounter != null) {
            clampedCounter.increment();
        }
    }

    public void recordBatch() {
        if (batchesCounter != null) {
            batchesCounter.increment();
        }
    }
}
