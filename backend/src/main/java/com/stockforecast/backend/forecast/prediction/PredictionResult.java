package com.stockforecast.backend.forecast.prediction;

import com.stockforecast.backend.forecast.artifact.ArtifactKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class PredictionResult {
    String symbol;
    Horizon horizon;
    double prediction;
    double lastPrice;
    double change;
    double changePercent;
    ArtifactKind modelKind;
    boolean cached;
    /** True when the raw forecast was negative and was raised to zero. */
    boolean clamped;
    double executionTimeMs;
    Double validationMape;
    String modelVersion;
    Instant timestamp;
}
