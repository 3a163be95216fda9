package com.stockforecast.backend.forecast.registry;

import com.stockforecast.backend.forecast.artifact.ArtifactHandle;
import com.stockforecast.backend.forecast.artifact.ArtifactKind;
import com.stockforecast.backend.forecast.scaler.ScalerState;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a routing decision: which artifact serves the symbol, the scaler to use with it,
 * and whether the artifact came out of the bounded cache.
 */
@Value
@Builder
public class RoutedArtifact {
    String symbol;
    ArtifactKind kind;
    ArtifactHandle handle;
    ScalerState scaler;
    /** Training-time id for the general artifact, null for a specific one. */
    Integer symbolId;
    boolean cacheHit;

    public double predict(double[] scaledWindow) {
        return handle.predict(symbolId, scaledWindow);
    }
}
