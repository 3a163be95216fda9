package com.stockforecast.backend.forecast.artifact;

import com.stockforecast.backend.exception.ArtifactCorruptException;
import com.stockforecast.backend.forecast.scaler.ScalerState;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A loaded inference model plus the scaler state(s) it was trained with.
 * Routing dispatches on {@link #getKind()}; the model reference of the other kind is always null.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ArtifactHandle {

    private final ArtifactKind kind;
    private final ForecastModel specificModel;
    private final GeneralForecastModel generalModel;
    private final ScalerState scaler;
    private final Map<String, ScalerState> scalers;
    private final Map<String, Integer> symbolIds;
    private final ArtifactMetadata metadata;
    private final Path source;
    private final long sourceVersion;

    public static ArtifactHandle specific(ForecastModel model, ScalerState scaler, ArtifactMetadata metadata,
                                          Path source, long sourceVersion) {
        return new ArtifactHandle(ArtifactKind.SPECIFIC,
                Objects.requireNonNull(model, "model"),
                null,
                Objects.requireNonNull(scaler, "scaler"),
                Map.of(),
                Map.of(),
                metadata,
                source,
                sourceVersion);
    }

    public static ArtifactHandle general(GeneralForecastModel model, Map<String, ScalerState> scalers,
                                         Map<String, Integer> symbolIds, ArtifactMetadata metadata,
                                         Path source, long sourceVersion) {
        return new ArtifactHandle(ArtifactKind.GENERAL,
                null,
                Objects.requireNonNull(model, "model"),
                null,
                Map.copyOf(scalers),
                Map.copyOf(symbolIds),
                metadata,
                source,
                sourceVersion);
    }

    public int windowLength() {
        return kind == ArtifactKind.SPECIFIC ? specificModel.windowLength() : generalModel.windowLength();
    }

    /**
     * Symbols the general artifact claims to cover: every symbol with a scaler slice or an id.
     * Empty for a specific artifact.
     */
    public Set<String> generalSymbols() {
        Set<String> symbols = new TreeSet<>(symbolIds.keySet());
        symbols.addAll(scalers.keySet());
        return symbols;
    }

    /**
     * Scaler to use for {@code symbol}: the artifact's own for a specific artifact, the symbol's
     * slice of the scaler collection for the general one.
     */
    public ScalerState scalerFor(String symbol) {
        if (kind == ArtifactKind.SPECIFIC) {
            return scaler;
        }
        ScalerState slice = scalers.get(symbol);
        if (slice == null) {
            throw new ArtifactCorruptException("General artifact has an id for " + symbol + " but no scaler");
        }
        return slice;
    }

    public Integer symbolIdFor(String symbol) {
        if (kind == ArtifactKind.SPECIFIC) {
            return null;
        }
        Integer id = symbolIds.get(symbol);
        if (id == null) {
            throw new ArtifactCorruptException("General artifact has a scaler for " + symbol + " but no symbol id");
        }
        return id;
    }

    public double predict(Integer symbolId, double[] scaledWindow) {
        return switch (kind) {
            case SPECIFIC -> specificModel.predict(scaledWindow);
            case GENERAL -> generalModel.predict(Objects.requireNonNull(symbolId, "symbolId"), scaledWindow);
        };
    }
}
