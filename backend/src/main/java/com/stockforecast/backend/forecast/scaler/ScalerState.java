package com.stockforecast.backend.forecast.scaler;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Statistics captured by {@link PriceScaler#fit}. {@code dataMin}/{@code dataMax} live in the
 * transformed domain: raw prices for {@link ScalerKind#IDENTITY_RANGE}, {@code ln(price)} for
 * {@link ScalerKind#LOG_RANGE}. A state without both bounds is not fitted.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScalerState {

    ScalerKind kind;
    Double dataMin;
    Double dataMax;
    @Builder.Default
    double featureMin = 0.0;
    @Builder.Default
    double featureMax = 1.0;

    @JsonIgnore
    public boolean isFitted() {
        return kind != null && dataMin != null && dataMax != null;
    }

    /** {@code featureMax} must lie strictly above {@code featureMin} for the scaler to invert. */
    @JsonIgnore
    public boolean hasIncreasingFeatureRange() {
        return featureMax > featureMin;
    }

    /** Width of the fitted data range; a constant window counts as width 1. */
    @JsonIgnore
    public double dataRange() {
        double range = dataMax - dataMin;
        return range == 0.0 ? 1.0 : range;
    }

    public static ScalerState unfitted(ScalerKind kind) {
        return ScalerState.builder().kind(kind).build();
    }
}
