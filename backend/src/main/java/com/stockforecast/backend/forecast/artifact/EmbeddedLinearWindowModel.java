package com.stockforecast.backend.forecast.artifact;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Shared regressor: the window term is common to all symbols, {@code symbolBias[id]} is the
 * learned per-symbol offset.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class EmbeddedLinearWindowModel implements GeneralForecastModel, ModelDefinition {

    public static final String TYPE = "embedded-linear-window";

    double[] weights;
    double bias;
    double[] symbolBias;

    @Override
    public int windowLength() {
        return weights.length;
    }

    @Override
    public double predict(int symbolId, double[] scaledWindow) {
        if (symbolId < 0 || symbolId >= symbolBias.length) {
            throw new IllegalArgumentException("Symbol id " + symbolId + " outside embedding of size " + symbolBias.length);
        }
        return LinearAlgebra.affine(weights, bias + symbolBias[symbolId], scaledWindow);
    }

    @Override
    public void validate() {
        LinearAlgebra.requireWeights(weights, bias);
        if (symbolBias == null || symbolBias.length == 0) {
            throw new IllegalStateException("symbolBias must not be empty");
        }
        for (double value : symbolBias) {
            if (!Double.isFinite(value)) {
                throw new IllegalStateException("symbolBias contains a non-finite value");
            }
        }
    }
}
