package com.stockforecast.backend.forecast.artifact;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Autoregressive regressor over the scaled window: {@code bias + sum(weights[i] * window[i])}.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class LinearWindowModel implements ForecastModel, ModelDefinition {

    public static final String TYPE = "linear-window";

    double[] weights;
    double bias;

    @Override
    public int windowLength() {
        return weights.length;
    }

    @Override
    public double predict(double[] scaledWindow) {
        return LinearAlgebra.affine(weights, bias, scaledWindow);
    }

    @Override
    public void validate() {
        LinearAlgebra.requireWeights(weights, bias);
    }
}
