package com.stockforecast.backend.forecast.artifact;

/**
 * Inference contract of a forecaster trained for exactly one symbol.
 * The window is already in the artifact's training scale; the result is in the same scale.
 */
public interface ForecastModel {

    int windowLength();

    double predict(double[] scaledWindow);
}
