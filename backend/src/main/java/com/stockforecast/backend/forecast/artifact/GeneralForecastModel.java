package com.stockforecast.backend.forecast.artifact;

/**
 * Inference contract of the shared forecaster; the symbol is passed as the integer id
 * it was assigned at training time.
 */
public interface GeneralForecastModel {

    int windowLength();

    double predict(int symbolId, double[] scaledWindow);
}
