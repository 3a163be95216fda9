package com.stockforecast.backend.forecast.scaler;

public enum ScalerKind {
    /** Min-max range scaling on raw prices. */
    IDENTITY_RANGE,
    /** Min-max range scaling on natural-log prices. */
    LOG_RANGE
}
