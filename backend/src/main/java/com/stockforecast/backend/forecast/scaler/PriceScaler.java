package com.stockforecast.backend.forecast.scaler;

import com.stockforecast.backend.exception.InvalidPriceException;
import com.stockforecast.backend.exception.NotFittedException;

/**
 * Reversible min-max transform between raw prices and an artifact's training scale.
 * Every method is a pure function of its arguments; a {@link ScalerState} is never mutated.
 */
public final class PriceScaler {

    private PriceScaler() {
    }

    public static ScalerState fit(ScalerKind kind, double[] trainingPrices) {
        return fit(kind, trainingPrices, 0.0, 1.0);
    }

    public static ScalerState fit(ScalerKind kind, double[] trainingPrices, double featureMin, double featureMax) {
        if (kind == null) {
            throw new IllegalArgumentException("Scaler kind is required");
        }
        if (trainingPrices == null || trainingPrices.length == 0) {
            throw new IllegalArgumentException("Cannot fit a scaler on an empty price series");
        }
        if (!(featureMax > featureMin)) {
            throw new IllegalArgumentException("Feature range must be increasing: " + featureMin + ".." + featureMax);
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < trainingPrices.length; i++) {
            double value = toDomain(kind, trainingPrices[i], i);
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        return ScalerState.builder()
                .kind(kind)
                .dataMin(min)
                .dataMax(max)
                .featureMin(featureMin)
                .featureMax(featureMax)
                .build();
    }

    public static double[] transform(ScalerState state, double[] prices) {
        requireFitted(state);
        double[] scaled = new double[prices.length];
        for (int i = 0; i < prices.length; i++) {
            scaled[i] = scale(state, toDomain(state.getKind(), prices[i], i));
        }
        return scaled;
    }

    public static double transform(ScalerState state, double price) {
        requireFitted(state);
        return scale(state, toDomain(state.getKind(), price, 0));
    }

    public static double[] inverseTransform(ScalerState state, double[] scaledValues) {
        requireFitted(state);
        double[] prices = new double[scaledValues.length];
        for (int i = 0; i < scaledValues.length; i++) {
            prices[i] = fromDomain(state.getKind(), unscale(state, scaledValues[i]));
        }
        return prices;
    }

    public static double inverseTransform(ScalerState state, double scaledValue) {
        requireFitted(state);
        return fromDomain(state.getKind(), unscale(state, scaledValue));
    }

    private static double scale(ScalerState state, double value) {
        double featureSpan = state.getFeatureMax() - state.getFeatureMin();
        return (value - state.getDataMin()) / state.dataRange() * featureSpan + state.getFeatureMin();
    }

    private static double unscale(ScalerState state, double scaled) {
        double featureSpan = state.getFeatureMax() - state.getFeatureMin();
        return (scaled - state.getFeatureMin()) / featureSpan * state.dataRange() + state.getDataMin();
    }

    private static double toDomain(ScalerKind kind, double price, int position) {
        if (!Double.isFinite(price)) {
            throw new InvalidPriceException(price, position, "price must be finite");
        }
        if (kind == ScalerKind.LOG_RANGE) {
            if (price <= 0.0) {
                throw new InvalidPriceException(price, position, "log scaling requires a strictly positive price");
            }
            return Math.log(price);
        }
        return price;
    }

    private static double fromDomain(ScalerKind kind, double value) {
        return kind == ScalerKind.LOG_RANGE ? Math.exp(value) : value;
    }

    private static void requireFitted(ScalerState state) {
        if (state == null || !state.isFitted()) {
            throw new NotFittedException("Scaler must be fitted before transform");
        }
    }
}
