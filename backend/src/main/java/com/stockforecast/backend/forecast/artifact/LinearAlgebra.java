package com.stockforecast.backend.forecast.artifact;

final class LinearAlgebra {

    private LinearAlgebra() {
    }

    static double affine(double[] weights, double bias, double[] window) {
        if (window.length != weights.length) {
            throw new IllegalArgumentException("Window length " + window.length + " does not match model input " + weights.length);
        }
        double sum = bias;
        for (int i = 0; i < weights.length; i++) {
            sum += weights[i] * window[i];
        }
        return sum;
    }

    static void requireWeights(double[] weights, double bias) {
        if (weights == null || weights.length == 0) {
            throw new IllegalStateException("weights must not be empty");
        }
        if (!Double.isFinite(bias)) {
            throw new IllegalStateException("bias must be finite");
        }
        for (double weight : weights) {
            if (!Double.isFinite(weight)) {
                throw new IllegalStateException("weights contain a non-finite value");
            }
        }
    }
}
