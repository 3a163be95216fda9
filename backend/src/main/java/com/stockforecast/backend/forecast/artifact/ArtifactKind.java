package com.stockforecast.backend.forecast.artifact;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ArtifactKind {
    SPECIFIC("specific"),
    GENERAL("general");

    private final String label;

    ArtifactKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public String cacheKey(String symbol) {
        return label + ":" + symbol;
    }
}
