package com.stockforecast.backend.forecast.registry;

import com.stockforecast.backend.forecast.artifact.ArtifactKind;
import com.stockforecast.backend.forecast.artifact.ArtifactMetadata;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ModelInfo {
    String symbol;
    boolean available;
    ArtifactKind kind;
    boolean cached;
    String trainingDate;
    Double testMape;
    String modelPath;
    ArtifactMetadata metadata;
}
