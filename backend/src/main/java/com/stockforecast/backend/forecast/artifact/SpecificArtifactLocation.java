package com.stockforecast.backend.forecast.artifact;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Where a symbol's dedicated artifact lives, as discovered by {@link ArtifactLoader#scan}.
 * {@code version} changes whenever the model or scaler file is rewritten.
 */
@Value
@Builder
public class SpecificArtifactLocation {
    String symbol;
    Path modelPath;
    Path scalerPath;
    Path metadataPath;
    long version;
}
