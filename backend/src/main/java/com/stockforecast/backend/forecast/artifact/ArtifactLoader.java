package com.stockforecast.backend.forecast.artifact;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves artifacts from durable storage. Implementations never retry internally: a failed load
 * is reported to the caller as an {@link com.stockforecast.backend.exception.ForecastException}.
 */
public interface ArtifactLoader {

    /**
     * Discovers which symbols have a dedicated artifact. Read-only and idempotent.
     */
    Map<String, SpecificArtifactLocation> scan(Path directory);

    /**
     * @throws com.stockforecast.backend.exception.ArtifactMissingException model or scaler file absent
     * @throws com.stockforecast.backend.exception.ArtifactCorruptException unreadable or invalid content
     */
    ArtifactHandle loadSpecific(SpecificArtifactLocation location);

    /**
     * @throws com.stockforecast.backend.exception.ArtifactUnavailableException no general pool configured or present
     * @throws com.stockforecast.backend.exception.ArtifactMissingException a required general file is absent
     * @throws com.stockforecast.backend.exception.ArtifactCorruptException unreadable or invalid content
     */
    ArtifactHandle loadGeneral();

    /**
     * True when a general pool directory is configured and exists.
     */
    boolean isGeneralPoolPresent();

    Optional<ArtifactMetadata> loadMetadata(SpecificArtifactLocation location);
}
