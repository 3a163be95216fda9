package com.stockforecast.backend.forecast.registry;

import com.stockforecast.backend.forecast.artifact.ArtifactHandle;
import com.stockforecast.backend.forecast.artifact.ArtifactMetadata;
import com.stockforecast.backend.forecast.artifact.SpecificArtifactLocation;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable routing snapshot. {@link ModelRegistry#refresh()} builds a new instance and swaps it
 * in, so readers always see one complete index.
 */
@Getter
final class RegistryIndex {

    private final Map<String, SpecificArtifactLocation> specific;
    private final Map<String, ArtifactMetadata> specificMetadata;
    private final ArtifactHandle general;
    private final Set<String> generalSymbols;
    private final Instant builtAt;

    RegistryIndex(Map<String, SpecificArtifactLocation> specific,
                  Map<String, ArtifactMetadata> specificMetadata,
                  ArtifactHandle general) {
        this.specific = Collections.unmodifiableMap(new TreeMap<>(specific));
        this.specificMetadata = Map.copyOf(specificMetadata);
        this.general = general;
        this.generalSymbols = general == null
                ? Set.of()
                : Collections.unmodifiableSet(new TreeSet<>(general.generalSymbols()));
        this.builtAt = Instant.now();
    }

    static RegistryIndex empty() {
        return new RegistryIndex(Map.of(), Map.of(), null);
    }

    boolean hasSpecific(String symbol) {
        return specific.containsKey(symbol);
    }

    boolean hasGeneral(String symbol) {
        return general != null && generalSymbols.contains(symbol);
    }

    List<String> specificSymbols() {
        return List.copyOf(specific.keySet());
    }

    List<String> allSymbols() {
        Set<String> all = new TreeSet<>(specific.keySet());
        all.addAll(generalSymbols);
        return List.copyOf(all);
    }
}
