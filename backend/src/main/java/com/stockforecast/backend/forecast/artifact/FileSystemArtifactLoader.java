package com.stockforecast.backend.forecast.artifact;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stockforecast.backend.exception.ArtifactCorruptException;
import com.stockforecast.backend.exception.ArtifactMissingException;
import com.stockforecast.backend.exception.ArtifactUnavailableException;
import com.stockforecast.backend.forecast.scaler.ScalerState;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Reads JSON artifacts laid out as
 * <pre>
 * specific-dir/SCOM_best.json, SCOM_log_scaler.json, SCOM_metadata.json (optional)
 * general-dir/general_best.json, scalers.json, stock_id_mapping.json, metadata.json (optional)
 * </pre>
 */
@Slf4j
public class FileSystemArtifactLoader implements ArtifactLoader {

    private static final TypeReference<Map<String, ScalerState>> SCALERS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Integer>> SYMBOL_IDS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Path generalDirectory;

    public FileSystemArtifactLoader(ObjectMapper objectMapper, Path generalDirectory) {
        this.objectMapper = objectMapper;
        this.generalDirectory = generalDirectory;
    }

    @Override
    public Map<String, SpecificArtifactLocation> scan(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            log.warn("Specific artifact directory not found: {}", directory);
            return Map.of();
        }
        Map<String, SpecificArtifactLocation> locations = new TreeMap<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(Files::isRegularFile).forEach(file -> {
                String fileName = file.getFileName().toString();
                ArtifactFiles.symbolOf(fileName).ifPresent(symbol -> {
                    String prefix = fileName.substring(0, fileName.length() - ArtifactFiles.SPECIFIC_MODEL_SUFFIX.length());
                    Path scalerPath = directory.resolve(ArtifactFiles.scalerFile(prefix));
                    Path metadataPath = directory.resolve(ArtifactFiles.metadataFile(prefix));
                    locations.put(symbol, SpecificArtifactLocation.builder()
                            .symbol(symbol)
                            .modelPath(file)
                            .scalerPath(scalerPath)
                            .metadataPath(metadataPath)
                            .version(Math.max(lastModified(file), lastModified(scalerPath)))
                            .build());
                });
            });
        } catch (IOException e) {
            throw new ArtifactUnavailableException("Failed to scan artifact directory " + directory, e);
        }
        log.info("Found {} specific artifacts in {}: {}", locations.size(), directory, locations.keySet());
        return locations;
    }

    @Override
    public ArtifactHandle loadSpecific(SpecificArtifactLocation location) {
        Path modelPath = location.getModelPath();
        if (!Files.isRegularFile(modelPath)) {
            throw new ArtifactMissingException("Model file", modelPath);
        }
        if (location.getScalerPath() == null || !Files.isRegularFile(location.getScalerPath())) {
            throw new ArtifactMissingException("Scaler file", location.getScalerPath());
        }
        ForecastModel model = readModel(modelPath, ForecastModel.class);
        ScalerState scaler = readScaler(location.getScalerPath());
        ArtifactMetadata metadata = loadMetadata(location).orElse(null);
        log.debug("Loaded specific artifact {} (window={})", location.getSymbol(), model.windowLength());
        return ArtifactHandle.specific(model, scaler, metadata, modelPath, location.getVersion());
    }

    @Override
    public ArtifactHandle loadGeneral() {
        if (!isGeneralPoolPresent()) {
            throw new ArtifactUnavailableException("General artifact directory not available: " + generalDirectory);
        }
        Path modelPath = requireFile("General model file", generalDirectory.resolve(ArtifactFiles.GENERAL_MODEL));
        Path scalersPath = requireFile("General scaler collection", generalDirectory.resolve(ArtifactFiles.GENERAL_SCALERS));
        Path idsPath = requireFile("Symbol id mapping", generalDirectory.resolve(ArtifactFiles.GENERAL_SYMBOL_IDS));

        GeneralForecastModel model = readModel(modelPath, GeneralForecastModel.class);
        Map<String, ScalerState> scalers = upperCaseKeys(readJson(scalersPath, SCALERS_TYPE));
        Map<String, Integer> symbolIds = upperCaseKeys(readJson(idsPath, SYMBOL_IDS_TYPE));

        scalers.forEach((symbol, state) -> {
            if (state == null || !state.isFitted()) {
                throw new ArtifactCorruptException("General scaler for " + symbol + " is not fitted");
            }
            if (!state.hasIncreasingFeatureRange()) {
                throw new ArtifactCorruptException("General scaler for " + symbol + " has an empty feature range ["
                        + state.getFeatureMin() + ", " + state.getFeatureMax() + "]");
            }
        });
        if (model instanceof EmbeddedLinearWindowModel embedded) {
            int embeddingSize = embedded.getSymbolBias().length;
            symbolIds.forEach((symbol, id) -> {
                if (id == null || id < 0 || id >= embeddingSize) {
                    throw new ArtifactCorruptException("Symbol id " + id + " for " + symbol
                            + " outside general model embedding of size " + embeddingSize);
                }
            });
        }
        reportMappingGaps(scalers.keySet(), symbolIds.keySet());

        Path metadataPath = generalDirectory.resolve(ArtifactFiles.GENERAL_METADATA);
        ArtifactMetadata metadata = Files.isRegularFile(metadataPath) ? readMetadata(metadataPath).orElse(null) : null;

        log.info("General artifact loaded: {} symbols, window={}", symbolIds.size(), model.windowLength());
        return ArtifactHandle.general(model, scalers, symbolIds, metadata, modelPath, lastModified(modelPath));
    }

    @Override
    public boolean isGeneralPoolPresent() {
        return generalDirectory != null && Files.isDirectory(generalDirectory);
    }

    @Override
    public Optional<ArtifactMetadata> loadMetadata(SpecificArtifactLocation location) {
        Path path = location.getMetadataPath();
        if (path == null || !Files.isRegularFile(path)) {
            return Optional.empty();
        }
        return readMetadata(path);
    }

    private Optional<ArtifactMetadata> readMetadata(Path path) {
        try {
            return Optional.ofNullable(objectMapper.readValue(path.toFile(), ArtifactMetadata.class));
        } catch (IOException e) {
            log.warn("Failed to load metadata {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private <T> T readModel(Path path, Class<T> expected) {
        ModelDefinition definition = readJson(path, new TypeReference<ModelDefinition>() {
        });
        if (!expected.isInstance(definition)) {
            throw new ArtifactCorruptException("Model " + path + " is not a " + expected.getSimpleName());
        }
        try {
            definition.validate();
        } catch (IllegalStateException e) {
            throw new ArtifactCorruptException("Invalid model " + path + ": " + e.getMessage(), e);
        }
        return expected.cast(definition);
    }

    private ScalerState readScaler(Path path) {
        ScalerState state = readJson(path, new TypeReference<ScalerState>() {
        });
        if (!state.isFitted()) {
            throw new ArtifactCorruptException("Scaler " + path + " is not fitted");
        }
        if (!state.hasIncreasingFeatureRange()) {
            throw new ArtifactCorruptException("Scaler " + path + " has an empty feature range ["
                    + state.getFeatureMin() + ", " + state.getFeatureMax() + "]");
        }
        return state;
    }

    private <T> T readJson(Path path, TypeReference<T> type) {
        T value;
        try {
            value = objectMapper.readValue(path.toFile(), type);
        } catch (IOException | IllegalArgumentException e) {
            throw new ArtifactCorruptException("Cannot deserialize " + path + ": " + e.getMessage(), e);
        }
        if (value == null) {
            throw new ArtifactCorruptException("Empty artifact file " + path);
        }
        return value;
    }

    private Path requireFile(String what, Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ArtifactMissingException(what, path);
        }
        return path;
    }

    private long lastModified(Path path) {
        if (path == null || !Files.exists(path)) {
            return 0L;
        }
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            throw new ArtifactUnavailableException("Cannot stat " + path, e);
        }
    }

    private static <V> Map<String, V> upperCaseKeys(Map<String, V> source) {
        Map<String, V> normalized = new LinkedHashMap<>();
        source.forEach((key, value) -> normalized.put(key.trim().toUpperCase(Locale.ROOT), value));
        return normalized;
    }

    private static void reportMappingGaps(Set<String> scalerSymbols, Set<String> idSymbols) {
        Set<String> withoutId = new HashSet<>(scalerSymbols);
        withoutId.removeAll(idSymbols);
        Set<String> withoutScaler = new HashSet<>(idSymbols);
        withoutScaler.removeAll(scalerSymbols);
        if (!withoutId.isEmpty()) {
            log.warn("General scalers without a symbol id: {}", withoutId);
        }
        if (!withoutScaler.isEmpty()) {
            log.warn("General symbol ids without a scaler: {}", withoutScaler);
        }
    }
}
