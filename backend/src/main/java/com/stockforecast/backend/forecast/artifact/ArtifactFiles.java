package com.stockforecast.backend.forecast.artifact;

import java.util.Locale;
import java.util.Optional;

/**
 * File naming convention of the artifact directories.
 */
public final class ArtifactFiles {

    public static final String SPECIFIC_MODEL_SUFFIX = "_best.json";
    public static final String SPECIFIC_SCALER_SUFFIX = "_log_scaler.json";
    public static final String SPECIFIC_METADATA_SUFFIX = "_metadata.json";

    public static final String GENERAL_MODEL = "general_best.json";
    public static final String GENERAL_SCALERS = "scalers.json";
    public static final String GENERAL_SYMBOL_IDS = "stock_id_mapping.json";
    public static final String GENERAL_METADATA = "metadata.json";

    private ArtifactFiles() {
    }

    public static String modelFile(String symbol) {
        return symbol + SPECIFIC_MODEL_SUFFIX;
    }

    public static String scalerFile(String symbol) {
        return symbol + SPECIFIC_SCALER_SUFFIX;
    }

    public static String metadataFile(String symbol) {
        return symbol + SPECIFIC_METADATA_SUFFIX;
    }

    /**
     * Symbol encoded in a specific model file name, e.g. {@code SCOM_best.json -> SCOM}.
     */
    public static Optional<String> symbolOf(String fileName) {
        if (fileName == null || !fileName.endsWith(SPECIFIC_MODEL_SUFFIX) || GENERAL_MODEL.equals(fileName)) {
            return Optional.empty();
        }
        String symbol = fileName.substring(0, fileName.length() - SPECIFIC_MODEL_SUFFIX.length()).trim();
        return symbol.isEmpty() ? Optional.empty() : Optional.of(symbol.toUpperCase(Locale.ROOT));
    }
}
