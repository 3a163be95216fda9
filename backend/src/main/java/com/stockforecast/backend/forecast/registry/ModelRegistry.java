package com.stockforecast.backend.forecast.registry;

import com.stockforecast.backend.exception.ArtifactCorruptException;
import com.stockforecast.backend.exception.ForecastException;
import com.stockforecast.backend.exception.ModelNotFoundException;
import com.stockforecast.backend.forecast.artifact.ArtifactHandle;
import com.stockforecast.backend.forecast.artifact.ArtifactKind;
import com.stockforecast.backend.forecast.artifact.ArtifactLoader;
import com.stockforecast.backend.forecast.artifact.ArtifactMetadata;
import com.stockforecast.backend.forecast.artifact.SpecificArtifactLocation;
import com.stockforecast.backend.forecast.cache.BoundedLruCache;
import com.stockforecast.backend.forecast.scaler.ScalerState;
import com.stockforecast.backend.service.MetricsService;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decides which artifact serves a symbol: the symbol's dedicated artifact when one exists
 * (loaded lazily into a bounded LRU cache), otherwise the always-resident general artifact.
 * <p>
 * One instance per process, created and torn down by the application context through
 * {@link #initialize()} and {@link #shutdown()}.
 */
@Slf4j
public class ModelRegistry {

    private final ArtifactLoader loader;
    private final Path specificDirectory;
    private final BoundedLruCache<String, ArtifactHandle> cache;
    private final MetricsService metricsService;
    private final Map<String, Object> loadLocks = new ConcurrentHashMap<>();

    private volatile RegistryIndex index = RegistryIndex.empty();

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final AtomicLong specificRequests = new AtomicLong();
    private final AtomicLong generalRequests = new AtomicLong();
    private final AtomicLong modelsLoaded = new AtomicLong();
    private final AtomicLong notFound = new AtomicLong();
    private final AtomicLong loadFailures = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public ModelRegistry(ArtifactLoader loader, Path specificDirectory, int cacheCapacity, MetricsService metricsService) {
        this.loader = loader;
        this.specificDirectory = specificDirectory;
        this.cache = new BoundedLruCache<>(cacheCapacity);
        this.metricsService = metricsService;
    }

    public void initialize() {
        RefreshSummary summary = refresh();
        log.info("Model registry initialized: specific={} general={} coverage={} cacheCapacity={}",
                summary.getSpecificModels(), summary.getGeneralModelSymbols(), summary.getTotalCoverage(), cache.capacity());
    }

    public void shutdown() {
        cache.clear();
        loadLocks.clear();
        index = RegistryIndex.empty();
        log.info("Model registry shut down");
    }

    public RoutedArtifact loadModel(String rawSymbol) {
        String symbol = normalizeSymbol(rawSymbol);
        totalRequests.incrementAndGet();
        RegistryIndex current = index;

        ForecastException specificFailure = null;
        SpecificArtifactLocation location = current.getSpecific().get(symbol);
        if (location != null) {
            try {
                return routeSpecific(symbol, location);
            } catch (ForecastException e) {
                loadFailures.incrementAndGet();
                log.error("Failed to load specific artifact for {} ({}): {}", symbol, e.getErrorKind(), e.getMessage());
                specificFailure = e;
            }
        }

        if (current.hasGeneral(symbol)) {
            return routeGeneral(symbol, current);
        }

        notFound.incrementAndGet();
        if (specificFailure != null) {
            throw new ModelNotFoundException(symbol, current.allSymbols(),
                    "Artifact for '" + symbol + "' could not be loaded and no general fallback covers it", specificFailure);
        }
        throw new ModelNotFoundException(symbol, current.allSymbols());
    }

    private RoutedArtifact routeSpecific(String symbol, SpecificArtifactLocation location) {
        specificRequests.incrementAndGet();
        String key = ArtifactKind.SPECIFIC.cacheKey(symbol);

        Optional<ArtifactHandle> cached = currentEntry(key, location);
        if (cached.isPresent()) {
            cacheHits.incrementAndGet();
            log.debug("Cache hit for {} (specific)", symbol);
            return specificRoute(symbol, cached.get(), true);
        }

        // concurrent misses on one key wait for a single load
        synchronized (loadLocks.computeIfAbsent(key, k -> new Object())) {
            cached = currentEntry(key, location);
            if (cached.isPresent()) {
                cacheHits.incrementAndGet();
                return specificRoute(symbol, cached.get(), true);
            }
            cacheMisses.incrementAndGet();
            log.info("Cache miss for {} - loading specific artifact", symbol);
            ArtifactHandle handle = loader.loadSpecific(location);
            modelsLoaded.incrementAndGet();
            metricsService.recordArtifactLoad(ArtifactKind.SPECIFIC);
            cache.put(key, handle).ifPresent(evicted -> {
                evictions.incrementAndGet();
                metricsService.recordEviction();
                log.info("Evicted artifact from cache: {}", evicted);
            });
            log.info("Loaded specific artifact for {} (cache: {}/{})", symbol, cache.size(), cache.capacity());
            return specificRoute(symbol, handle, false);
        }
    }

    /**
     * Cached handle for {@code key} when it was loaded from the files {@code location} describes.
     * A handle built from an older version (a load that finished after a refresh) is a miss.
     */
    private Optional<ArtifactHandle> currentEntry(String key, SpecificArtifactLocation location) {
        Optional<ArtifactHandle> cached = cache.get(key);
        if (cached.isPresent() && cached.get().getSourceVersion() != location.getVersion()) {
            log.info("Cached artifact {} is outdated (version {} vs {}), reloading",
                    key, cached.get().getSourceVersion(), location.getVersion());
            return Optional.empty();
        }
        return cached;
    }

    private RoutedArtifact specificRoute(String symbol, ArtifactHandle handle, boolean cacheHit) {
        return RoutedArtifact.builder()
                .symbol(symbol)
                .kind(ArtifactKind.SPECIFIC)
                .handle(handle)
                .scaler(handle.getScaler())
                .cacheHit(cacheHit)
                .build();
    }

    private RoutedArtifact routeGeneral(String symbol, RegistryIndex current) {
        generalRequests.incrementAndGet();
        ArtifactHandle general = current.getGeneral();
        ScalerState scaler;
        Integer symbolId;
        try {
            scaler = general.scalerFor(symbol);
            symbolId = general.symbolIdFor(symbol);
        } catch (ArtifactCorruptException e) {
            loadFailures.incrementAndGet();
            notFound.incrementAndGet();
            log.error("General artifact cannot serve {}: {}", symbol, e.getMessage());
            throw new ModelNotFoundException(symbol, current.allSymbols(),
                    "General artifact cannot serve '" + symbol + "'", e);
        }
        log.debug("Using general artifact for {} (id={})", symbol, symbolId);
        return RoutedArtifact.builder()
                .symbol(symbol)
                .kind(ArtifactKind.GENERAL)
                .handle(general)
                .scaler(scaler)
                .symbolId(symbolId)
                .cacheHit(false)
                .build();
    }

    public Optional<ArtifactKind> getModelType(String rawSymbol) {
        return kindOf(index, normalizeSymbol(rawSymbol));
    }

    public List<String> availableSymbols() {
        return index.specificSymbols();
    }

    public List<String> allAvailableSymbols() {
        return index.allSymbols();
    }

    public List<String> generalSymbols() {
        return List.copyOf(index.getGeneralSymbols());
    }

    /** Symbols whose specific artifact is resident, least recently used first. */
    public List<String> cachedSymbols() {
        String prefix = ArtifactKind.SPECIFIC.cacheKey("");
        return cache.keys().stream()
                .map(key -> key.startsWith(prefix) ? key.substring(prefix.length()) : key)
                .toList();
    }

    public boolean isCached(String rawSymbol) {
        return cache.containsKey(ArtifactKind.SPECIFIC.cacheKey(normalizeSymbol(rawSymbol)));
    }

    public Optional<ArtifactMetadata> metadata(String rawSymbol) {
        return metadataOf(index, normalizeSymbol(rawSymbol));
    }

    public ModelInfo modelInfo(String rawSymbol) {
        String symbol = normalizeSymbol(rawSymbol);
        RegistryIndex current = index;
        Optional<ArtifactKind> kind = kindOf(current, symbol);
        if (kind.isEmpty()) {
            return ModelInfo.builder().symbol(symbol).available(false).build();
        }
        ArtifactMetadata metadata = metadataOf(current, symbol).orElse(null);
        String modelPath = kind.get() == ArtifactKind.SPECIFIC
                ? String.valueOf(current.getSpecific().get(symbol).getModelPath())
                : String.valueOf(current.getGeneral().getSource());
        return ModelInfo.builder()
                .symbol(symbol)
                .available(true)
                .kind(kind.get())
                .cached(kind.get() == ArtifactKind.SPECIFIC && isCached(symbol))
                .trainingDate(metadata != null ? metadata.getTrainingDate() : null)
                .testMape(metadata != null ? metadata.getTestMape() : null)
                .modelPath(modelPath)
                .metadata(metadata)
                .build();
    }

    private static Optional<ArtifactKind> kindOf(RegistryIndex current, String symbol) {
        if (current.hasSpecific(symbol)) {
            return Optional.of(ArtifactKind.SPECIFIC);
        }
        if (current.hasGeneral(symbol)) {
            return Optional.of(ArtifactKind.GENERAL);
        }
        return Optional.empty();
    }

    private static Optional<ArtifactMetadata> metadataOf(RegistryIndex current, String symbol) {
        if (current.hasSpecific(symbol)) {
            return Optional.ofNullable(current.getSpecificMetadata().get(symbol));
        }
        if (current.hasGeneral(symbol)) {
            return Optional.ofNullable(current.getGeneral().getMetadata());
        }
        return Optional.empty();
    }

    public Map<String, SectorCoverage> modelsBySector(Map<String, List<String>> sectorSymbols) {
        List<String> available = allAvailableSymbols();
        Map<String, SectorCoverage> result = new LinkedHashMap<>();
        sectorSymbols.forEach((sector, symbols) -> {
            List<String> normalized = symbols.stream().map(ModelRegistry::normalizeSymbol).toList();
            List<String> covered = normalized.stream().filter(available::contains).toList();
            List<String> missing = normalized.stream().filter(symbol -> !available.contains(symbol)).toList();
            result.put(sector, SectorCoverage.builder()
                    .totalStocks(normalized.size())
                    .trainedModels(covered.size())
                    .availableStocks(covered)
                    .missingStocks(missing)
                    .build());
        });
        return result;
    }

    public RegistryStats stats() {
        RegistryIndex current = index;
        long total = totalRequests.get();
        long hits = cacheHits.get();
        return RegistryStats.builder()
                .totalRequests(total)
                .cacheHits(hits)
                .cacheMisses(cacheMisses.get())
                .specificRequests(specificRequests.get())
                .generalRequests(generalRequests.get())
                .modelsLoaded(modelsLoaded.get())
                .notFound(notFound.get())
                .loadFailures(loadFailures.get())
                .evictions(evictions.get())
                .hitRate((double) hits / Math.max(1L, total))
                .cacheSize(cache.size())
                .cacheCapacity(cache.capacity())
                .specificModels(current.getSpecific().size())
                .generalModelSymbols(current.getGeneralSymbols().size())
                .totalCoverage(current.allSymbols().size())
                .generalModelLoaded(current.getGeneral() != null)
                .build();
    }

    /**
     * Drops every cached specific artifact and resets the counters. The index and the general
     * artifact are untouched.
     */
    public void clearCache() {
        cache.clear();
        for (AtomicLong counter : List.of(totalRequests, cacheHits, cacheMisses, specificRequests, generalRequests,
                modelsLoaded, notFound, loadFailures, evictions)) {
            counter.set(0L);
        }
        log.info("Model cache cleared");
    }

    /**
     * Rescans the specific directory, reloads the general artifact when its directory is present,
     * swaps in the new index and drops cached artifacts whose files changed or disappeared.
     * A failed general reload keeps the previously loaded general artifact.
     */
    public synchronized RefreshSummary refresh() {
        RegistryIndex previous = index;
        Map<String, SpecificArtifactLocation> specific = loader.scan(specificDirectory);
        Map<String, ArtifactMetadata> metadata = new HashMap<>();
        specific.values().forEach(location -> loader.loadMetadata(location)
                .ifPresent(value -> metadata.put(location.getSymbol(), value)));

        ArtifactHandle general = previous.getGeneral();
        boolean generalReloaded = false;
        String generalError = null;
        if (loader.isGeneralPoolPresent()) {
            try {
                general = loader.loadGeneral();
                generalReloaded = true;
                metricsService.recordArtifactLoad(ArtifactKind.GENERAL);
            } catch (ForecastException e) {
                loadFailures.incrementAndGet();
                generalError = e.getMessage();
                log.error("Failed to load general artifact ({}): {}", e.getErrorKind(), e.getMessage());
            }
        }

        RegistryIndex next = new RegistryIndex(specific, metadata, general);
        index = next;
        List<String> invalidated = invalidateStale(next);

        log.info("Registry refreshed: {} specific, {} general, {} total symbols available",
                next.getSpecific().size(), next.getGeneralSymbols().size(), next.allSymbols().size());
        return RefreshSummary.builder()
                .specificModels(next.getSpecific().size())
                .generalModelSymbols(next.getGeneralSymbols().size())
                .totalCoverage(next.allSymbols().size())
                .generalReloaded(generalReloaded)
                .generalError(generalError)
                .invalidatedKeys(invalidated)
                .specificSymbols(next.specificSymbols())
                .refreshedAt(next.getBuiltAt())
                .build();
    }

    private List<String> invalidateStale(RegistryIndex next) {
        String prefix = ArtifactKind.SPECIFIC.cacheKey("");
        List<String> invalidated = new ArrayList<>();
        cache.snapshot().forEach((key, handle) -> {
            SpecificArtifactLocation location = next.getSpecific().get(key.substring(prefix.length()));
            if (location == null || location.getVersion() != handle.getSourceVersion()) {
                cache.remove(key);
                invalidated.add(key);
            }
        });
        if (!invalidated.isEmpty()) {
            log.info("Invalidated stale cached artifacts: {}", invalidated);
        }
        return invalidated;
    }

    public static String normalizeSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol is required");
        }
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
