package com.stockforecast.backend.forecast.registry;

import com.stockforecast.backend.exception.ArtifactUnavailableException;
import com.stockforecast.backend.exception.ModelNotFoundException;
import com.stockforecast.backend.forecast.artifact.ArtifactHandle;
import com.stockforecast.backend.forecast.artifact.ArtifactKind;
import com.stockforecast.backend.forecast.artifact.ArtifactLoader;
import com.stockforecast.backend.forecast.artifact.ArtifactMetadata;
import com.stockforecast.backend.forecast.artifact.LinearWindowModel;
import com.stockforecast.backend.forecast.artifact.SpecificArtifactLocation;
import com.stockforecast.backend.service.MetricsService;
import com.stockforecast.backend.util.TestArtifacts;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Registry behaviour while {@link ModelRegistry#refresh()} swaps the index under concurrent readers.
 * Uses an in-memory loader so the artifact set can change between refreshes without touching disk.
 */
class ModelRegistryConcurrencyTest {

    private static final int ROUNDS = 500;

    private ScriptedLoader loader;
    private ModelRegistry registry;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        loader = new ScriptedLoader();
        registry = new ModelRegistry(loader, Path.of("models"), 2, new MetricsService(new SimpleMeterRegistry()));
        registry.initialize();
        executor = Executors.newFixedThreadPool(3);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void readersSeeOneConsistentIndexWhileArtifactsComeAndGo() throws Exception {
        Queue<Throwable> failures = new ConcurrentLinkedQueue<>();
        CountDownLatch start = new CountDownLatch(1);

        Future<?> refresher = executor.submit(() -> {
            await(start);
            for (int i = 0; i < ROUNDS; i++) {
                loader.present.set(!loader.present.get());
                registry.refresh();
            }
        });
        Future<?> infoReader = executor.submit(() -> {
            await(start);
            for (int i = 0; i < ROUNDS; i++) {
                try {
                    ModelInfo info = registry.modelInfo("SCOM");
                    if (info.isAvailable()) {
                        assertThat(info.getKind()).isEqualTo(ArtifactKind.SPECIFIC);
                        assertThat(info.getModelPath()).endsWith("SCOM_model.json");
                    }
                } catch (Throwable t) {
                    failures.add(t);
                }
            }
        });
        Future<?> predictor = executor.submit(() -> {
            await(start);
            for (int i = 0; i < ROUNDS; i++) {
                try {
                    assertThat(registry.loadModel("SCOM").getKind()).isEqualTo(ArtifactKind.SPECIFIC);
                } catch (ModelNotFoundException expected) {
                    // removed by the last refresh
                } catch (Throwable t) {
                    failures.add(t);
                }
            }
        });

        start.countDown();
        refresher.get(30, TimeUnit.SECONDS);
        infoReader.get(30, TimeUnit.SECONDS);
        predictor.get(30, TimeUnit.SECONDS);

        assertThat(failures).isEmpty();
    }

    @Test
    void loadThatFinishesAfterRefreshIsNotServedAsCurrent() throws Exception {
        loader.blockNextLoad();
        Future<RoutedArtifact> inFlight = executor.submit(() -> registry.loadModel("SCOM"));
        assertThat(loader.loadStarted.await(5, TimeUnit.SECONDS)).isTrue();

        loader.version.set(2);
        RefreshSummary summary = registry.refresh();
        loader.releaseLoad.countDown();

        assertThat(summary.getInvalidatedKeys()).isEmpty();
        assertThat(summary.getRefreshedAt()).isNotNull();
        assertThat(inFlight.get(5, TimeUnit.SECONDS).getHandle().getSourceVersion()).isEqualTo(1);

        RoutedArtifact reloaded = registry.loadModel("SCOM");
        assertThat(reloaded.isCacheHit()).isFalse();
        assertThat(reloaded.getHandle().getSourceVersion()).isEqualTo(2);
        assertThat(registry.loadModel("SCOM").isCacheHit()).isTrue();
        assertThat(loader.loads.get()).isEqualTo(2);
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    /** Serves one symbol, SCOM, whose presence and version the test flips between refreshes. */
    private static final class ScriptedLoader implements ArtifactLoader {

        final AtomicBoolean present = new AtomicBoolean(true);
        final AtomicLong version = new AtomicLong(1);
        final AtomicLong loads = new AtomicLong();
        final CountDownLatch loadStarted = new CountDownLatch(1);
        final CountDownLatch releaseLoad = new CountDownLatch(1);
        private final AtomicBoolean blockNext = new AtomicBoolean();

        void blockNextLoad() {
            blockNext.set(true);
        }

        @Override
        public Map<String, SpecificArtifactLocation> scan(Path directory) {
            if (!present.get()) {
                return Map.of();
            }
            return Map.of("SCOM", SpecificArtifactLocation.builder()
                    .symbol("SCOM")
                    .modelPath(directory.resolve("SCOM_model.json"))
                    .scalerPath(directory.resolve("SCOM_scaler.json"))
                    .version(version.get())
                    .build());
        }

        @Override
        public ArtifactHandle loadSpecific(SpecificArtifactLocation location) {
            loads.incrementAndGet();
            if (blockNext.compareAndSet(true, false)) {
                loadStarted.countDown();
                await(releaseLoad);
            }
            LinearWindowModel model = LinearWindowModel.builder()
                    .weights(TestArtifacts.lastValueWeights())
                    .bias(0.0)
                    .build();
            return ArtifactHandle.specific(model, TestArtifacts.identityScaler(10, 30), null,
                    location.getModelPath(), location.getVersion());
        }

        @Override
        public ArtifactHandle loadGeneral() {
            throw new ArtifactUnavailableException("No general pool");
        }

        @Override
        public boolean isGeneralPoolPresent() {
            return false;
        }

        @Override
        public Optional<ArtifactMetadata> loadMetadata(SpecificArtifactLocation location) {
            return Optional.empty();
        }
    }
}
