package com.stockforecast.backend.forecast.artifact;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stockforecast.backend.exception.ArtifactCorruptException;
import com.stockforecast.backend.exception.ArtifactMissingException;
import com.stockforecast.backend.exception.ArtifactUnavailableException;
import com.stockforecast.backend.forecast.scaler.ScalerKind;
import com.stockforecast.backend.forecast.scaler.ScalerState;
import com.stockforecast.backend.util.TestArtifacts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FileSystemArtifactLoaderTest {

    @TempDir
    Path root;

    private Path specificDir;
    private Path generalDir;
    private FileSystemArtifactLoader loader;

    @BeforeEach
    void setUp() {
        specificDir = root.resolve("specific");
        generalDir = root.resolve("general");
        loader = new FileSystemArtifactLoader(new ObjectMapper(), generalDir);
    }

    @Test
    void scanIndexesModelFilesByUpperCaseSymbol() {
        TestArtifacts.writeSpecific(specificDir, "scom", 0.0, TestArtifacts.logScaler(10, 30));
        TestArtifacts.writeSpecific(specificDir, "EQTY", 0.0, TestArtifacts.logScaler(30, 60));
        TestArtifacts.writeRaw(specificDir.resolve("README.txt"), "not an artifact");

        Map<String, SpecificArtifactLocation> locations = loader.scan(specificDir);

        assertThat(locations).containsOnlyKeys("EQTY", "SCOM");
        SpecificArtifactLocation scom = locations.get("SCOM");
        assertThat(scom.getModelPath().getFileName().toString()).isEqualTo("scom_best.json");
        assertThat(scom.getScalerPath().getFileName().toString()).isEqualTo("scom_log_scaler.json");
        assertThat(scom.getVersion()).isPositive();
    }

    @Test
    void scanOfMissingDirectoryIsEmpty() {
        assertThat(loader.scan(root.resolve("nowhere"))).isEmpty();
    }

    @Test
    void loadsSpecificArtifactWithMetadata() {
        TestArtifacts.writeSpecific(specificDir, "SCOM", 0.0, TestArtifacts.logScaler(10, 30));
        TestArtifacts.writeSpecificMetadata(specificDir, "SCOM", Map.of(
                "training_date", "2024-03-01",
                "test_mape", 2.75,
                "epochs", 40));
        SpecificArtifactLocation location = loader.scan(specificDir).get("SCOM");

        ArtifactHandle handle = loader.loadSpecific(location);

        assertThat(handle.getKind()).isEqualTo(ArtifactKind.SPECIFIC);
        assertThat(handle.windowLength()).isEqualTo(TestArtifacts.WINDOW);
        assertThat(handle.getScaler().getKind()).isEqualTo(ScalerKind.LOG_RANGE);
        assertThat(handle.getSourceVersion()).isEqualTo(location.getVersion());
        assertThat(handle.getMetadata().getTrainingDate()).isEqualTo("2024-03-01");
        assertThat(handle.getMetadata().getTestMape()).isEqualTo(2.75);
        assertThat(handle.getMetadata().getAttributes()).containsEntry("epochs", 40);
    }

    @Test
    void missingScalerIsReported() {
        TestArtifacts.writeSpecificModel(specificDir, "SCOM", TestArtifacts.lastValueWeights(), 0.0);
        SpecificArtifactLocation location = loader.scan(specificDir).get("SCOM");

        assertThatThrownBy(() -> loader.loadSpecific(location))
                .isInstanceOf(ArtifactMissingException.class)
                .hasMessageContaining("SCOM_log_scaler.json");
    }

    @Test
    void unreadableModelIsCorrupt() {
        TestArtifacts.writeSpecific(specificDir, "SCOM", 0.0, TestArtifacts.logScaler(10, 30));
        TestArtifacts.writeRaw(specificDir.resolve("SCOM_best.json"), "{\"type\": \"linear-window\", \"weights\": [");
        SpecificArtifactLocation location = loader.scan(specificDir).get("SCOM");

        assertThatThrownBy(() -> loader.loadSpecific(location))
                .isInstanceOf(ArtifactCorruptException.class);
    }

    @Test
    void generalModelInSpecificSlotIsCorrupt() {
        TestArtifacts.writeRaw(specificDir.resolve("SCOM_best.json"), "{\"type\": \"embedded-linear-window\", "
                + "\"weights\": [1.0], \"bias\": 0.0, \"symbolBias\": [0.0]}");
        TestArtifacts.write(specificDir.resolve("SCOM_log_scaler.json"), TestArtifacts.logScaler(10, 30));
        SpecificArtifactLocation location = loader.scan(specificDir).get("SCOM");

        assertThatThrownBy(() -> loader.loadSpecific(location))
                .isInstanceOf(ArtifactCorruptException.class)
                .hasMessageContaining("ForecastModel");
    }

    @Test
    void unfittedScalerIsCorrupt() {
        TestArtifacts.writeSpecific(specificDir, "SCOM", 0.0, ScalerState.unfitted(ScalerKind.LOG_RANGE));
        SpecificArtifactLocation location = loader.scan(specificDir).get("SCOM");

        assertThatThrownBy(() -> loader.loadSpecific(location))
                .isInstanceOf(ArtifactCorruptException.class)
                .hasMessageContaining("not fitted");
    }

    @Test
    void scalerWithEmptyFeatureRangeIsCorrupt() {
        ScalerState collapsed = ScalerState.builder()
                .kind(ScalerKind.IDENTITY_RANGE).dataMin(10.0).dataMax(30.0)
                .featureMin(1.0).featureMax(1.0)
                .build();
        TestArtifacts.writeSpecific(specificDir, "SCOM", 0.0, collapsed);
        SpecificArtifactLocation location = loader.scan(specificDir).get("SCOM");

        assertThatThrownBy(() -> loader.loadSpecific(location))
                .isInstanceOf(ArtifactCorruptException.class)
                .hasMessageContaining("empty feature range");
    }

    @Test
    void loadsGeneralArtifact() {
        TestArtifacts.writeGeneral(generalDir, new double[]{0.0, 0.25},
                Map.of("kcb", TestArtifacts.identityScaler(10, 20), "SCOM", TestArtifacts.identityScaler(10, 30)),
                Map.of("KCB", 1, "scom", 0));

        ArtifactHandle handle = loader.loadGeneral();

        assertThat(handle.getKind()).isEqualTo(ArtifactKind.GENERAL);
        assertThat(handle.generalSymbols()).containsExactly("KCB", "SCOM");
        assertThat(handle.symbolIdFor("KCB")).isEqualTo(1);
        double[] window = new double[TestArtifacts.WINDOW];
        window[TestArtifacts.WINDOW - 1] = 0.5;
        assertThat(handle.predict(1, window)).isCloseTo(0.75, within(1e-12));
        assertThat(handle.getMetadata()).isNull();
    }

    @Test
    void generalPoolAbsentIsUnavailable() {
        assertThat(loader.isGeneralPoolPresent()).isFalse();
        assertThatThrownBy(() -> loader.loadGeneral())
                .isInstanceOf(ArtifactUnavailableException.class);
    }

    @Test
    void generalWithoutIdMappingIsMissing() throws IOException {
        TestArtifacts.writeGeneral(generalDir, new double[]{0.0}, Map.of("KCB", TestArtifacts.identityScaler(1, 2)), Map.of("KCB", 0));
        Files.delete(generalDir.resolve(ArtifactFiles.GENERAL_SYMBOL_IDS));

        assertThatThrownBy(() -> loader.loadGeneral())
                .isInstanceOf(ArtifactMissingException.class)
                .hasMessageContaining(ArtifactFiles.GENERAL_SYMBOL_IDS);
    }

    @Test
    void symbolIdOutsideEmbeddingIsCorrupt() {
        TestArtifacts.writeGeneral(generalDir, new double[]{0.0, 0.0},
                Map.of("KCB", TestArtifacts.identityScaler(1, 2)), Map.of("KCB", 2));

        assertThatThrownBy(() -> loader.loadGeneral())
                .isInstanceOf(ArtifactCorruptException.class)
                .hasMessageContaining("KCB");
    }

    @Test
    void generalScalerWithInvertedFeatureRangeIsCorrupt() {
        ScalerState inverted = ScalerState.builder()
                .kind(ScalerKind.IDENTITY_RANGE).dataMin(1.0).dataMax(2.0)
                .featureMin(1.0).featureMax(0.0)
                .build();
        TestArtifacts.writeGeneral(generalDir, new double[]{0.0},
                Map.of("KCB", inverted), Map.of("KCB", 0));

        assertThatThrownBy(() -> loader.loadGeneral())
                .isInstanceOf(ArtifactCorruptException.class)
                .hasMessageContaining("KCB")
                .hasMessageContaining("empty feature range");
    }
}
