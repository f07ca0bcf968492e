package org.pixelmill.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pixelmill.processing.TransformConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigManagerTest {

    @TempDir
    Path tempDir;

    @Test
    void testLoad_missingFileGivesDefaults() throws IOException {
        AppConfig config = ConfigManager.load(tempDir.resolve("absent.yaml"));

        assertEquals(AppConfig.DEFAULT_INPUT_DIR, config.inputDir());
        assertEquals(AppConfig.DEFAULT_OUTPUT_DIR, config.outputDir());
        assertEquals("processed_", config.outputPrefix());
        assertEquals(List.of(".jpg", ".jpeg", ".png", ".bmp", ".gif"), config.extensions());
        assertNull(config.concurrency(), "Concurrency stays unset so the pool picks min(cpus, items).");
        assertEquals(0.85f, config.outputQuality().floatValue());
        assertEquals(TransformConfig.defaults(), config.transformConfig());
        assertEquals(StressItem.defaults(), config.stress());
    }

    @Test
    void testLoad_yamlOverridesAndIgnoresUnknownKeys() throws IOException {
        Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, """
                inputDir: in
                outputDir: out
                concurrency: 3
                someFutureSetting: true
                transform:
                  resizeWidth: 320
                  blurRadius: 0.5
                  iterations: 2
                stress:
                  imageCount: 50
                """);

        AppConfig config = ConfigManager.load(file);

        assertEquals(Path.of("in"), config.inputDir());
        assertEquals(Path.of("out"), config.outputDir());
        assertEquals(3, config.concurrency().intValue());
        assertEquals("processed_", config.outputPrefix(), "Unset values keep their defaults.");

        TransformConfig transform = config.transformConfig();
        assertEquals(320, transform.resizeWidth());
        assertEquals(TransformConfig.DEFAULT_HEIGHT, transform.resizeHeight());
        assertEquals(0.5, transform.blurRadius());
        assertEquals(2, transform.iterationCount());

        assertEquals(50, config.stress().imageCount().intValue());
        assertEquals(StressItem.DEFAULT_ITERATIONS, config.stress().iterations().intValue());
        assertEquals("stress_processed_", config.stress().outputPrefix());
    }

    @Test
    void testLoad_malformedYamlFails() throws IOException {
        Path file = tempDir.resolve("broken.yaml");
        Files.writeString(file, "concurrency: [not, a, number\n");

        assertThrows(IOException.class, () -> ConfigManager.load(file));
    }

    @Test
    void testWithers_keepOtherValues() {
        AppConfig config = AppConfig.defaults().withConcurrency(2).withReportFile(Path.of("r.json"));
        assertEquals(2, config.concurrency().intValue());
        assertEquals(Path.of("r.json"), config.reportFile());
        assertEquals(AppConfig.DEFAULT_INPUT_DIR, config.inputDir());
    }
}
