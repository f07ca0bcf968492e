package org.pixelmill.config;

import java.nio.file.Path;

/**
 * Stress-mode section of the YAML configuration.
 *
 * @param imageCount            number of work items to amplify the discovered images to
 * @param iterations            chain passes per image
 * @param materializeDuplicates copy duplicated sources into {@code stagingDir} instead of reusing the same file
 */
public record StressItem(Boolean enabled, Integer imageCount, Integer iterations, Double blurRadius,
                         Boolean materializeDuplicates, Path stagingDir, String outputPrefix) {

    public static final int DEFAULT_IMAGE_COUNT = 20;
    public static final int DEFAULT_ITERATIONS = 3;
    public static final double DEFAULT_BLUR_RADIUS = 5.0;
    public static final String DEFAULT_OUTPUT_PREFIX = "stress_processed_";

    public static StressItem defaults() {
        return new StressItem(false, DEFAULT_IMAGE_COUNT, DEFAULT_ITERATIONS, DEFAULT_BLUR_RADIUS, false, null,
                DEFAULT_OUTPUT_PREFIX);
    }

    StressItem withDefaults() {
        StressItem d = defaults();
        return new StressItem(
                enabled != null ? enabled : d.enabled(),
                imageCount != null ? imageCount : d.imageCount(),
                iterations != null ? iterations : d.iterations(),
                blurRadius != null ? blurRadius : d.blurRadius(),
                materializeDuplicates != null ? materializeDuplicates : d.materializeDuplicates(),
                stagingDir,
                outputPrefix != null ? outputPrefix : d.outputPrefix());
    }

    public StressItem withEnabled(boolean on) {
        return new StressItem(on, imageCount, iterations, blurRadius, materializeDuplicates, stagingDir, outputPrefix);
    }

    public StressItem withImageCount(int count) {
        return new StressItem(enabled, count, iterations, blurRadius, materializeDuplicates, stagingDir, outputPrefix);
    }

    public StressItem withIterations(int n) {
        return new StressItem(enabled, imageCount, n, blurRadius, materializeDuplicates, stagingDir, outputPrefix);
    }

    public StressItem withBlurRadius(double radius) {
        return new StressItem(enabled, imageCount, iterations, radius, materializeDuplicates, stagingDir, outputPrefix);
    }
}
