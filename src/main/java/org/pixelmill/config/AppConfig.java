package org.pixelmill.config;

import org.pixelmill.processing.TransformConfig;

import java.nio.file.Path;
import java.util.List;

/**
 * Root of the YAML configuration.
 *
 * @param concurrency          worker count; null means {@code min(cpuCount, itemCount)}
 * @param queueCapacity        items allowed to wait for a worker beyond the ones running
 * @param shutdownGraceSeconds how long in-flight items may run after a shutdown request
 * @param outputQuality        JPEG compression quality in [0, 1]
 */
public record AppConfig(Path inputDir, Path outputDir, String outputPrefix, List<String> extensions,
                        Integer concurrency, Integer queueCapacity, Long shutdownGraceSeconds, Float outputQuality,
                        Path reportFile, Path statusFile, TransformItem transform, StressItem stress) {

    public static final Path DEFAULT_INPUT_DIR = Path.of("data", "images");
    public static final Path DEFAULT_OUTPUT_DIR = Path.of("data", "output");
    public static final String DEFAULT_OUTPUT_PREFIX = "processed_";
    public static final List<String> DEFAULT_EXTENSIONS = List.of(".jpg", ".jpeg", ".png", ".bmp", ".gif");
    public static final int DEFAULT_QUEUE_CAPACITY = 64;
    public static final long DEFAULT_SHUTDOWN_GRACE_SECONDS = 60;
    public static final float DEFAULT_OUTPUT_QUALITY = 0.85f;

    public static AppConfig defaults() {
        return new AppConfig(null, null, null, null, null, null, null, null, null, null, null, null).withDefaults();
    }

    /**
     * Copy with every absent value replaced by its default. {@code concurrency}, {@code reportFile},
     * {@code statusFile} and the stress staging dir stay null when unset.
     */
    public AppConfig withDefaults() {
        return new AppConfig(
                inputDir != null ? inputDir : DEFAULT_INPUT_DIR,
                outputDir != null ? outputDir : DEFAULT_OUTPUT_DIR,
                outputPrefix != null ? outputPrefix : DEFAULT_OUTPUT_PREFIX,
                extensions != null && !extensions.isEmpty() ? List.copyOf(extensions) : DEFAULT_EXTENSIONS,
                concurrency,
                queueCapacity != null ? queueCapacity : DEFAULT_QUEUE_CAPACITY,
                shutdownGraceSeconds != null ? shutdownGraceSeconds : DEFAULT_SHUTDOWN_GRACE_SECONDS,
                outputQuality != null ? outputQuality : DEFAULT_OUTPUT_QUALITY,
                reportFile,
                statusFile,
                transform != null ? transform : new TransformItem(null, null, null, null, null, null, null, null),
                stress != null ? stress.withDefaults() : StressItem.defaults());
    }

    public TransformConfig transformConfig() {
        return (transform != null ? transform : new TransformItem(null, null, null, null, null, null, null, null))
                .toTransformConfig();
    }

    public AppConfig withInputDir(Path dir) {
        return new AppConfig(dir, outputDir, outputPrefix, extensions, concurrency, queueCapacity,
                shutdownGraceSeconds, outputQuality, reportFile, statusFile, transform, stress);
    }

    public AppConfig withOutputDir(Path dir) {
        return new AppConfig(inputDir, dir, outputPrefix, extensions, concurrency, queueCapacity,
                shutdownGraceSeconds, outputQuality, reportFile, statusFile, transform, stress);
    }

    public AppConfig withConcurrency(Integer workers) {
        return new AppConfig(inputDir, outputDir, outputPrefix, extensions, workers, queueCapacity,
                shutdownGraceSeconds, outputQuality, reportFile, statusFile, transform, stress);
    }

    public AppConfig withReportFile(Path file) {
        return new AppConfig(inputDir, outputDir, outputPrefix, extensions, concurrency, queueCapacity,
                shutdownGraceSeconds, outputQuality, file, statusFile, transform, stress);
    }

    public AppConfig withStatusFile(Path file) {
        return new AppConfig(inputDir, outputDir, outputPrefix, extensions, concurrency, queueCapacity,
                shutdownGraceSeconds, outputQuality, reportFile, file, transform, stress);
    }

    public AppConfig withStress(StressItem item) {
        return new AppConfig(inputDir, outputDir, outputPrefix, extensions, concurrency, queueCapacity,
                shutdownGraceSeconds, outputQuality, reportFile, statusFile, transform, item);
    }
}
