package org.pixelmill.processing;

import org.pixelmill.config.AppConfig;
import org.pixelmill.imaging.ImagingLibrary;
import org.pixelmill.metrics.BatchSummary;
import org.pixelmill.util.ConcurrencyUtils;
import org.pixelmill.util.Utils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Processes the same input with one worker and with the default worker count, repeatedly, and reports the
 * wall-clock speedup. Each variant writes to its own sub-directory so their outputs can be compared byte for byte.
 */
public class ScalingComparison {

    private static final Logger LOGGER = Logger.getLogger(ScalingComparison.class.getName());

    private final AppConfig config;
    private final ImagingLibrary imaging;

    public ScalingComparison(final AppConfig config, final ImagingLibrary imaging) {
        this.config = Objects.requireNonNull(config).withDefaults();
        this.imaging = Objects.requireNonNull(imaging);
    }

    public record Comparison(List<BatchSummary> sequentialRuns, List<BatchSummary> parallelRuns, int parallelWorkers,
                             Duration averageSequential, Duration averageParallel, double speedup,
                             boolean outputsIdentical) {
    }

    public Comparison compare(final Path inputDir, final Path outputDir, final TransformConfig transform, final int repeat)
            throws IOException {
        if (repeat < 1) throw new IllegalArgumentException("repeat must be >= 1: " + repeat);
        final int imageCount = FileDiscovery.discover(inputDir, config.extensions()).size();
        final int parallelWorkers = config.concurrency() != null
                ? config.concurrency() : ConcurrencyUtils.defaultConcurrency(imageCount);

        final Path sequentialDir = outputDir.resolve("sequential");
        final Path parallelDir = outputDir.resolve("parallel");
        final List<BatchSummary> sequential = new ArrayList<>();
        final List<BatchSummary> parallel = new ArrayList<>();

        LOGGER.info("Starting performance comparison with %d repetitions...".formatted(repeat));
        for (int i = 0; i < repeat; i++) {
            LOGGER.info("Running test iteration %d/%d".formatted(i + 1, repeat));
            sequential.add(new BatchCoordinator(config.withConcurrency(1), imaging).run(inputDir, sequentialDir, transform));
            parallel.add(new BatchCoordinator(config.withConcurrency(parallelWorkers), imaging).run(inputDir, parallelDir, transform));
        }

        final Duration avgSequential = average(sequential);
        final Duration avgParallel = average(parallel);
        final double speedup = avgParallel.isZero() ? 0.0 : (double) avgSequential.toNanos() / avgParallel.toNanos();
        final boolean identical = sameContents(sequentialDir, parallelDir);

        LOGGER.info("Sequential: %s s, parallel (%d workers): %s s, speedup %.2fx, identical outputs: %s".formatted(
                Utils.formatSeconds(avgSequential), parallelWorkers, Utils.formatSeconds(avgParallel), speedup, identical));
        return new Comparison(List.copyOf(sequential), List.copyOf(parallel), parallelWorkers, avgSequential,
                avgParallel, speedup, identical);
    }

    private static Duration average(final List<BatchSummary> runs) {
        Duration total = Duration.ZERO;
        for (BatchSummary run : runs) total = total.plus(run.wallClock());
        return total.dividedBy(runs.size());
    }

    /**
     * True when both directories hold the same file names with byte-identical contents.
     */
    static boolean sameContents(final Path left, final Path right) throws IOException {
        final List<Path> leftFiles = listSorted(left);
        final List<Path> rightFiles = listSorted(right);
        if (leftFiles.size() != rightFiles.size()) return false;
        for (int i = 0; i < leftFiles.size(); i++) {
            final Path l = leftFiles.get(i), r = rightFiles.get(i);
            if (!l.getFileName().equals(r.getFileName()) || Files.mismatch(l, r) != -1) return false;
        }
        return true;
    }

    private static List<Path> listSorted(final Path dir) throws IOException {
        if (!Files.isDirectory(dir)) return List.of();
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.filter(Files::isRegularFile).sorted().toList();
        }
    }
}
